package net.bookharvest.support.lock;

/**
 * Advisory lock key for one backfill month: {@code year * 100 + month}. The year bounds match the
 * {@code backfill_log.year} check constraint and are shared with request validation.
 */
public final class MonthLockKey {

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2100;

    private MonthLockKey() {
    }

    /**
     * @throws IllegalArgumentException when year is outside 1900..2100 or month outside 1..12
     */
    public static long of(int year, int month) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("year must be between " + MIN_YEAR + " and " + MAX_YEAR + ": " + year);
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12: " + month);
        }
        return (long) year * 100 + month;
    }
}
