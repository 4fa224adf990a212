package net.bookharvest.application.backfill;

import com.fasterxml.jackson.annotation.JsonProperty;
import net.bookharvest.support.lock.MonthLockKey;

/**
 * Operator request to start a batch of months. Missing fields take their defaults in
 * {@link #normalized()}.
 */
public record BackfillScheduleRequest(@JsonProperty("batch_size") Integer batchSize,
                                      @JsonProperty("dry_run") Boolean dryRun,
                                      @JsonProperty("force_retry") Boolean forceRetry,
                                      @JsonProperty("year_range") YearRange yearRange) {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int MAX_BATCH_SIZE = 50;
    public static final int MIN_YEAR = MonthLockKey.MIN_YEAR;
    public static final int MAX_YEAR = MonthLockKey.MAX_YEAR;
    public static final int DEFAULT_START_YEAR = 2000;
    public static final int DEFAULT_END_YEAR = 2024;

    public static BackfillScheduleRequest defaults() {
        return new BackfillScheduleRequest(null, null, null, null).normalized();
    }

    /**
     * Applies defaults and validates ranges.
     *
     * @throws IllegalArgumentException when a value is out of range
     */
    public BackfillScheduleRequest normalized() {
        int size = batchSize == null ? DEFAULT_BATCH_SIZE : batchSize;
        if (size < 1 || size > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("batch_size must be between 1 and " + MAX_BATCH_SIZE + ": " + size);
        }
        YearRange range = yearRange == null ? new YearRange(DEFAULT_START_YEAR, DEFAULT_END_YEAR) : yearRange;
        Integer start = range.start() == null ? Integer.valueOf(DEFAULT_START_YEAR) : range.start();
        Integer end = range.end() == null ? Integer.valueOf(DEFAULT_END_YEAR) : range.end();
        if (start < MIN_YEAR || end > MAX_YEAR || start > end) {
            throw new IllegalArgumentException(
                "year_range must satisfy " + MIN_YEAR + " <= start <= end <= " + MAX_YEAR + ": " + start + ".." + end);
        }
        return new BackfillScheduleRequest(size, Boolean.TRUE.equals(dryRun), Boolean.TRUE.equals(forceRetry),
            new YearRange(start, end));
    }

    public record YearRange(@JsonProperty("start") Integer start, @JsonProperty("end") Integer end) {
    }
}
