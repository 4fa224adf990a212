package net.bookharvest.support.lock;

/**
 * Signals that the lock infrastructure itself failed (no connection, SQL error), as opposed to
 * contention, which is reported as a {@code false} acquisition.
 */
public class AdvisoryLockAcquisitionException extends IllegalStateException {

    private final long lockKey;

    public AdvisoryLockAcquisitionException(long lockKey, String message, Throwable cause) {
        super(message + " (lockKey=" + lockKey + ")", cause);
        this.lockKey = lockKey;
    }

    public long getLockKey() {
        return lockKey;
    }
}
