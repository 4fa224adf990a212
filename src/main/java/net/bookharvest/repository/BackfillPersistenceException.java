package net.bookharvest.repository;

/**
 * Raised when a backfill write or read fails at the database. The job processor treats it as a
 * retryable failure of the month.
 */
public class BackfillPersistenceException extends RuntimeException {

    public BackfillPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
