package net.bookharvest.application.backfill;

/**
 * A month job could not produce a usable result, for example when no generator is registered.
 */
public class BackfillJobException extends RuntimeException {

    public BackfillJobException(String message) {
        super(message);
    }
}
