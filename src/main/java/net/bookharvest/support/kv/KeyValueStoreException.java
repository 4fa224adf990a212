package net.bookharvest.support.kv;

/**
 * Raised when the shared key-value store cannot be reached or rejects a command.
 */
public class KeyValueStoreException extends RuntimeException {

    private final String operation;

    public KeyValueStoreException(String operation, Throwable cause) {
        super("Key-value operation '" + operation + "' failed: "
            + (cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown error"), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
