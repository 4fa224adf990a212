package net.bookharvest.support.queue;

/**
 * A message could not be serialized or written to its queue.
 */
public class QueuePublishException extends RuntimeException {

    public QueuePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
