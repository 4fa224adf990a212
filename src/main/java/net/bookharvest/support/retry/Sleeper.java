package net.bookharvest.support.retry;

import java.time.Duration;

/**
 * Blocking pause used by polling loops. Swappable so tests can observe waits instead of taking them.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps on the calling thread. An interrupt restores the flag and surfaces as
     * {@link IllegalStateException}.
     */
    Sleeper THREAD = duration -> {
        try {
            Thread.sleep(Math.max(0L, duration.toMillis()));
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting " + duration.toMillis() + "ms", interruptedException);
        }
    };

    void sleep(Duration duration);
}
