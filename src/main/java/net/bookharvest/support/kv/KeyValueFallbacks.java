package net.bookharvest.support.kv;

import org.slf4j.Logger;

import java.util.function.Supplier;

/**
 * Centralized handling for store calls whose failure has a well-defined fallback value.
 *
 * <p>Only {@link KeyValueStoreException} is absorbed. Programming errors still propagate.</p>
 */
public final class KeyValueFallbacks {

    private KeyValueFallbacks() {
    }

    /**
     * Executes a store operation, returning {@code fallback} when the store is unavailable.
     *
     * @param log       logger of the calling component
     * @param call      supplier performing the store call
     * @param operation description of the operation for logging
     * @param fallback  value to return on store failure
     * @param <T>       return type
     * @return result of {@code call.get()}, or {@code fallback}
     */
    public static <T> T execute(Logger log, Supplier<T> call, String operation, T fallback) {
        try {
            return call.get();
        } catch (KeyValueStoreException e) {
            log.warn("Key-value {} failed, using fallback: {}", operation, e.getMessage());
            return fallback;
        }
    }

    /**
     * Executes a store write whose failure is tolerated.
     *
     * @return {@code true} when the write reached the store
     */
    public static boolean run(Logger log, Runnable call, String operation) {
        try {
            call.run();
            return true;
        } catch (KeyValueStoreException e) {
            log.warn("Key-value {} failed and was skipped: {}", operation, e.getMessage());
            return false;
        }
    }
}
