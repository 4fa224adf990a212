package net.bookharvest.support.kv;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Shared key-value store used for every piece of cross-instance state: quota counters,
 * rate-limit timestamps, job status documents, response cache entries and work queues.
 *
 * <p>Implementations throw {@link KeyValueStoreException} when the store is unreachable.
 * Callers choose their own failure policy (the quota path denies, the rate limiter proceeds).</p>
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void set(String key, String value, Duration ttl);

    /**
     * Atomically adds {@code delta} to the integer stored at {@code key} and returns the new value.
     * A missing key counts as zero.
     */
    long incrementBy(String key, long delta);

    boolean delete(String key);

    /**
     * Sets a time to live on an existing key without changing its value.
     *
     * @return {@code false} when the key does not exist
     */
    boolean expire(String key, Duration ttl);

    /**
     * Appends values to the tail of the list at {@code key}.
     *
     * @return length of the list after the push
     */
    long pushTail(String key, List<String> values);

    /**
     * Removes and returns up to {@code count} values from the head of the list at {@code key}.
     */
    List<String> popHead(String key, int count);

    long listLength(String key);
}
