package net.bookharvest.service;

import lombok.extern.slf4j.Slf4j;
import net.bookharvest.support.kv.KeyValueStore;
import net.bookharvest.support.kv.KeyValueStoreException;
import net.bookharvest.support.retry.Sleeper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Enforces a minimum spacing between calls to one upstream provider across every running instance.
 *
 * <p>The last-call timestamp lives in the shared store under {@code rate_limit:<provider>} with a
 * short TTL. The read-modify-write is not atomic: two instances can occasionally both see an old
 * timestamp and call slightly early. Politeness here is best-effort, so a store failure lets the call
 * proceed without waiting.</p>
 */
@Service
@Slf4j
public class DistributedRateLimiter {

    static final String KEY_PREFIX = "rate_limit:";
    static final Duration TIMESTAMP_TTL = Duration.ofSeconds(60);

    private final KeyValueStore store;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public DistributedRateLimiter(KeyValueStore store, Clock clock) {
        this(store, clock, Sleeper.THREAD);
    }

    DistributedRateLimiter(KeyValueStore store, Clock clock, Sleeper sleeper) {
        this.store = store;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until at least {@code minSpacing} has passed since the last recorded call to
     * {@code provider}, then records the current call.
     *
     * @return how long the caller waited
     */
    public Duration acquire(String provider, Duration minSpacing) {
        if (minSpacing == null || minSpacing.isZero() || minSpacing.isNegative()) {
            return Duration.ZERO;
        }
        String key = KEY_PREFIX + provider;
        Duration waited = Duration.ZERO;
        try {
            Duration remaining = remainingDelay(key, minSpacing);
            if (!remaining.isZero()) {
                log.debug("[RATE-LIMIT] Waiting {}ms before calling {}", remaining.toMillis(), provider);
                sleeper.sleep(remaining);
                waited = remaining;
            }
            store.set(key, Long.toString(clock.millis()), TIMESTAMP_TTL);
        } catch (KeyValueStoreException e) {
            log.warn("[RATE-LIMIT] Store unavailable for {}; proceeding without delay: {}", provider, e.getMessage());
        }
        return waited;
    }

    /**
     * Reports the delay a call to {@code provider} would wait right now, without recording anything.
     * Returns zero when the store is unavailable.
     */
    public Duration peekDelay(String provider, Duration minSpacing) {
        if (minSpacing == null || minSpacing.isZero() || minSpacing.isNegative()) {
            return Duration.ZERO;
        }
        try {
            return remainingDelay(KEY_PREFIX + provider, minSpacing);
        } catch (KeyValueStoreException e) {
            log.warn("[RATE-LIMIT] Store unavailable while checking {}: {}", provider, e.getMessage());
            return Duration.ZERO;
        }
    }

    private Duration remainingDelay(String key, Duration minSpacing) {
        Optional<Long> lastCall = store.get(key).flatMap(DistributedRateLimiter::parseMillis);
        if (lastCall.isEmpty()) {
            return Duration.ZERO;
        }
        long elapsed = clock.millis() - lastCall.get();
        long remaining = minSpacing.toMillis() - elapsed;
        return remaining > 0 ? Duration.ofMillis(remaining) : Duration.ZERO;
    }

    private static Optional<Long> parseMillis(String raw) {
        try {
            return Optional.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("[RATE-LIMIT] Ignoring unparseable timestamp '{}'", raw);
            return Optional.empty();
        }
    }
}
