package net.bookharvest.domain.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call value passed through every provider invocation.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies so one
 * context can be narrowed for a single call without affecting the caller's copy.</p>
 */
public final class ServiceContext {

    private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(ServiceContext.class);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final CacheStrategy cacheStrategy;
    private final RateLimitStrategy rateLimitStrategy;
    private final String cacheNamespace;
    private final Duration timeout;
    private final Logger logger;
    private final Map<String, String> metadata;

    private ServiceContext(CacheStrategy cacheStrategy,
                           RateLimitStrategy rateLimitStrategy,
                           String cacheNamespace,
                           Duration timeout,
                           Logger logger,
                           Map<String, String> metadata) {
        this.cacheStrategy = Objects.requireNonNull(cacheStrategy, "cacheStrategy");
        this.rateLimitStrategy = Objects.requireNonNull(rateLimitStrategy, "rateLimitStrategy");
        this.cacheNamespace = Objects.requireNonNull(cacheNamespace, "cacheNamespace");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.metadata = Map.copyOf(metadata);
    }

    /**
     * Default context: read-write cache, enforced rate limiting, 10 second timeout.
     */
    public static ServiceContext defaults() {
        return new ServiceContext(CacheStrategy.READ_WRITE, RateLimitStrategy.ENFORCE, "default",
            DEFAULT_TIMEOUT, DEFAULT_LOGGER, Map.of());
    }

    public ServiceContext withCacheStrategy(CacheStrategy strategy) {
        return new ServiceContext(strategy, rateLimitStrategy, cacheNamespace, timeout, logger, metadata);
    }

    public ServiceContext withRateLimitStrategy(RateLimitStrategy strategy) {
        return new ServiceContext(cacheStrategy, strategy, cacheNamespace, timeout, logger, metadata);
    }

    public ServiceContext withCacheNamespace(String namespace) {
        return new ServiceContext(cacheStrategy, rateLimitStrategy, namespace, timeout, logger, metadata);
    }

    public ServiceContext withTimeout(Duration newTimeout) {
        if (newTimeout.isNegative() || newTimeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + newTimeout);
        }
        return new ServiceContext(cacheStrategy, rateLimitStrategy, cacheNamespace, newTimeout, logger, metadata);
    }

    public ServiceContext withLogger(Logger newLogger) {
        return new ServiceContext(cacheStrategy, rateLimitStrategy, cacheNamespace, timeout, newLogger, metadata);
    }

    public ServiceContext withMetadata(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new ServiceContext(cacheStrategy, rateLimitStrategy, cacheNamespace, timeout, logger, copy);
    }

    public CacheStrategy cacheStrategy() {
        return cacheStrategy;
    }

    public RateLimitStrategy rateLimitStrategy() {
        return rateLimitStrategy;
    }

    public String cacheNamespace() {
        return cacheNamespace;
    }

    public Duration timeout() {
        return timeout;
    }

    public Logger logger() {
        return logger;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    @Override
    public String toString() {
        return "ServiceContext{cache=" + cacheStrategy + ", rateLimit=" + rateLimitStrategy
            + ", namespace=" + cacheNamespace + ", timeout=" + timeout + ", metadata=" + metadata + "}";
    }
}
