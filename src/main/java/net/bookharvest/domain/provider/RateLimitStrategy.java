package net.bookharvest.domain.provider;

/**
 * How a single provider call interacts with the distributed rate limiter.
 */
public enum RateLimitStrategy {
    /** Wait for the minimum spacing before calling. */
    ENFORCE,
    /** Log when a call would have waited, but do not wait. */
    LOG_ONLY,
    DISABLED
}
