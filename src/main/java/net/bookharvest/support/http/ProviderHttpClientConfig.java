package net.bookharvest.support.http;

import net.bookharvest.domain.provider.ProviderDescriptor;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for one provider's {@link ProviderHttpClient}.
 *
 * @param providerName      provider id used for rate-limit and cache keys
 * @param minCallSpacing    minimum delay between calls across instances
 * @param cacheTtl          response cache TTL; zero disables caching
 * @param purpose           appended to the User-Agent so upstream operators know why we call
 * @param maxRetries        retries on retryable statuses and IO errors
 * @param retryableStatuses HTTP statuses that trigger a retry
 */
public record ProviderHttpClientConfig(String providerName,
                                       Duration minCallSpacing,
                                       Duration cacheTtl,
                                       String purpose,
                                       int maxRetries,
                                       Set<Integer> retryableStatuses) {

    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(408, 429, 500, 502, 503, 504);
    public static final int DEFAULT_MAX_RETRIES = 3;

    public ProviderHttpClientConfig {
        Objects.requireNonNull(providerName, "providerName");
        minCallSpacing = minCallSpacing == null ? Duration.ZERO : minCallSpacing;
        cacheTtl = cacheTtl == null ? Duration.ZERO : cacheTtl;
        purpose = purpose == null ? "Book metadata enrichment" : purpose;
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        retryableStatuses = retryableStatuses == null ? DEFAULT_RETRYABLE_STATUSES : Set.copyOf(retryableStatuses);
    }

    public static ProviderHttpClientConfig forDescriptor(ProviderDescriptor descriptor, String purpose) {
        return new ProviderHttpClientConfig(descriptor.id(), descriptor.minCallSpacing(), descriptor.cacheTtl(),
            purpose, DEFAULT_MAX_RETRIES, DEFAULT_RETRYABLE_STATUSES);
    }

    /**
     * Same settings with retries disabled, for metered APIs where every resent request is billed.
     */
    public ProviderHttpClientConfig withoutRetries() {
        return new ProviderHttpClientConfig(providerName, minCallSpacing, cacheTtl, purpose, 0, retryableStatuses);
    }
}
