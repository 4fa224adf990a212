package net.bookharvest.support.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import net.bookharvest.service.DistributedRateLimiter;
import net.bookharvest.support.kv.KeyValueStore;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Builds {@link ProviderHttpClient} instances that share the store, limiter, mapper and metrics.
 */
@Component
public class ProviderHttpClientFactory {

    private final WebClient.Builder webClientBuilder;
    private final KeyValueStore store;
    private final DistributedRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public ProviderHttpClientFactory(WebClient.Builder webClientBuilder,
                                     KeyValueStore store,
                                     DistributedRateLimiter rateLimiter,
                                     ObjectMapper objectMapper,
                                     MeterRegistry meterRegistry,
                                     RateLimiterRegistry rateLimiterRegistry,
                                     CircuitBreakerRegistry circuitBreakerRegistry) {
        this.webClientBuilder = webClientBuilder;
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.rateLimiterRegistry = rateLimiterRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    /**
     * @param config             client settings
     * @param burstLimitPerSecond in-process ceiling; zero or less disables the burst limiter
     */
    public ProviderHttpClient create(ProviderHttpClientConfig config, int burstLimitPerSecond) {
        RateLimiter burstLimiter = null;
        if (burstLimitPerSecond > 0) {
            burstLimiter = rateLimiterRegistry.rateLimiter(config.providerName(), RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(burstLimitPerSecond)
                .timeoutDuration(Duration.ofSeconds(1))
                .build());
        }
        return new ProviderHttpClient(config, webClientBuilder.clone().build(), store, rateLimiter, objectMapper,
            meterRegistry, burstLimiter, circuitBreakerRegistry.circuitBreaker(config.providerName()));
    }
}
