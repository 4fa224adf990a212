/**
 * Configuration for per-instance provider resilience
 * - In-process burst limiters sit in front of the distributed rate limiter
 * - Circuit breakers stop hammering an upstream that keeps failing
 */
package net.bookharvest.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ProviderResilienceConfig {
    private static final Logger logger = LoggerFactory.getLogger(ProviderResilienceConfig.class);

    /**
     * Registry of burst limiters. Each provider gets its own limiter, sized from
     * {@code app.providers.registry.<id>.burst-limit-per-second} when the HTTP client is built.
     */
    @Bean
    public RateLimiterRegistry providerRateLimiterRegistry() {
        RateLimiterConfig defaults = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(10)
                .timeoutDuration(Duration.ZERO)
                .build();
        logger.info("Provider burst limiter registry initialized (default 10 requests/second per provider)");
        return RateLimiterRegistry.of(defaults);
    }

    /**
     * Registry of per-provider circuit breakers.
     */
    @Bean
    public CircuitBreakerRegistry providerCircuitBreakerRegistry(
            @Value("${app.providers.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${app.providers.circuit-breaker.sliding-window-size:20}") int slidingWindowSize,
            @Value("${app.providers.circuit-breaker.open-state-seconds:60}") long openStateSeconds) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(Math.min(10, slidingWindowSize))
                .waitDurationInOpenState(Duration.ofSeconds(openStateSeconds))
                .build();
        logger.info("Provider circuit breaker registry initialized (threshold={}%, window={}, open={}s)",
                failureRateThreshold, slidingWindowSize, openStateSeconds);
        return CircuitBreakerRegistry.of(config);
    }
}
