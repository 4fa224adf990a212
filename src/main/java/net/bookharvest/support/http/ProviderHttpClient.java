package net.bookharvest.support.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.domain.provider.ProviderException;
import net.bookharvest.domain.provider.ProviderFailureKind;
import net.bookharvest.domain.provider.RateLimitStrategy;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.service.DistributedRateLimiter;
import net.bookharvest.support.kv.KeyValueFallbacks;
import net.bookharvest.support.kv.KeyValueStore;
import net.bookharvest.util.ExternalApiLogger;
import net.bookharvest.util.HashUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Outbound HTTP for one provider with shared response caching, distributed rate limiting,
 * bounded retry and latency metrics.
 *
 * <p>Call flow: cache read (if the context strategy reads), rate limit (if enforced), request with
 * exponential backoff on retryable statuses, outcome classification, cache write (if the strategy
 * writes). A 404 is an empty result; every other failure surfaces as {@link ProviderException} so
 * the orchestrators can tell fatal from transient outcomes. Cache failures never fail a call.</p>
 */
@Slf4j
public class ProviderHttpClient {

    private static final String USER_AGENT_PREFIX = "BookHarvest/1.0";
    private static final String CACHE_PREFIX = "cache:";
    private static final Duration RETRY_BASE_BACKOFF = Duration.ofMillis(250);

    private final ProviderHttpClientConfig config;
    private final WebClient webClient;
    private final KeyValueStore store;
    private final DistributedRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final RateLimiter localBurstLimiter;
    private final CircuitBreaker circuitBreaker;
    private final Duration retryBackoff;

    public ProviderHttpClient(ProviderHttpClientConfig config,
                              WebClient webClient,
                              KeyValueStore store,
                              DistributedRateLimiter rateLimiter,
                              ObjectMapper objectMapper,
                              MeterRegistry meterRegistry,
                              RateLimiter localBurstLimiter,
                              CircuitBreaker circuitBreaker) {
        this(config, webClient, store, rateLimiter, objectMapper, meterRegistry, localBurstLimiter, circuitBreaker,
            RETRY_BASE_BACKOFF);
    }

    ProviderHttpClient(ProviderHttpClientConfig config,
                       WebClient webClient,
                       KeyValueStore store,
                       DistributedRateLimiter rateLimiter,
                       ObjectMapper objectMapper,
                       MeterRegistry meterRegistry,
                       RateLimiter localBurstLimiter,
                       CircuitBreaker circuitBreaker,
                       Duration retryBackoff) {
        this.config = Objects.requireNonNull(config, "config");
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.store = Objects.requireNonNull(store, "store");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.localBurstLimiter = localBurstLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retryBackoff = retryBackoff;
    }

    public String providerName() {
        return config.providerName();
    }

    /**
     * Issues a GET and parses the JSON body.
     *
     * @return parsed body, or empty on 404 or an empty body
     * @throws ProviderException for every other failure
     */
    public Optional<JsonNode> getJson(String url, Map<String, String> headers, ServiceContext context) {
        return execute(HttpMethod.GET, url, headers, null, context);
    }

    /**
     * Issues a POST with a JSON body and parses the JSON response.
     */
    public Optional<JsonNode> postJson(String url, Map<String, String> headers, Object body, ServiceContext context) {
        String serialized;
        try {
            serialized = body instanceof String text ? text : objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(config.providerName(), ProviderFailureKind.CONFIGURATION,
                "Request body could not be serialized", e);
        }
        return execute(HttpMethod.POST, url, headers, serialized, context);
    }

    private Optional<JsonNode> execute(HttpMethod method,
                                       String url,
                                       Map<String, String> headers,
                                       String body,
                                       ServiceContext context) {
        long startNanos = System.nanoTime();
        boolean cacheable = !config.cacheTtl().isZero();
        String cacheKey = cacheable ? cacheKey(context, url, body) : null;

        if (cacheable && context.cacheStrategy().reads()) {
            Optional<String> cached = KeyValueFallbacks.execute(log, () -> store.get(cacheKey), "cache read", Optional.empty());
            if (cached.isPresent()) {
                Optional<JsonNode> parsed = parseCached(cached.get());
                if (parsed.isPresent()) {
                    record(startNanos, "hit", true);
                    context.logger().debug("Cache hit for {} {}", config.providerName(), url);
                    return parsed;
                }
            }
        }

        applyRateLimit(context);

        if (localBurstLimiter != null && !localBurstLimiter.acquirePermission()) {
            record(startNanos, ProviderFailureKind.RATE_LIMITED.name(), false);
            throw new ProviderException(config.providerName(), ProviderFailureKind.RATE_LIMITED,
                "Local burst limit reached for " + config.providerName());
        }
        if (circuitBreaker != null && !circuitBreaker.tryAcquirePermission()) {
            record(startNanos, "circuit_open", false);
            throw new ProviderException(config.providerName(), ProviderFailureKind.UPSTREAM,
                "Circuit breaker is open for " + config.providerName());
        }

        ExternalApiLogger.logApiCallAttempt(log, config.providerName(), method.name(), url);
        String responseBody;
        try {
            responseBody = exchange(method, url, headers, body, context).block();
        } catch (RuntimeException e) {
            ProviderException failure = classify(e);
            onCircuitResult(startNanos, failure);
            record(startNanos, failure.kind().name(), false);
            ExternalApiLogger.logApiCallFailure(log, config.providerName(), method.name(), url, failure.getMessage());
            throw failure;
        }
        onCircuitResult(startNanos, null);

        if (responseBody == null || responseBody.isBlank()) {
            record(startNanos, "empty", false);
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            record(startNanos, ProviderFailureKind.INVALID_RESPONSE.name(), false);
            throw new ProviderException(config.providerName(), ProviderFailureKind.INVALID_RESPONSE,
                "Response was not valid JSON", e);
        }

        if (cacheable && context.cacheStrategy().writes()) {
            KeyValueFallbacks.run(log, () -> store.set(cacheKey, responseBody, config.cacheTtl()), "cache write");
        }
        record(startNanos, "success", false);
        return Optional.of(node);
    }

    private Mono<String> exchange(HttpMethod method, String url, Map<String, String> headers, String body,
                                  ServiceContext context) {
        WebClient.RequestBodySpec spec = webClient.method(method)
            .uri(URI.create(url))
            .headers(httpHeaders -> {
                if (headers != null) {
                    headers.forEach(httpHeaders::set);
                }
                httpHeaders.set(HttpHeaders.USER_AGENT, USER_AGENT_PREFIX + " (" + config.purpose() + ")");
            });
        WebClient.RequestHeadersSpec<?> request = body != null
            ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body)
            : spec;

        return request.exchangeToMono(response -> {
                int status = response.statusCode().value();
                if (response.statusCode().is2xxSuccessful()) {
                    return response.bodyToMono(String.class).defaultIfEmpty("");
                }
                if (status == 404) {
                    return response.releaseBody().then(Mono.<String>empty());
                }
                return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(errorBody -> Mono.<String>error(new UpstreamStatusException(status, errorBody)));
            })
            .retryWhen(Retry.backoff(config.maxRetries(), retryBackoff)
                .filter(this::isRetryable)
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
            .timeout(context.timeout());
    }

    private void applyRateLimit(ServiceContext context) {
        RateLimitStrategy strategy = context.rateLimitStrategy();
        if (strategy == RateLimitStrategy.ENFORCE) {
            rateLimiter.acquire(config.providerName(), config.minCallSpacing());
        } else if (strategy == RateLimitStrategy.LOG_ONLY) {
            Duration wouldWait = rateLimiter.peekDelay(config.providerName(), config.minCallSpacing());
            if (!wouldWait.isZero()) {
                context.logger().info("[RATE-LIMIT] {} would have waited {}ms (log-only)",
                    config.providerName(), wouldWait.toMillis());
            }
        }
    }

    private boolean isRetryable(Throwable throwable) {
        if (throwable instanceof UpstreamStatusException statusException) {
            return config.retryableStatuses().contains(statusException.status);
        }
        return throwable instanceof WebClientRequestException;
    }

    private ProviderException classify(RuntimeException raw) {
        Throwable cause = Exceptions.unwrap(raw);
        String provider = config.providerName();
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        if (cause instanceof UpstreamStatusException statusException) {
            int status = statusException.status;
            if (status == 401 || status == 403) {
                return new ProviderException(provider, ProviderFailureKind.AUTHENTICATION,
                    "HTTP " + status + " rejected credentials", statusException);
            }
            if (status == 429) {
                return new ProviderException(provider, ProviderFailureKind.RATE_LIMITED,
                    "HTTP 429 rate limited", statusException);
            }
            return new ProviderException(provider, ProviderFailureKind.UPSTREAM,
                "HTTP " + status, statusException);
        }
        if (cause instanceof TimeoutException || hasTimeoutCause(cause)) {
            return new ProviderException(provider, ProviderFailureKind.TIMEOUT, "Request timed out", cause);
        }
        return new ProviderException(provider, ProviderFailureKind.UPSTREAM,
            cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
    }

    private static boolean hasTimeoutCause(Throwable throwable) {
        Throwable current = throwable.getCause();
        while (current != null) {
            if (current instanceof TimeoutException || current.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private void onCircuitResult(long startNanos, ProviderException failure) {
        if (circuitBreaker == null) {
            return;
        }
        long elapsed = System.nanoTime() - startNanos;
        boolean countsAgainstUpstream = failure != null
            && (failure.kind() == ProviderFailureKind.UPSTREAM || failure.kind() == ProviderFailureKind.TIMEOUT);
        if (countsAgainstUpstream) {
            circuitBreaker.onError(elapsed, TimeUnit.NANOSECONDS, failure);
        } else {
            circuitBreaker.onSuccess(elapsed, TimeUnit.NANOSECONDS);
        }
    }

    private Optional<JsonNode> parseCached(String cached) {
        try {
            return Optional.of(objectMapper.readTree(cached));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unparseable cache entry for {}: {}", config.providerName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String cacheKey(ServiceContext context, String url, String body) {
        String material = body == null ? url : url + "\n" + body;
        return CACHE_PREFIX + context.cacheNamespace() + ":" + config.providerName() + ":" + HashUtils.sha256Hex(material);
    }

    private void record(long startNanos, String outcome, boolean cached) {
        Timer.builder("bookharvest.provider.http")
            .tag("provider", config.providerName())
            .tag("outcome", outcome)
            .tag("cached", Boolean.toString(cached))
            .register(meterRegistry)
            .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Non-2xx, non-404 response carried through the reactive chain so retry can inspect the status.
     */
    static final class UpstreamStatusException extends RuntimeException {
        private final int status;

        UpstreamStatusException(int status, String body) {
            super("HTTP " + status + (body == null || body.isBlank() ? "" : ": " + abbreviate(body)));
            this.status = status;
        }

        int status() {
            return status;
        }

        private static String abbreviate(String body) {
            return body.length() > 200 ? body.substring(0, 200) + "..." : body;
        }
    }
}
