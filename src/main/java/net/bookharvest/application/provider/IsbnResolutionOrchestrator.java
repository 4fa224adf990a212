package net.bookharvest.application.provider;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.config.ProviderProperties;
import net.bookharvest.domain.provider.ProviderCapability;
import net.bookharvest.domain.provider.ProviderException;
import net.bookharvest.domain.provider.ProviderType;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves an ISBN from title and author by walking the {@code ISBN_RESOLUTION} providers in order.
 *
 * <p>Order: the configured {@code app.providers.isbn-resolution-order} when set (unlisted providers
 * follow in priority order), otherwise paid providers first and then by priority weight. Every attempt
 * is time-boxed. Provider exceptions never escape; a fatal failure only removes that provider from the
 * current chain.</p>
 */
@Slf4j
@Service
public class IsbnResolutionOrchestrator {

    private final ProviderRegistry registry;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final List<String> customOrder;
    private final Duration attemptTimeout;
    private final boolean stopOnFirstSuccess;

    @Autowired
    public IsbnResolutionOrchestrator(ProviderRegistry registry,
                                      ProviderProperties properties,
                                      @Qualifier("providerExecutor") Executor executor,
                                      MeterRegistry meterRegistry) {
        this(registry, executor, meterRegistry, properties.getIsbnResolutionOrder(),
            properties.getResolutionTimeout(), properties.isStopOnFirstSuccess());
    }

    public IsbnResolutionOrchestrator(ProviderRegistry registry,
                                      Executor executor,
                                      MeterRegistry meterRegistry,
                                      List<String> customOrder,
                                      Duration attemptTimeout,
                                      boolean stopOnFirstSuccess) {
        this.registry = registry;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.customOrder = customOrder == null ? List.of() : List.copyOf(customOrder);
        this.attemptTimeout = attemptTimeout;
        this.stopOnFirstSuccess = stopOnFirstSuccess;
    }

    public IsbnResolution resolve(String title, String author, ServiceContext context) {
        List<IsbnResolver> resolvers = orderedResolvers();
        if (resolvers.isEmpty()) {
            context.logger().warn("[ISBN] No ISBN resolvers available for '{}' by '{}'", title, author);
            return finish(new IsbnResolution(null, IsbnResolution.SOURCE_NONE, List.of()));
        }

        List<ProviderAttempt> attempts = new ArrayList<>();
        IsbnMatch best = null;
        String bestSource = null;

        for (int i = 0; i < resolvers.size(); i++) {
            IsbnResolver resolver = resolvers.get(i);
            AttemptResult result = attempt(resolver, title, author, context);
            attempts.add(result.attempt());

            if (result.match() != null) {
                if (best == null || result.match().confidence() > best.confidence()) {
                    best = result.match();
                    bestSource = resolver.id();
                }
                if (stopOnFirstSuccess) {
                    break;
                }
            }
            if (i + 1 < resolvers.size() && result.match() == null) {
                ExternalApiLogger.logFallback(log, resolver.id(), resolvers.get(i + 1).id(),
                    result.attempt().outcome() + (result.attempt().detail().isEmpty() ? "" : ": " + result.attempt().detail()));
            }
        }

        if (best != null) {
            context.logger().info("[ISBN] Resolved '{}' by '{}' to {} via {} (confidence={}, attempts={})",
                title, author, best.isbn(), bestSource, best.confidence(), attempts.size());
            return finish(new IsbnResolution(best, bestSource, attempts));
        }
        String source = aggregateSource(attempts);
        context.logger().info("[ISBN] No ISBN for '{}' by '{}' ({}, attempts={})", title, author, source, attempts);
        return finish(new IsbnResolution(null, source, attempts));
    }

    private AttemptResult attempt(IsbnResolver resolver, String title, String author, ServiceContext context) {
        long started = System.nanoTime();
        ServiceContext attemptContext = context.timeout().compareTo(attemptTimeout) > 0
            ? context.withTimeout(attemptTimeout)
            : context;
        CompletableFuture<Optional<IsbnMatch>> call =
            CompletableFuture.supplyAsync(() -> resolver.resolveIsbn(title, author, attemptContext), executor);
        try {
            Optional<IsbnMatch> match = call.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            return match
                .map(found -> new AttemptResult(new ProviderAttempt(resolver.id(), AttemptOutcome.FOUND, found.isbn(), elapsed), found))
                .orElseGet(() -> new AttemptResult(new ProviderAttempt(resolver.id(), AttemptOutcome.NOT_FOUND, "", elapsed), null));
        } catch (TimeoutException e) {
            call.cancel(true);
            return failed(resolver, AttemptOutcome.TIMEOUT, "exceeded " + attemptTimeout.toMillis() + "ms", started);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ProviderException providerException) {
                AttemptOutcome outcome = AttemptOutcome.from(providerException);
                if (outcome == AttemptOutcome.FATAL) {
                    log.error("[ISBN] {} failed fatally ({}); skipping it for this resolution",
                        resolver.id(), providerException.kind());
                }
                return failed(resolver, outcome, providerException.getMessage(), started);
            }
            log.warn("[ISBN] {} threw unexpectedly", resolver.id(), cause);
            return failed(resolver, AttemptOutcome.ERROR, String.valueOf(cause.getMessage()), started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return failed(resolver, AttemptOutcome.ERROR, "interrupted", started);
        }
    }

    private static AttemptResult failed(IsbnResolver resolver, AttemptOutcome outcome, String detail, long started) {
        return new AttemptResult(
            new ProviderAttempt(resolver.id(), outcome, detail, Duration.ofNanos(System.nanoTime() - started)), null);
    }

    static String aggregateSource(List<ProviderAttempt> attempts) {
        boolean everyAttemptFailed = !attempts.isEmpty()
            && attempts.stream().allMatch(attempt -> attempt.outcome().isFailure());
        if (!everyAttemptFailed) {
            return IsbnResolution.SOURCE_NONE;
        }
        boolean allBudget = attempts.stream().allMatch(attempt -> attempt.outcome().isBudgetSignal());
        return allBudget ? IsbnResolution.SOURCE_QUOTA_EXHAUSTED : IsbnResolution.SOURCE_ALL_FAILED;
    }

    List<IsbnResolver> orderedResolvers() {
        List<IsbnResolver> available = registry.availableProviders(ProviderCapability.ISBN_RESOLUTION).stream()
            .filter(IsbnResolver.class::isInstance)
            .map(IsbnResolver.class::cast)
            .toList();
        Comparator<IsbnResolver> ordering;
        if (!customOrder.isEmpty()) {
            ordering = Comparator.comparingInt(resolver -> {
                int index = customOrder.indexOf(resolver.id());
                return index < 0 ? Integer.MAX_VALUE : index;
            });
        } else {
            ordering = Comparator.comparingInt(resolver -> resolver.descriptor().type() == ProviderType.PAID ? 0 : 1);
        }
        // Stable sort keeps the registry's priority order inside each group
        List<IsbnResolver> ordered = new ArrayList<>(available);
        ordered.sort(ordering);
        return ordered;
    }

    private IsbnResolution finish(IsbnResolution resolution) {
        String outcome = resolution.resolved() ? "resolved" : resolution.source();
        Counter.builder("bookharvest.isbn.resolutions")
            .tag("outcome", outcome)
            .register(meterRegistry)
            .increment();
        return resolution;
    }

    private record AttemptResult(ProviderAttempt attempt, IsbnMatch match) {
    }
}
