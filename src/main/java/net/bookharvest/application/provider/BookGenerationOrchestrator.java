package net.bookharvest.application.provider;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.application.dedup.DeduplicationEngine;
import net.bookharvest.config.ProviderProperties;
import net.bookharvest.domain.backfill.CandidateBook;
import net.bookharvest.domain.provider.ProviderCapability;
import net.bookharvest.domain.provider.ServiceContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a generation request out to every available {@code BOOK_GENERATION} provider.
 *
 * <p>Each provider runs on the provider executor with its own timeout. Results are joined once,
 * merged in priority order and deduplicated only after the join. A provider failure contributes an
 * empty list; when every provider comes back empty the result is tagged
 * {@value BookGenerationResult#NO_PROVIDER_SUCCEEDED} instead of throwing.</p>
 */
@Slf4j
@Service
public class BookGenerationOrchestrator {

    private final ProviderRegistry registry;
    private final DeduplicationEngine deduplicationEngine;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final List<String> priority;
    private final Duration providerTimeout;
    private final boolean sequential;

    @Autowired
    public BookGenerationOrchestrator(ProviderRegistry registry,
                                      DeduplicationEngine deduplicationEngine,
                                      ProviderProperties properties,
                                      @Qualifier("providerExecutor") Executor executor,
                                      MeterRegistry meterRegistry) {
        this(registry, deduplicationEngine, executor, meterRegistry, properties.getGenerationOrder(),
            properties.getGenerationTimeout(), properties.isGenerationSequential());
    }

    public BookGenerationOrchestrator(ProviderRegistry registry,
                                      DeduplicationEngine deduplicationEngine,
                                      Executor executor,
                                      MeterRegistry meterRegistry,
                                      List<String> priority,
                                      Duration providerTimeout,
                                      boolean sequential) {
        this.registry = registry;
        this.deduplicationEngine = deduplicationEngine;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.priority = priority == null ? List.of() : List.copyOf(priority);
        this.providerTimeout = providerTimeout;
        this.sequential = sequential;
    }

    /**
     * @throws IllegalArgumentException when the request names an unknown prompt variant
     */
    public BookGenerationResult generate(BookGenerationRequest request, ServiceContext context) {
        BookGenerationPrompts.Variant.fromWireName(request.promptVariant());

        if (registry.byCapability(ProviderCapability.BOOK_GENERATION).isEmpty()) {
            log.error("[GENERATION] No book generation provider registered");
            return record(BookGenerationResult.unconfigured());
        }
        List<BookGenerator> generators = orderedGenerators();
        if (generators.isEmpty()) {
            log.warn("[GENERATION] Every book generation provider reports unavailable");
            return record(BookGenerationResult.failed(Map.of()));
        }
        ServiceContext providerContext = context.timeout().compareTo(providerTimeout) < 0
            ? context.withTimeout(providerTimeout)
            : context;

        return record(sequential
            ? generateSequentially(generators, request, providerContext)
            : generateConcurrently(generators, request, providerContext));
    }

    private BookGenerationResult generateConcurrently(List<BookGenerator> generators,
                                                      BookGenerationRequest request,
                                                      ServiceContext context) {
        log.info("[GENERATION] Fan-out to {} for {}-{} ({} books, variant={})",
            generators.stream().map(BookGenerator::id).toList(), request.year(), request.month(),
            request.limit(), request.promptVariant());

        Map<String, CompletableFuture<List<CandidateBook>>> calls = new LinkedHashMap<>();
        Map<String, Integer> providerCalls = new LinkedHashMap<>();
        for (BookGenerator generator : generators) {
            providerCalls.put(generator.id(), 1);
            calls.put(generator.id(), CompletableFuture
                .supplyAsync(() -> generator.generate(request, context), executor)
                .orTimeout(providerTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(failure -> {
                    logFailure(generator.id(), failure);
                    return List.of();
                }));
        }

        CompletableFuture.allOf(calls.values().toArray(new CompletableFuture[0])).join();

        List<CandidateBook> merged = new ArrayList<>();
        calls.forEach((providerId, call) -> {
            List<CandidateBook> books = call.join();
            log.info("[GENERATION] {} returned {} books", providerId, books.size());
            merged.addAll(books);
        });
        return merge(merged, providerCalls);
    }

    private BookGenerationResult generateSequentially(List<BookGenerator> generators,
                                                      BookGenerationRequest request,
                                                      ServiceContext context) {
        Map<String, Integer> providerCalls = new LinkedHashMap<>();
        for (BookGenerator generator : generators) {
            providerCalls.put(generator.id(), 1);
            List<CandidateBook> books;
            try {
                books = CompletableFuture.supplyAsync(() -> generator.generate(request, context), executor)
                    .orTimeout(providerTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
            } catch (CompletionException e) {
                logFailure(generator.id(), e);
                continue;
            }
            if (!books.isEmpty()) {
                log.info("[GENERATION] {} succeeded with {} books (sequential)", generator.id(), books.size());
                return merge(books, providerCalls);
            }
            log.warn("[GENERATION] {} returned no books; trying next provider", generator.id());
        }
        return merge(List.of(), providerCalls);
    }

    private BookGenerationResult merge(List<CandidateBook> merged, Map<String, Integer> providerCalls) {
        if (merged.isEmpty()) {
            log.error("[GENERATION] All providers failed or returned nothing: {}", providerCalls.keySet());
            return BookGenerationResult.failed(providerCalls);
        }
        List<CandidateBook> unique = deduplicationEngine.cluster(merged);
        log.info("[GENERATION] {} generated, {} after deduplication", merged.size(), unique.size());
        return new BookGenerationResult(unique, merged.size(), providerCalls, null);
    }

    private static void logFailure(String providerId, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
            ? failure.getCause() : failure;
        if (cause instanceof TimeoutException) {
            log.warn("[GENERATION] {} timed out", providerId);
        } else {
            log.warn("[GENERATION] {} failed: {}", providerId, cause.getMessage());
        }
    }

    List<BookGenerator> orderedGenerators() {
        List<BookGenerator> generators = new ArrayList<>(registry.availableProviders(ProviderCapability.BOOK_GENERATION).stream()
            .filter(BookGenerator.class::isInstance)
            .map(BookGenerator.class::cast)
            .toList());
        generators.sort(Comparator.comparingInt(generator -> {
            int index = priority.indexOf(generator.id());
            return index < 0 ? Integer.MAX_VALUE : index;
        }));
        return generators;
    }

    private BookGenerationResult record(BookGenerationResult result) {
        Counter.builder("bookharvest.generation.rounds")
            .tag("outcome", outcomeTag(result))
            .register(meterRegistry)
            .increment();
        return result;
    }

    private static String outcomeTag(BookGenerationResult result) {
        if (result.succeeded()) {
            return "success";
        }
        return result.configurationError() ? "no_provider_registered" : "no_provider_succeeded";
    }
}
