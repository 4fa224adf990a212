package net.bookharvest.application.backfill;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.application.dedup.DeduplicationEngine;
import net.bookharvest.application.provider.BookGenerationOrchestrator;
import net.bookharvest.application.provider.BookGenerationRequest;
import net.bookharvest.application.provider.BookGenerationResult;
import net.bookharvest.application.provider.IsbnResolution;
import net.bookharvest.domain.backfill.BackfillCompletion;
import net.bookharvest.domain.backfill.BackfillStatus;
import net.bookharvest.domain.backfill.CandidateBook;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.repository.BackfillLogRepository;
import net.bookharvest.repository.BackfillPersistenceException;
import net.bookharvest.repository.SyntheticWorkRepository;
import net.bookharvest.support.lock.AdvisoryLockAcquisitionException;
import net.bookharvest.support.lock.AdvisoryLockManager;
import net.bookharvest.support.queue.BackfillJobMessage;
import net.bookharvest.support.queue.EnrichmentQueuePublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one month job: generate candidates, deduplicate, resolve ISBNs under the paid budget,
 * persist and record the outcome in {@code backfill_log}.
 *
 * <p>When the budget runs out mid-month the job does not fail. Remaining candidates are stored as
 * synthetic works and the month completes with whatever was resolved (the degraded path).</p>
 */
@Service
@Slf4j
public class BackfillJobProcessor {

    static final String GEMINI = "gemini";
    static final String XAI = "xai";
    static final Duration LOCK_TIMEOUT = Duration.ofSeconds(10);

    private final BackfillLogRepository backfillLogRepository;
    private final SyntheticWorkRepository syntheticWorkRepository;
    private final AdvisoryLockManager lockManager;
    private final BookGenerationOrchestrator generationOrchestrator;
    private final DeduplicationEngine deduplicationEngine;
    private final QuotaGuardedIsbnResolver isbnResolver;
    private final EnrichmentQueuePublisher enrichmentQueue;
    private final BackfillJobStatusStore statusStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public BackfillJobProcessor(BackfillLogRepository backfillLogRepository,
                                SyntheticWorkRepository syntheticWorkRepository,
                                AdvisoryLockManager lockManager,
                                BookGenerationOrchestrator generationOrchestrator,
                                DeduplicationEngine deduplicationEngine,
                                QuotaGuardedIsbnResolver isbnResolver,
                                EnrichmentQueuePublisher enrichmentQueue,
                                BackfillJobStatusStore statusStore,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.backfillLogRepository = backfillLogRepository;
        this.syntheticWorkRepository = syntheticWorkRepository;
        this.lockManager = lockManager;
        this.generationOrchestrator = generationOrchestrator;
        this.deduplicationEngine = deduplicationEngine;
        this.isbnResolver = isbnResolver;
        this.enrichmentQueue = enrichmentQueue;
        this.statusStore = statusStore;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public BackfillJobResult process(BackfillJobMessage message) {
        int year = message.year();
        int month = message.month();
        boolean acquired;
        try {
            acquired = lockManager.tryAcquire(year, month, LOCK_TIMEOUT);
        } catch (AdvisoryLockAcquisitionException e) {
            log.error("[BACKFILL] Lock infrastructure unavailable for {}; leaving job {} for reclaim",
                message.label(), message.jobId(), e);
            return record(BackfillJobResult.failed(message.jobId(), year, month, "Lock unavailable: " + e.getMessage()));
        }
        if (!acquired) {
            log.info("[BACKFILL] {} is owned by another runner; job {} skipped", message.label(), message.jobId());
            return record(BackfillJobResult.skipped(message.jobId(), year, month, "Month locked by another runner"));
        }

        Instant startedAt = clock.instant();
        try {
            return record(run(message, startedAt));
        } catch (RuntimeException e) {
            log.error("[BACKFILL] Job {} for {} failed", message.jobId(), message.label(), e);
            String error = describe(e);
            if (!message.dryRun()) {
                recordFailedAttempt(year, month, error);
            }
            statusStore.markFailed(message.jobId(), error, startedAt);
            return record(BackfillJobResult.failed(message.jobId(), year, month, error));
        } finally {
            lockManager.release(year, month);
        }
    }

    private BackfillJobResult run(BackfillJobMessage message, Instant startedAt) {
        String jobId = message.jobId();
        int year = message.year();
        int month = message.month();
        ServiceContext context = ServiceContext.defaults()
            .withLogger(log)
            .withCacheNamespace("backfill")
            .withMetadata("jobId", jobId);

        statusStore.markProgress(jobId, BackfillJobState.PROCESSING, "Generating candidates for " + message.label());
        BookGenerationResult generation = generationOrchestrator.generate(
            new BookGenerationRequest(year, month, message.batchSize(), message.promptVariant()), context);
        if (generation.configurationError()) {
            throw new BackfillJobException("Generation not configured for " + message.label() + ": "
                + generation.failure().orElse(BookGenerationResult.NO_PROVIDER_REGISTERED));
        }
        if (!generation.succeeded()) {
            log.warn("[BACKFILL] {}: no generation provider succeeded; completing with 0 books", message.label());
        }

        // Orchestrator output is already clustered; only the corpus check remains.
        DeduplicationEngine.CorpusFilterResult filtered = deduplicationEngine.filterAgainstCorpus(generation.books());
        int skipped = generation.books().size() - filtered.candidates().size();
        log.info("[BACKFILL] {}: {} generated ({} raw), {} new ({} exact, {} fuzzy corpus matches)",
            message.label(), generation.books().size(), generation.rawCount(), filtered.candidates().size(),
            filtered.exactMatches(), filtered.fuzzyMatches());

        statusStore.markProgress(jobId, BackfillJobState.PROCESSING,
            "Resolving ISBNs for " + filtered.candidates().size() + " candidates");
        ResolutionPass pass = resolveAll(filtered.candidates(), context, message.label());

        int syntheticCreated = 0;
        int isbnsQueued = 0;
        if (!message.dryRun()) {
            for (CandidateBook book : pass.unresolved()) {
                if (syntheticWorkRepository.insertSynthetic(book, jobId)) {
                    syntheticCreated++;
                }
            }
            statusStore.markProgress(jobId, BackfillJobState.ENRICHING,
                "Queueing " + pass.resolved().size() + " ISBNs for enrichment");
            List<String> isbns = pass.resolved().stream().map(CandidateBook::isbn).toList();
            isbnsQueued = enrichmentQueue.enqueue(isbns, enrichmentSource(year, month),
                EnrichmentQueuePublisher.PRIORITY_LOW, jobId);
        }

        BackfillCompletion completion = new BackfillCompletion(
            generation.books().size(),
            pass.resolved().size(),
            isbnsQueued,
            syntheticCreated,
            generation.callsTo(GEMINI),
            generation.callsTo(XAI),
            pass.paidCalls());
        if (!message.dryRun() && !backfillLogRepository.markCompleted(year, month, completion)) {
            log.warn("[BACKFILL] {} was not in processing when job {} finished; counters not recorded",
                message.label(), jobId);
        }

        String summary = generation.succeeded()
            ? summarize(pass, syntheticCreated, message.dryRun())
            : withDryRunPrefix("0 books generated - " + BookGenerationResult.NO_PROVIDER_SUCCEEDED, message.dryRun());
        statusStore.markComplete(jobId, summary, statsOf(completion, filtered), startedAt);
        log.info("[BACKFILL] Job {} for {} complete: {}", jobId, message.label(), summary);
        return new BackfillJobResult(BackfillJobResult.Outcome.COMPLETED, jobId, year, month,
            filtered.candidates().size(), pass.resolved().size(), skipped, pass.degraded(),
            syntheticCreated, isbnsQueued, summary);
    }

    private ResolutionPass resolveAll(List<CandidateBook> candidates, ServiceContext context, String label) {
        List<CandidateBook> resolved = new ArrayList<>();
        List<CandidateBook> unresolved = new ArrayList<>();
        boolean degraded = false;
        int paidCalls = 0;

        for (CandidateBook candidate : candidates) {
            if (candidate.hasIsbn()) {
                resolved.add(candidate);
                continue;
            }
            if (degraded) {
                unresolved.add(candidate);
                continue;
            }
            Optional<QuotaGuardedIsbnResolver.GuardedResolution> guarded =
                isbnResolver.resolve(candidate.title(), candidate.author(), context);
            if (guarded.isEmpty()) {
                log.warn("[BACKFILL] {}: quota reservation rejected; remaining candidates become synthetic", label);
                degraded = true;
                unresolved.add(candidate);
                continue;
            }
            paidCalls += guarded.get().paidCalls();
            IsbnResolution resolution = guarded.get().resolution();
            if (resolution.resolved()) {
                resolved.add(candidate.withIsbn(resolution.match().isbn(), resolution.source()));
            } else {
                if (resolution.quotaExhausted()) {
                    log.warn("[BACKFILL] {}: ISBN providers report quota exhausted; remaining candidates become synthetic", label);
                    degraded = true;
                }
                unresolved.add(candidate);
            }
        }
        return new ResolutionPass(resolved, unresolved, degraded, paidCalls);
    }

    private void recordFailedAttempt(int year, int month, String error) {
        try {
            Optional<BackfillStatus> status = backfillLogRepository.markFailedAttempt(year, month, error);
            status.ifPresentOrElse(
                value -> log.info("[BACKFILL] {}-{} recorded as {}", year, month, value.dbValue()),
                () -> log.warn("[BACKFILL] {}-{} was not processing; failed attempt not recorded", year, month));
        } catch (BackfillPersistenceException e) {
            log.error("[BACKFILL] Could not record failed attempt for {}-{}; month stays processing until reclaimed",
                year, month, e);
        }
    }

    private BackfillJobResult record(BackfillJobResult result) {
        meterRegistry.counter("bookharvest.backfill.jobs", "outcome", result.outcome().name().toLowerCase(Locale.ROOT)).increment();
        return result;
    }

    static String enrichmentSource(int year, int month) {
        return "backfill-%d-%02d".formatted(year, month);
    }

    private static String summarize(ResolutionPass pass, int syntheticCreated, boolean dryRun) {
        String summary = pass.resolved().size() + " ISBNs resolved - " + syntheticCreated + " synthetic records created";
        if (pass.degraded()) {
            summary += " (quota exhausted, degraded)";
        }
        return withDryRunPrefix(summary, dryRun);
    }

    private static String withDryRunPrefix(String summary, boolean dryRun) {
        return dryRun ? "[DRY-RUN] " + summary : summary;
    }

    private static Map<String, Number> statsOf(BackfillCompletion completion,
                                               DeduplicationEngine.CorpusFilterResult filtered) {
        Map<String, Number> stats = new LinkedHashMap<>();
        stats.put("books_generated", completion.booksGenerated());
        stats.put("isbns_resolved", completion.isbnsResolved());
        stats.put("isbn_resolution_rate", completion.resolutionRate());
        stats.put("isbns_queued", completion.isbnsQueued());
        stats.put("synthetic_created", completion.syntheticCreated());
        stats.put("exact_dedup_matches", filtered.exactMatches());
        stats.put("fuzzy_dedup_matches", filtered.fuzzyMatches());
        stats.put("gemini_calls", completion.geminiCalls());
        stats.put("xai_calls", completion.xaiCalls());
        stats.put("isbndb_calls", completion.isbndbCalls());
        stats.put("total_api_calls", completion.totalApiCalls());
        return stats;
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private record ResolutionPass(List<CandidateBook> resolved, List<CandidateBook> unresolved,
                                  boolean degraded, int paidCalls) {
    }
}
