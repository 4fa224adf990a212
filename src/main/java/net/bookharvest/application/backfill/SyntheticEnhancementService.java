package net.bookharvest.application.backfill;

import lombok.extern.slf4j.Slf4j;
import net.bookharvest.application.provider.IsbnResolution;
import net.bookharvest.domain.provider.ServiceContext;
import net.bookharvest.repository.BackfillPersistenceException;
import net.bookharvest.repository.SyntheticWorkRepository;
import net.bookharvest.repository.SyntheticWorkRepository.SyntheticWork;
import net.bookharvest.support.queue.EnrichmentQueuePublisher;
import net.bookharvest.support.queue.QueuePublishException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Second chance for synthetic works: retries ISBN resolution once the daily budget allows and
 * promotes the work when a match turns up.
 *
 * <p>A work is only marked enhanced after its ISBN reached the enrichment queue. If the queue write
 * fails the lookup is stamped so the work waits out the cooldown before the next try.</p>
 */
@Service
@Slf4j
public class SyntheticEnhancementService {

    static final String ENRICHMENT_SOURCE = "synthetic-enhancement";

    private final SyntheticWorkRepository syntheticWorkRepository;
    private final QuotaGuardedIsbnResolver isbnResolver;
    private final EnrichmentQueuePublisher enrichmentQueue;
    private final int defaultLimit;

    public SyntheticEnhancementService(SyntheticWorkRepository syntheticWorkRepository,
                                       QuotaGuardedIsbnResolver isbnResolver,
                                       EnrichmentQueuePublisher enrichmentQueue,
                                       @Value("${app.backfill.enhancement.batch-limit:500}") int defaultLimit) {
        this.syntheticWorkRepository = syntheticWorkRepository;
        this.isbnResolver = isbnResolver;
        this.enrichmentQueue = enrichmentQueue;
        this.defaultLimit = defaultLimit;
    }

    public SyntheticEnhancementResult enhance() {
        return enhance(defaultLimit);
    }

    public SyntheticEnhancementResult enhance(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        List<SyntheticWork> candidates = syntheticWorkRepository.findEnhancementCandidates(limit);
        ServiceContext context = ServiceContext.defaults()
            .withLogger(log)
            .withCacheNamespace(ENRICHMENT_SOURCE);

        int attempted = 0;
        int enhanced = 0;
        int notFound = 0;
        int errors = 0;
        boolean quotaStopped = false;

        for (SyntheticWork work : candidates) {
            Optional<QuotaGuardedIsbnResolver.GuardedResolution> guarded =
                isbnResolver.resolve(work.title(), work.author(), context.withMetadata("workKey", work.workKey()));
            if (guarded.isEmpty()) {
                quotaStopped = true;
                break;
            }
            attempted++;
            IsbnResolution resolution = guarded.get().resolution();
            try {
                if (resolution.resolved()) {
                    switch (promote(work, resolution)) {
                        case ENHANCED -> enhanced++;
                        case ISBN_TAKEN -> notFound++;
                        case QUEUE_FAILED -> errors++;
                    }
                } else if (resolution.quotaExhausted()) {
                    quotaStopped = true;
                    break;
                } else {
                    syntheticWorkRepository.markSyncAttempt(work.workKey());
                    notFound++;
                }
            } catch (BackfillPersistenceException e) {
                errors++;
                log.error("[BACKFILL] Enhancement of {} failed", work.workKey(), e);
            }
        }

        if (quotaStopped) {
            log.warn("[BACKFILL] Synthetic enhancement stopped by quota after {} of {} works", attempted, candidates.size());
        }
        log.info("[BACKFILL] Synthetic enhancement: candidates={}, attempted={}, enhanced={}, notFound={}, errors={}",
            candidates.size(), attempted, enhanced, notFound, errors);
        return new SyntheticEnhancementResult(candidates.size(), attempted, enhanced, notFound, errors, quotaStopped);
    }

    private Promotion promote(SyntheticWork work, IsbnResolution resolution) {
        String isbn = resolution.match().isbn();
        try {
            enrichmentQueue.enqueue(List.of(isbn), ENRICHMENT_SOURCE, EnrichmentQueuePublisher.PRIORITY_LOW, null);
        } catch (QueuePublishException e) {
            log.error("[BACKFILL] Could not queue {} for {}; work left synthetic", isbn, work.workKey(), e);
            syntheticWorkRepository.markSyncAttempt(work.workKey());
            return Promotion.QUEUE_FAILED;
        }
        return syntheticWorkRepository.markEnhanced(work.workKey(), isbn, resolution.source(), resolution.confidence())
            ? Promotion.ENHANCED
            : Promotion.ISBN_TAKEN;
    }

    private enum Promotion {
        ENHANCED,
        /** The ISBN is already an edition of another work. */
        ISBN_TAKEN,
        QUEUE_FAILED
    }
}
