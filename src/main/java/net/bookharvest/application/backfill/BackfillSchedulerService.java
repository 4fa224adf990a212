package net.bookharvest.application.backfill;

import lombok.extern.slf4j.Slf4j;
import net.bookharvest.domain.backfill.BackfillMonthRecord;
import net.bookharvest.domain.backfill.BackfillStatus;
import net.bookharvest.repository.BackfillLogRepository;
import net.bookharvest.support.lock.AdvisoryLockManager;
import net.bookharvest.support.queue.BackfillJobMessage;
import net.bookharvest.support.queue.BackfillJobQueue;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Picks eligible months and hands each one to the job queue.
 *
 * <p>Each month is claimed under its advisory lock: the lock serializes schedulers on different
 * instances and the guarded {@code markProcessing} update makes a second claim a no-op. The lock
 * is released as soon as the job is published; the processor takes it again when it runs.</p>
 */
@Service
@Slf4j
public class BackfillSchedulerService {

    static final Duration LOCK_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_STALE_AFTER = Duration.ofHours(1);

    private final BackfillLogRepository backfillLogRepository;
    private final AdvisoryLockManager lockManager;
    private final BackfillJobQueue jobQueue;
    private final BackfillJobStatusStore statusStore;

    public BackfillSchedulerService(BackfillLogRepository backfillLogRepository,
                                    AdvisoryLockManager lockManager,
                                    BackfillJobQueue jobQueue,
                                    BackfillJobStatusStore statusStore) {
        this.backfillLogRepository = backfillLogRepository;
        this.lockManager = lockManager;
        this.jobQueue = jobQueue;
        this.statusStore = statusStore;
    }

    public BackfillScheduleResponse schedule(BackfillScheduleRequest rawRequest) {
        BackfillScheduleRequest request = rawRequest == null ? BackfillScheduleRequest.defaults() : rawRequest.normalized();
        int startYear = request.yearRange().start();
        int endYear = request.yearRange().end();
        boolean forceRetry = request.forceRetry();

        List<BackfillMonthRecord> candidates =
            backfillLogRepository.findEligible(request.batchSize(), startYear, endYear, forceRetry);
        log.info("[BACKFILL] {} eligible months in {}..{} (batch={}, dryRun={}, forceRetry={})",
            candidates.size(), startYear, endYear, request.batchSize(), request.dryRun(), forceRetry);

        if (request.dryRun()) {
            List<BackfillScheduleResponse.ScheduledMonth> months = candidates.stream()
                .map(record -> BackfillScheduleResponse.ScheduledMonth.of(record, null))
                .toList();
            return new BackfillScheduleResponse(true, request.batchSize(), candidates.size(), months,
                statusTotals(), new BackfillScheduleResponse.ExecutionSummary(0, 0, 0));
        }

        List<BackfillScheduleResponse.ScheduledMonth> months = new ArrayList<>();
        int triggered = 0;
        int skipped = 0;
        int errors = 0;
        for (BackfillMonthRecord candidate : candidates) {
            try {
                ClaimOutcome outcome = claimAndPublish(candidate, forceRetry);
                months.add(BackfillScheduleResponse.ScheduledMonth.of(candidate, outcome.jobId()));
                switch (outcome.kind()) {
                    case TRIGGERED -> triggered++;
                    case SKIPPED -> skipped++;
                    case ERROR -> errors++;
                }
            } catch (RuntimeException e) {
                errors++;
                months.add(BackfillScheduleResponse.ScheduledMonth.of(candidate, null));
                log.error("[BACKFILL] Failed to schedule {}", candidate.label(), e);
            }
        }

        log.info("[BACKFILL] Schedule run finished: triggered={}, skipped={}, errors={}", triggered, skipped, errors);
        return new BackfillScheduleResponse(false, request.batchSize(), candidates.size(), months, statusTotals(),
            new BackfillScheduleResponse.ExecutionSummary(triggered, skipped, errors));
    }

    private ClaimOutcome claimAndPublish(BackfillMonthRecord candidate, boolean forceRetry) {
        int year = candidate.year();
        int month = candidate.month();
        if (!lockManager.tryAcquire(year, month, LOCK_TIMEOUT)) {
            log.info("[BACKFILL] {} is locked by another runner; skipping", candidate.label());
            return ClaimOutcome.skipped();
        }
        try {
            if (!backfillLogRepository.markProcessing(year, month, forceRetry)) {
                log.info("[BACKFILL] {} is no longer eligible; skipping", candidate.label());
                return ClaimOutcome.skipped();
            }
            String jobId = UUID.randomUUID().toString();
            try {
                statusStore.create(jobId, year, month, candidate.promptVariant(), false);
                jobQueue.publish(new BackfillJobMessage(jobId, year, month, candidate.batchSize(),
                    candidate.promptVariant(), false));
                return ClaimOutcome.triggered(jobId);
            } catch (RuntimeException e) {
                log.error("[BACKFILL] Failed to queue {}; recording a failed attempt", candidate.label(), e);
                backfillLogRepository.markFailedAttempt(year, month, "Failed to queue job: " + e.getMessage());
                return ClaimOutcome.error();
            }
        } finally {
            lockManager.release(year, month);
        }
    }

    /**
     * Creates pending rows for every month of the range.
     *
     * @return months inserted; zero when the range was already seeded
     */
    public int seed(int yearStart, int yearEnd) {
        if (yearStart < BackfillScheduleRequest.MIN_YEAR || yearEnd > BackfillScheduleRequest.MAX_YEAR) {
            throw new IllegalArgumentException("Seed range must be within " + BackfillScheduleRequest.MIN_YEAR
                + ".." + BackfillScheduleRequest.MAX_YEAR + ": " + yearStart + ".." + yearEnd);
        }
        return backfillLogRepository.seed(yearStart, yearEnd);
    }

    /**
     * Returns months whose runner died mid-job to the eligible pool.
     */
    public int reclaimStale(Duration olderThan) {
        Duration threshold = olderThan == null ? DEFAULT_STALE_AFTER : olderThan;
        if (threshold.isNegative() || threshold.isZero()) {
            throw new IllegalArgumentException("Stale threshold must be positive: " + threshold);
        }
        return backfillLogRepository.resetStaleProcessing(threshold);
    }

    private Map<String, Long> statusTotals() {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (Map.Entry<BackfillStatus, Long> entry : backfillLogRepository.countByStatus().entrySet()) {
            totals.put(entry.getKey().dbValue(), entry.getValue());
        }
        return totals;
    }

    private record ClaimOutcome(Kind kind, String jobId) {
        enum Kind { TRIGGERED, SKIPPED, ERROR }

        static ClaimOutcome triggered(String jobId) {
            return new ClaimOutcome(Kind.TRIGGERED, jobId);
        }

        static ClaimOutcome skipped() {
            return new ClaimOutcome(Kind.SKIPPED, null);
        }

        static ClaimOutcome error() {
            return new ClaimOutcome(Kind.ERROR, null);
        }
    }
}
