package net.bookharvest.application.backfill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.support.kv.KeyValueFallbacks;
import net.bookharvest.support.kv.KeyValueStore;
import net.bookharvest.support.kv.KeyValueStoreException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keeps {@link BackfillJobStatus} documents in the shared store for seven days.
 *
 * <p>Creation must succeed for a job to be published. Later updates are best effort: a lost
 * progress update never fails the month itself.</p>
 */
@Component
@Slf4j
public class BackfillJobStatusStore {

    static final String KEY_PREFIX = "backfill:job:";
    static final Duration TTL = Duration.ofDays(7);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BackfillJobStatusStore(KeyValueStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws KeyValueStoreException when the document cannot be written
     */
    public BackfillJobStatus create(String jobId, int year, int month, String promptVariant, boolean dryRun) {
        String now = Instant.now(clock).toString();
        BackfillJobStatus status = new BackfillJobStatus(jobId, year, month, BackfillJobState.QUEUED,
            "Job queued for processing", Map.of(), dryRun, promptVariant, null, now, now, null, null);
        write(status);
        return status;
    }

    public Optional<BackfillJobStatus> find(String jobId) {
        Optional<String> raw = KeyValueFallbacks.execute(log, () -> store.get(KEY_PREFIX + jobId),
            "read job status " + jobId, Optional.empty());
        return raw.flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, BackfillJobStatus.class));
            } catch (JsonProcessingException e) {
                log.warn("[BACKFILL] Unreadable status document for job {}: {}", jobId, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    public boolean markProgress(String jobId, BackfillJobState state, String progress) {
        String now = Instant.now(clock).toString();
        return update(jobId, status -> status.advance(state, progress, now));
    }

    public boolean markComplete(String jobId, String progress, Map<String, Number> stats, Instant startedAt) {
        Instant now = Instant.now(clock);
        return update(jobId, status -> status.finish(BackfillJobState.COMPLETE, progress, stats, null,
            now.toString(), Duration.between(startedAt, now).toMillis()));
    }

    public boolean markFailed(String jobId, String error, Instant startedAt) {
        Instant now = Instant.now(clock);
        return update(jobId, status -> status.finish(BackfillJobState.FAILED, "Job failed", status.stats(), error,
            now.toString(), Duration.between(startedAt, now).toMillis()));
    }

    private boolean update(String jobId, UnaryOperator<BackfillJobStatus> change) {
        Optional<BackfillJobStatus> existing = find(jobId);
        if (existing.isEmpty()) {
            log.warn("[BACKFILL] Job {} has no status document; update skipped", jobId);
            return false;
        }
        BackfillJobStatus updated = change.apply(existing.get());
        return KeyValueFallbacks.run(log, () -> write(updated), "update job status " + jobId);
    }

    private void write(BackfillJobStatus status) {
        try {
            store.set(KEY_PREFIX + status.jobId(), objectMapper.writeValueAsString(status), TTL);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize status for job " + status.jobId(), e);
        }
    }
}
