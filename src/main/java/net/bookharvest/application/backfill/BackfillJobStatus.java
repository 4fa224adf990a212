package net.bookharvest.application.backfill;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Operator-facing status document for a month job. Timestamps are ISO-8601 UTC strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackfillJobStatus(@JsonProperty("job_id") String jobId,
                                @JsonProperty("year") int year,
                                @JsonProperty("month") int month,
                                @JsonProperty("status") BackfillJobState status,
                                @JsonProperty("progress") String progress,
                                @JsonProperty("stats") Map<String, Number> stats,
                                @JsonProperty("dry_run") boolean dryRun,
                                @JsonProperty("prompt_variant") String promptVariant,
                                @JsonProperty("error") String error,
                                @JsonProperty("created_at") String createdAt,
                                @JsonProperty("updated_at") String updatedAt,
                                @JsonProperty("completed_at") String completedAt,
                                @JsonProperty("duration_ms") Long durationMs) {

    public BackfillJobStatus {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    BackfillJobStatus advance(BackfillJobState newStatus, String newProgress, String now) {
        return new BackfillJobStatus(jobId, year, month, newStatus, newProgress, stats, dryRun, promptVariant,
            error, createdAt, now, completedAt, durationMs);
    }

    BackfillJobStatus finish(BackfillJobState finalStatus, String newProgress, Map<String, Number> finalStats,
                             String failure, String now, long elapsedMillis) {
        return new BackfillJobStatus(jobId, year, month, finalStatus, newProgress, finalStats, dryRun, promptVariant,
            failure, createdAt, now, now, elapsedMillis);
    }
}
