package net.bookharvest.support.queue;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Work item for one month of backfill.
 */
public record BackfillJobMessage(@JsonProperty("job_id") String jobId,
                                 @JsonProperty("year") int year,
                                 @JsonProperty("month") int month,
                                 @JsonProperty("batch_size") int batchSize,
                                 @JsonProperty("prompt_variant") String promptVariant,
                                 @JsonProperty("dry_run") boolean dryRun) {

    public BackfillJobMessage {
        Objects.requireNonNull(jobId, "jobId");
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be within 1..12: " + month);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
    }

    public String label() {
        return String.format("%04d-%02d", year, month);
    }
}
