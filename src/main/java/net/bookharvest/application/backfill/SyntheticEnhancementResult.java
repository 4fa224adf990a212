package net.bookharvest.application.backfill;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param quotaStopped whether the pass ended early because the paid budget ran out
 */
public record SyntheticEnhancementResult(@JsonProperty("candidates") int candidates,
                                         @JsonProperty("attempted") int attempted,
                                         @JsonProperty("enhanced") int enhanced,
                                         @JsonProperty("not_found") int notFound,
                                         @JsonProperty("errors") int errors,
                                         @JsonProperty("quota_stopped") boolean quotaStopped) {
}
