package net.bookharvest.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the daily paid-provider budget.
 */
public record QuotaStatus(@JsonProperty("used_today") long usedToday,
                          @JsonProperty("remaining") long remaining,
                          @JsonProperty("limit") long limit,
                          @JsonProperty("safety_buffer") long safetyBuffer,
                          @JsonProperty("buffer_remaining") long bufferRemaining,
                          @JsonProperty("last_reset") String lastReset,
                          @JsonProperty("next_reset_in_hours") long nextResetInHours,
                          @JsonProperty("can_make_calls") boolean canMakeCalls) {

    /**
     * Status reported when the store cannot be read. Denies everything.
     */
    static QuotaStatus unavailable(long limit, long safetyBuffer, long nextResetInHours) {
        return new QuotaStatus(0, 0, limit, safetyBuffer, 0, "unknown", nextResetInHours, false);
    }
}
