package net.bookharvest.domain.backfill;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of one backfill month. {@link #COMPLETED} and {@link #FAILED} are terminal and are the
 * only statuses that carry a {@code completed_at} timestamp.
 */
public enum BackfillStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    RETRY;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static BackfillStatus fromDbValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
