package net.bookharvest.application.backfill;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of one queued month job as reported to operators.
 */
public enum BackfillJobState {
    QUEUED,
    PROCESSING,
    ENRICHING,
    COMPLETE,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BackfillJobState fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
