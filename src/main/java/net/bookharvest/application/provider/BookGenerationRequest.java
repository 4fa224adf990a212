package net.bookharvest.application.provider;

import java.util.Objects;

/**
 * Input for one generation round.
 *
 * @param year          target publication year
 * @param month         target month 1..12, or {@code null} for annual prompts
 * @param limit         how many books to ask for
 * @param promptVariant prompt variant name, see {@link BookGenerationPrompts}
 */
public record BookGenerationRequest(int year, Integer month, int limit, String promptVariant) {

    public BookGenerationRequest {
        Objects.requireNonNull(promptVariant, "promptVariant");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("month must be 1..12: " + month);
        }
    }
}
