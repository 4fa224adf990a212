package net.bookharvest.application.provider;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate result of an ISBN fallback chain.
 *
 * <p>{@code source} is the winning provider id, or one of {@link #SOURCE_NONE},
 * {@link #SOURCE_ALL_FAILED} and {@link #SOURCE_QUOTA_EXHAUSTED}.</p>
 */
public record IsbnResolution(IsbnMatch match, String source, List<ProviderAttempt> attempts) {

    public static final String SOURCE_NONE = "none";
    public static final String SOURCE_ALL_FAILED = "all-failed";
    public static final String SOURCE_QUOTA_EXHAUSTED = "quota-exhausted";

    public IsbnResolution {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public boolean resolved() {
        return match != null;
    }

    public Optional<String> isbn() {
        return match == null ? Optional.empty() : Optional.of(match.isbn());
    }

    public int confidence() {
        return match == null ? 0 : match.confidence();
    }

    public boolean quotaExhausted() {
        return SOURCE_QUOTA_EXHAUSTED.equals(source);
    }

    /**
     * Whether the named provider was actually called (as opposed to skipped or rejected by budget).
     */
    public boolean called(String providerId) {
        return attempts.stream()
            .anyMatch(attempt -> attempt.provider().equals(providerId) && !attempt.outcome().isBudgetSignal());
    }
}
