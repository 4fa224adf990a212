package net.bookharvest.application.provider;

import net.bookharvest.domain.provider.ProviderException;

/**
 * Outcome of one provider attempt in a fallback chain.
 */
public enum AttemptOutcome {
    FOUND,
    NOT_FOUND,
    TIMEOUT,
    RATE_LIMITED,
    QUOTA_EXHAUSTED,
    FATAL,
    ERROR;

    static AttemptOutcome from(ProviderException failure) {
        if (failure.isFatal()) {
            return FATAL;
        }
        return switch (failure.kind()) {
            case TIMEOUT -> TIMEOUT;
            case RATE_LIMITED -> RATE_LIMITED;
            case QUOTA_EXHAUSTED -> QUOTA_EXHAUSTED;
            case NOT_FOUND -> NOT_FOUND;
            default -> ERROR;
        };
    }

    public boolean isFailure() {
        return this != FOUND && this != NOT_FOUND;
    }

    public boolean isBudgetSignal() {
        return this == RATE_LIMITED || this == QUOTA_EXHAUSTED;
    }
}
