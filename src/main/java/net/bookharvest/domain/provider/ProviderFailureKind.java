package net.bookharvest.domain.provider;

/**
 * Classification of a failed provider call.
 *
 * <p>Fatal kinds disable the provider for the rest of the invocation; every other kind lets
 * a fallback chain move on to the next provider.</p>
 */
public enum ProviderFailureKind {
    TIMEOUT(false),
    RATE_LIMITED(false),
    QUOTA_EXHAUSTED(false),
    NOT_FOUND(false),
    UPSTREAM(false),
    INVALID_RESPONSE(false),
    AUTHENTICATION(true),
    CONFIGURATION(true);

    private final boolean fatal;

    ProviderFailureKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }

    /**
     * Whether the failure signals an exhausted paid budget rather than a broken provider.
     */
    public boolean isBudgetSignal() {
        return this == RATE_LIMITED || this == QUOTA_EXHAUSTED;
    }
}
