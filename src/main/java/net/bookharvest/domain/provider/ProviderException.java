package net.bookharvest.domain.provider;

import java.util.Objects;

/**
 * Thrown by provider implementations and the HTTP client. Orchestrators absorb it;
 * it never reaches the backfill state machine.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;
    private final ProviderFailureKind kind;

    public ProviderException(String providerId, ProviderFailureKind kind, String message) {
        this(providerId, kind, message, null);
    }

    public ProviderException(String providerId, ProviderFailureKind kind, String message, Throwable cause) {
        super("[" + providerId + "] " + kind + ": " + message, cause);
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String providerId() {
        return providerId;
    }

    public ProviderFailureKind kind() {
        return kind;
    }

    public boolean isFatal() {
        return kind.isFatal();
    }
}
