package net.bookharvest.adapters.provider;

import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import net.bookharvest.domain.provider.ProviderException;
import net.bookharvest.domain.provider.ProviderFailureKind;

/**
 * Thrown when a generative provider call or its response parsing fails.
 *
 * <p>Carries a {@link ProviderFailureKind} derived from the SDK error so the fan-out and the job
 * processor can tell a bad key from a transient outage.</p>
 */
public class BookGenerationException extends ProviderException {

    public BookGenerationException(String providerId, ProviderFailureKind kind, String message) {
        super(providerId, kind, message);
    }

    public BookGenerationException(String providerId, ProviderFailureKind kind, String message, Throwable cause) {
        super(providerId, kind, message, cause);
    }

    static BookGenerationException fromSdk(String providerId, OpenAIException ex) {
        return new BookGenerationException(providerId, classify(ex), describeApiError(ex), ex);
    }

    static ProviderFailureKind classify(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            return switch (serviceException.statusCode()) {
                case 401, 403 -> ProviderFailureKind.AUTHENTICATION;
                case 404 -> ProviderFailureKind.CONFIGURATION;
                case 429 -> ProviderFailureKind.RATE_LIMITED;
                case 408 -> ProviderFailureKind.TIMEOUT;
                default -> ProviderFailureKind.UPSTREAM;
            };
        }
        if (ex instanceof OpenAIIoException) {
            return ProviderFailureKind.TIMEOUT;
        }
        return ProviderFailureKind.UPSTREAM;
    }

    /**
     * Formats an OpenAI SDK exception into a concise description with HTTP status
     * code and human-readable explanation when available.
     */
    public static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 400 -> "bad request";
                case 401 -> "unauthorized, check API key";
                case 403 -> "access denied";
                case 404 -> "not found, check base URL and model name";
                case 429 -> "rate limited";
                case 500, 502, 503 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
