package net.bookharvest.application.provider;

import net.bookharvest.domain.backfill.CandidateBook;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merged output of a generation round.
 *
 * @param books          deduplicated candidates in provider priority order
 * @param rawCount       candidates before deduplication
 * @param providerCalls  calls made per provider id
 * @param failureReason  set when no provider produced anything, or none is registered at all
 */
public record BookGenerationResult(List<CandidateBook> books,
                                   int rawCount,
                                   Map<String, Integer> providerCalls,
                                   String failureReason) {

    public static final String NO_PROVIDER_SUCCEEDED = "no provider succeeded";
    public static final String NO_PROVIDER_REGISTERED = "no generation provider registered";

    public BookGenerationResult {
        books = books == null ? List.of() : List.copyOf(books);
        providerCalls = providerCalls == null ? Map.of() : Map.copyOf(providerCalls);
    }

    public static BookGenerationResult failed(Map<String, Integer> providerCalls) {
        return new BookGenerationResult(List.of(), 0, providerCalls, NO_PROVIDER_SUCCEEDED);
    }

    public static BookGenerationResult unconfigured() {
        return new BookGenerationResult(List.of(), 0, Map.of(), NO_PROVIDER_REGISTERED);
    }

    public boolean succeeded() {
        return failureReason == null;
    }

    /**
     * True when generation could not run because nothing is registered for the capability.
     * Provider failures and timeouts are not configuration errors.
     */
    public boolean configurationError() {
        return NO_PROVIDER_REGISTERED.equals(failureReason);
    }

    public Optional<String> failure() {
        return Optional.ofNullable(failureReason);
    }

    public int callsTo(String providerId) {
        return providerCalls.getOrDefault(providerId, 0);
    }
}
