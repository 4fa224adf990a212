package net.bookharvest.application.provider;

import java.time.Duration;

/**
 * Record of one provider call made by an orchestrator.
 */
public record ProviderAttempt(String provider, AttemptOutcome outcome, String detail, Duration duration) {
}
