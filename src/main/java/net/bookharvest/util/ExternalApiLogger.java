package net.bookharvest.util;

import org.slf4j.Logger;

/**
 * Centralized logging for external provider calls.
 *
 * These lines make the resolution and generation flows traceable in one grep:
 * - HTTP provider attempts and failures
 * - Sequential fallback progression
 * - Fan-out generation results
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String target) {
        if (log.isDebugEnabled()) {
            log.debug(String.format("%s [%s] ATTEMPT: %s %s", PREFIX, apiName, operation, target));
        }
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: %s returned %d result(s) for query='%s'",
            PREFIX, apiName, operation, resultCount, query));
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s failed for query='%s' - %s",
            PREFIX, apiName, operation, query, reason));
    }

    /**
     * Log a fallback step to the next provider in a chain
     */
    public static void logFallback(Logger log, String fromProvider, String toProvider, String reason) {
        log.info(String.format("%s [FALLBACK] %s -> %s (%s)", PREFIX, fromProvider, toProvider, reason));
    }
}
