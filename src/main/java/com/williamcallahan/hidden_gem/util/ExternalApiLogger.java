package com.williamcallahan.hidden_gem.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to third-party media providers
 *
 * Every line carries the {@code [EXTERNAL-API]} prefix so provider traffic can be grepped out of the
 * application log in one pass.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info("{} [{}] ATTEMPT: {} for query='{}'", PREFIX, apiName, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    /**
     * Log circuit breaker blocking an API call
     */
    public static void logCircuitBreakerBlocked(Logger log, String apiName, String query) {
        log.info("{} [{}] CIRCUIT-BREAKER-OPEN: Blocking call for query='{}'", PREFIX, apiName, query);
    }

    /**
     * Log a provider skipped because it has no API key configured
     */
    public static void logProviderDisabled(Logger log, String apiName, String query) {
        log.debug("{} [{}] DISABLED: No API key configured, skipping query='{}'", PREFIX, apiName, query);
    }

    /**
     * Log the start of a provider walk for one game
     */
    public static void logResolutionStart(Logger log, String game, int covers, int screenshots) {
        log.info("{} [RESOLVE] START: game='{}', coversNeeded={}, screenshotsNeeded={}", PREFIX, game, covers, screenshots);
    }

    /**
     * Log the end of a provider walk for one game
     */
    public static void logResolutionComplete(Logger log, String game, int added, int remaining) {
        log.info("{} [RESOLVE] COMPLETE: game='{}', imagesAdded={}, stillMissing={}", PREFIX, game, added, remaining);
    }

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String method, String url) {
        log.debug("{} [HTTP] {} request to: {}", PREFIX, method, url);
    }
}
