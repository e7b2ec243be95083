package com.williamcallahan.cinema_lookup.util;

import org.slf4j.Logger;

/**
 * Centralized logging for external API calls made while resolving a lookup.
 *
 * These logs help debug the fallback flow:
 * - Disk cache (short circuit)
 * - POMS (primary)
 * - TMDB alternate titles retried against POMS
 * - Web search engines + cinema.nl page scrape (final fallback)
 */
public class ExternalApiLogger {

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
     * Log a search engine answering with a bot challenge
     */
    public static void logBotProtection(Logger log, String engine, String query, String signature) {
        log.warn("{} [{}] BOT-PROTECTION: {} for query='{}', abandoning engine for this lookup", PREFIX, engine, signature, query);
    }

    /**
     * Log the start of a lookup
     */
    public static void logLookupStart(Logger log, String query, Integer year, String externalId, String mediaType) {
        log.info("{} [LOOKUP] START: query='{}', year={}, externalId={}, mediaType={}",
            PREFIX, query, year, externalId, mediaType);
    }

    /**
     * Log the completion of a lookup
     */
    public static void logLookupComplete(Logger log, String query, String status, String method, long durationMs) {
        log.info("{} [LOOKUP] COMPLETE: query='{}', status={}, method={}, duration={}ms",
            PREFIX, query, status, method, durationMs);
    }
}
