package com.williamcallahan.bibliography_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to external bibliographic sources.
 *
 * These logs help debug the reconciliation lookup chain:
 * - batch bibcode lookups
 * - identifier lookups (DOI, arXiv)
 * - heuristic smart-search strategies
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info(String.format("%s [%s] ATTEMPT: %s for query='%s'", PREFIX, apiName, operation, query));
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
     * Log a smart-search strategy outcome
     */
    public static void logSearchStrategy(Logger log, String apiName, String strategy, String query, double similarity, boolean accepted) {
        log.debug(String.format("%s [%s] STRATEGY %s: query='%s', similarity=%.2f, accepted=%s",
            PREFIX, apiName, strategy, query, similarity, accepted));
    }

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String method, String url) {
        log.debug(String.format("%s [HTTP] %s request to: %s", PREFIX, method, url));
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url, int bodySize) {
        log.debug(String.format("%s [HTTP] Response: status=%d, url=%s, bodySize=%d bytes",
            PREFIX, statusCode, url, bodySize));
    }
}
