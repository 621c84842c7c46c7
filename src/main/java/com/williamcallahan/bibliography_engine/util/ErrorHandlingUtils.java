/**
 * Utility class for standardized error handling across the application
 * Provides consistent classification and retry policies for remote lookups
 *
 * @author William Callahan
 */

package com.williamcallahan.bibliography_engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

public class ErrorHandlingUtils {

    // Gateway-style failures that usually clear up on a second attempt
    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(500, 502, 503);

    /**
     * Standard error categorization for consistent handling
     */
    public enum ErrorCategory {
        TIMEOUT,
        RATE_LIMIT,
        REMOTE_HTTP,
        SERIALIZATION,
        VALIDATION,
        GENERAL
    }

    /**
     * Categorize an exception into standard error types
     */
    public static ErrorCategory categorizeError(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.GENERAL;
        }
        if (throwable instanceof TimeoutException) {
            return ErrorCategory.TIMEOUT;
        } else if (throwable instanceof RequestNotPermitted) {
            return ErrorCategory.RATE_LIMIT;
        } else if (throwable instanceof WebClientResponseException wcre) {
            return wcre.getStatusCode().value() == 429 ? ErrorCategory.RATE_LIMIT : ErrorCategory.REMOTE_HTTP;
        } else if (throwable instanceof WebClientRequestException || throwable instanceof IOException) {
            return ErrorCategory.REMOTE_HTTP;
        } else if (throwable instanceof DecodingException
                || throwable instanceof JsonProcessingException) {
            return ErrorCategory.SERIALIZATION;
        } else if (throwable instanceof IllegalArgumentException) {
            return ErrorCategory.VALIDATION;
        } else if (throwable.getMessage() != null && throwable.getMessage().contains("Rate limit")) {
            return ErrorCategory.RATE_LIMIT;
        } else if (throwable.getCause() != null && throwable.getCause() != throwable) {
            return categorizeError(throwable.getCause());
        }
        return ErrorCategory.GENERAL;
    }

    /**
     * Human-readable message for per-item error reports. Keeps the underlying message intact.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        if (throwable instanceof WebClientResponseException wcre) {
            return "HTTP " + wcre.getStatusCode().value() + ": " + wcre.getStatusText();
        }
        String message = throwable.getMessage();
        return ValidationUtils.hasText(message) ? message : throwable.getClass().getSimpleName();
    }

    /**
     * Check if an error is retryable. Rate limiting is deliberately not retried.
     */
    public static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException wcre) {
            return RETRYABLE_STATUSES.contains(wcre.getStatusCode().value());
        }
        return throwable instanceof WebClientRequestException
            || throwable instanceof IOException
            || throwable instanceof TimeoutException;
    }

    /**
     * Create WebClient retry specification
     * @param logger Logger instance
     * @param operation Operation name for logging
     * @param maxAttempts Maximum retry attempts
     * @param firstBackoff Initial backoff duration
     */
    public static Retry createWebClientRetry(Logger logger, String operation, int maxAttempts, Duration firstBackoff) {
        return Retry.backoff(maxAttempts, firstBackoff)
                .maxBackoff(Duration.ofSeconds(10))
                .jitter(0.5)
                .filter(ErrorHandlingUtils::isRetryable)
                .doBeforeRetry(retrySignal -> logger.warn("Retrying {} after error. Attempt #{}/{}. Error: {}",
                        operation, retrySignal.totalRetries() + 1, maxAttempts, describe(retrySignal.failure())))
                .onRetryExhaustedThrow((retryBackoffSpec, retrySignal) -> {
                    logger.error("All {} retries failed for {}. Final error: {}",
                            maxAttempts, operation, describe(retrySignal.failure()));
                    return retrySignal.failure();
                });
    }
}
