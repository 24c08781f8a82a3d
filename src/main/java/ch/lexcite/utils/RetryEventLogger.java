package ch.lexcite.utils;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging of retry events for calls to external legal data sources.
 *
 * <p>Each event puts the following keys into the MDC for the duration of the
 * log statement:</p>
 * <ul>
 *   <li><code>retry.operation</code> - source and operation, e.g. {@code federal.getByCitation}</li>
 *   <li><code>retry.attempt</code> - attempt number (1-based)</li>
 *   <li><code>retry.exception</code> - simple name of the failure that triggered the retry</li>
 * </ul>
 *
 * <pre>
 * INFO  [RetryEventLogger] Retry attempt 2/4 for federal.search: ExternalServiceException - HTTP 503
 * WARN  [RetryEventLogger] Retry exhausted for federal.search after 4 attempts: ExternalServiceException - HTTP 503
 * INFO  [RetryEventLogger] Retry succeeded for federal.search on attempt 3
 * </pre>
 */
@ApplicationScoped
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    static final String MDC_RETRY_OPERATION = "retry.operation";
    static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    static final String MDC_RETRY_EXCEPTION = "retry.exception";

    /**
     * Attempts allowed by the source retry policy: one call plus three retries.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 4;

    static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * Logs that an attempt is about to be retried.
     *
     * @param operation the operation being retried
     * @param attempt   the attempt number about to run (1-based)
     * @param failure   the failure of the previous attempt (may be null)
     */
    public void logRetryAttempt(final String operation, final int attempt, final Throwable failure) {
        logRetryAttempt(operation, attempt, DEFAULT_MAX_ATTEMPTS, failure);
    }

    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        final String message = failure != null ? failure.getMessage() : "no message";

        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);

            logger.info("Retry attempt {}/{} for {}: {} - {}",
                attempt, maxAttempts, operation, exceptionName, truncateMessage(message));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs that an operation failed for good, either because retries ran out or
     * because the failure was permanent.
     *
     * @param operation     the operation that failed
     * @param totalAttempts the number of attempts made
     * @param failure       the final failure
     */
    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        final String message = failure != null ? failure.getMessage() : "no message";

        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);

            logger.warn("Retry exhausted for {} after {} attempts: {} - {}",
                operation, totalAttempts, exceptionName, truncateMessage(message));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs a success that needed more than one attempt. Single-attempt successes are not logged.
     */
    public void logRetrySuccess(final String operation, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));

            logger.info("Retry succeeded for {} on attempt {}", operation, totalAttempts);
        } finally {
            clearMDC();
        }
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    static String truncateMessage(final String message) {
        if (message == null) {
            return "null";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
