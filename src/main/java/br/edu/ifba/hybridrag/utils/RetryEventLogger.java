package br.edu.ifba.hybridrag.utils;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for application-level retry loops, such as the optimistic
 * re-read of feedback records.
 *
 * <p>MDC keys set for the duration of each log call:</p>
 * <ul>
 *   <li><code>retry.operation</code> - the operation being retried</li>
 *   <li><code>retry.attempt</code> - attempt number (1-based)</li>
 *   <li><code>retry.exception</code> - simple name of the failure that triggered the retry</li>
 * </ul>
 */
@ApplicationScoped
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    private static final String MDC_RETRY_OPERATION = "retry.operation";
    private static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    private static final String MDC_RETRY_EXCEPTION = "retry.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final String reason) {
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
            MDC.put(MDC_RETRY_EXCEPTION, reason);

            logger.warn("Retry attempt {}/{} for {}: {}", attempt, maxAttempts, operation, truncateMessage(reason));
        } finally {
            clearMDC();
        }
    }

    public void logRetryExhausted(final String operation, final int totalAttempts, final String reason) {
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            MDC.put(MDC_RETRY_EXCEPTION, reason);

            logger.warn("Retry exhausted for {} after {} attempts: {}", operation, totalAttempts, truncateMessage(reason));
        } finally {
            clearMDC();
        }
    }

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

    private String truncateMessage(final String message) {
        if (message == null) {
            return "null";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
