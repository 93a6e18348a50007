package org.javai.backoff.ops;

import org.javai.backoff.RetryFailure;

import java.time.Duration;

/**
 * Reports retry activity for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 */
public interface RetryReporter {

    /**
     * Reports that an attempt failed and another will follow after a wait.
     *
     * @param operation The operation name
     * @param attemptNumber The attempt that just failed (1-based)
     * @param error The error the attempt threw
     * @param wait The wait before the next attempt
     */
    default void reportRetryAttempt(String operation, int attemptNumber, Throwable error, Duration wait) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a run ended without success.
     *
     * @param operation The operation name
     * @param failure The terminal failure, with its reason and last error
     */
    default void reportFailure(String operation, RetryFailure failure) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing.
     */
    static RetryReporter noOp() {
        return new RetryReporter() {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static RetryReporter composite(RetryReporter... reporters) {
        return CompositeRetryReporter.of(reporters);
    }
}
