package org.javai.backoff;

/**
 * Why a retried operation ended without success.
 * Exactly one reason applies to every failed run.
 */
public enum FailureReason {
    /**
     * The operation failed with an error the classifier judged not worth retrying.
     * Examples: validation errors, unknown host, explicit permanent marker.
     */
    NON_RETRYABLE,

    /**
     * Every permitted attempt failed with a retryable error.
     */
    EXHAUSTED,

    /**
     * The cancellation token fired while waiting between attempts.
     */
    CANCELLED
}
