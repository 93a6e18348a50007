package org.javai.backoff.classify;

/**
 * Decides whether an error thrown by an operation is worth retrying.
 * Implementations must be pure: no side effects, same answer for the same error.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies an error.
     *
     * @param error the error thrown by the operation (null is never retryable)
     * @return true if the operation should be attempted again
     */
    boolean isRetryable(Throwable error);

    /**
     * The classifier used when none is configured.
     *
     * @see DefaultErrorClassifier
     */
    static ErrorClassifier defaults() {
        return DefaultErrorClassifier.INSTANCE;
    }
}
