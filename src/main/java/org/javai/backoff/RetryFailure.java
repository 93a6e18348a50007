package org.javai.backoff;

import java.util.Objects;

/**
 * The terminal failure of a retried operation.
 * One record per {@link FailureReason}; each carries the error that ended the run.
 */
public sealed interface RetryFailure
        permits RetryFailure.NonRetryable, RetryFailure.Exhausted, RetryFailure.Cancelled {

    /**
     * The reason the run ended.
     */
    FailureReason reason();

    /**
     * The last error thrown by the operation. Never null.
     */
    Throwable lastError();

    /**
     * How many times the operation was invoked.
     */
    int attempts();

    /**
     * Human-readable summary, used as the message of {@link RetryFailedException}.
     */
    String describe();

    /**
     * The operation failed with an error that is not retryable.
     *
     * @param lastError the first disqualifying error
     * @param attempts invocations performed, including the failing one
     */
    record NonRetryable(Throwable lastError, int attempts) implements RetryFailure {
        public NonRetryable {
            Objects.requireNonNull(lastError, "lastError must not be null");
            requirePositive(attempts);
        }

        @Override
        public FailureReason reason() {
            return FailureReason.NON_RETRYABLE;
        }

        @Override
        public String describe() {
            return "not retryable error: " + messageOf(lastError);
        }
    }

    /**
     * Every permitted attempt failed.
     *
     * @param lastError the error from the final attempt
     * @param attempts invocations performed, equal to the policy's maxAttempts
     */
    record Exhausted(Throwable lastError, int attempts) implements RetryFailure {
        public Exhausted {
            Objects.requireNonNull(lastError, "lastError must not be null");
            requirePositive(attempts);
        }

        @Override
        public FailureReason reason() {
            return FailureReason.EXHAUSTED;
        }

        @Override
        public String describe() {
            return "retries exceeded after " + attempts + " attempts: " + messageOf(lastError);
        }
    }

    /**
     * The cancellation token fired during a backoff wait.
     *
     * @param lastError the error from the attempt preceding the wait
     * @param attempts invocations performed before cancellation
     * @param cancellationCause why the token fired (may be null)
     */
    record Cancelled(Throwable lastError, int attempts, Throwable cancellationCause) implements RetryFailure {
        public Cancelled {
            Objects.requireNonNull(lastError, "lastError must not be null");
            requirePositive(attempts);
        }

        @Override
        public FailureReason reason() {
            return FailureReason.CANCELLED;
        }

        @Override
        public String describe() {
            return "cancelled after " + attempts + " attempts: " + messageOf(lastError);
        }
    }

    private static void requirePositive(int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, was: " + attempts);
        }
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
