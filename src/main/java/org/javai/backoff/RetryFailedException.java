package org.javai.backoff;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * The operation's last error is attached as the cause.
 */
public class RetryFailedException extends RuntimeException {

    private final RetryFailure failure;

    public RetryFailedException(RetryFailure failure) {
        super(failure.describe(), failure.lastError());
        this.failure = failure;
    }

    public RetryFailure failure() {
        return failure;
    }

    public FailureReason reason() {
        return failure.reason();
    }
}
