package org.javai.backoff.retry;

import java.time.Duration;

/**
 * Notified synchronously after a retryable failure, before the executor waits.
 * Called at most {@code maxAttempts - 1} times per run.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param error the error the operation just threw
     * @param wait how long the executor is about to wait before the next attempt
     */
    void onRetry(Throwable error, Duration wait);

    static RetryListener none() {
        return (error, wait) -> {};
    }
}
