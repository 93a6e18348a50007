package org.javai.backoff.retry;

import java.time.Duration;

/**
 * Waits between attempts. Swapped out in tests to avoid real sleeps.
 */
@FunctionalInterface
interface Waiter {

    /**
     * Waits for {@code duration} unless the token fires first.
     *
     * @return true if the token fired during the wait
     */
    boolean await(CancellationToken token, Duration duration) throws InterruptedException;

    static Waiter blocking() {
        return CancellationToken::await;
    }
}
