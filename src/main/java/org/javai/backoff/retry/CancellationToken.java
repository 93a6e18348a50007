package org.javai.backoff.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A cooperative signal by which a caller asks a retry run to stop waiting.
 *
 * <p>The token fires once, either when {@link #cancel()} is called or when its deadline
 * passes. The first cause wins. Tokens are thread-safe: typically one thread cancels
 * while another waits.</p>
 *
 * <pre>{@code
 * CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(30));
 * Outcome<Quote> quote = executor.run(token, policy, () -> pricing.quote(request));
 * }</pre>
 */
public final class CancellationToken {

    private static final long NO_DEADLINE = 0L;
    // Keeps nanoTime arithmetic clear of overflow (about 73 years)
    private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 4;
    private static final CancellationToken NONE = new CancellationToken(false, NO_DEADLINE);

    private final boolean cancellable;
    private final long deadlineNanos;
    private final CountDownLatch fired = new CountDownLatch(1);
    private final AtomicReference<Throwable> cause = new AtomicReference<>();

    private CancellationToken(boolean cancellable, long deadlineNanos) {
        this.cancellable = cancellable;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Creates a token that fires only when cancelled explicitly.
     */
    public static CancellationToken create() {
        return new CancellationToken(true, NO_DEADLINE);
    }

    /**
     * Returns a shared token that never fires.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Creates a token that fires once {@code timeout} has elapsed, or earlier if cancelled.
     *
     * @param timeout time from now until the token fires
     */
    public static CancellationToken withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        long timeoutNanos = Math.min(Math.max(0, saturatedNanos(timeout)), MAX_TIMEOUT_NANOS);
        long deadline = System.nanoTime() + timeoutNanos;
        // 0 is reserved for "no deadline"
        return new CancellationToken(true, deadline == NO_DEADLINE ? 1L : deadline);
    }

    /**
     * Fires the token with a generic cancellation cause.
     *
     * @return true if this call fired the token, false if it had already fired
     */
    public boolean cancel() {
        return cancel(new CancellationException("cancelled"));
    }

    /**
     * Fires the token with the given cause.
     *
     * @param reason why the token fired
     * @return true if this call fired the token, false if it had already fired
     * @throws IllegalStateException if this is the {@link #none()} token
     */
    public boolean cancel(Throwable reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        if (!cancellable) {
            throw new IllegalStateException("CancellationToken.none() cannot be cancelled");
        }
        if (cause.compareAndSet(null, reason)) {
            fired.countDown();
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        if (fired.getCount() == 0) {
            return true;
        }
        if (hasDeadline() && System.nanoTime() - deadlineNanos >= 0) {
            expire();
            return true;
        }
        return false;
    }

    /**
     * Returns why the token fired, or empty if it has not.
     */
    public Optional<Throwable> cause() {
        isCancelled();
        return Optional.ofNullable(cause.get());
    }

    /**
     * Blocks until the token fires or {@code timeout} elapses, whichever comes first.
     *
     * @param timeout the longest time to wait
     * @return true if the token fired, false if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (isCancelled()) {
            return true;
        }
        long waitNanos = Math.max(0, saturatedNanos(timeout));
        if (hasDeadline()) {
            long untilDeadline = deadlineNanos - System.nanoTime();
            if (untilDeadline <= waitNanos) {
                if (!fired.await(Math.max(0, untilDeadline), TimeUnit.NANOSECONDS)) {
                    expire();
                }
                return true;
            }
        }
        return fired.await(waitNanos, TimeUnit.NANOSECONDS);
    }

    private boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    private void expire() {
        if (cause.compareAndSet(null, new CancellationException("deadline exceeded"))) {
            fired.countDown();
        }
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
