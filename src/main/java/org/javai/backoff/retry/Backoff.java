package org.javai.backoff.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the wait between a failed attempt and the next one.
 *
 * <p>The wait is {@code initialWait * growthFactor^attemptIndex}, capped at {@code maxWait},
 * then perturbed by up to half of {@code jitterFraction} of itself in either direction.
 * With a jitter fraction of zero the result is exact and deterministic.</p>
 *
 * <p>Random values come from the supplied source, which must yield uniform doubles in
 * {@code [0, 1)}. The default draws from {@link ThreadLocalRandom} on every call, so
 * concurrent runs never share generator state.</p>
 */
public final class Backoff {

    private final DoubleSupplier random;

    public Backoff() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public Backoff(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Computes the wait preceding attempt {@code attemptIndex + 2}.
     *
     * @param attemptIndex 0 for the wait after the first failure
     * @param policy the backoff shape
     * @return a non-negative wait
     */
    public Duration computeWait(int attemptIndex, RetryPolicy policy) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, was: " + attemptIndex);
        }
        Objects.requireNonNull(policy, "policy must not be null");

        double initial = saturatedNanos(policy.initialWait());
        double max = saturatedNanos(policy.maxWait());

        double capped = Math.min(grow(initial, policy.growthFactor(), attemptIndex), max);

        double u = random.getAsDouble() - 0.5;
        double jittered = capped + u * policy.jitterFraction() * capped;
        if (jittered <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(Math.round(jittered));
    }

    // Infinite for large indices, which the cap then absorbs
    private static double grow(double initial, double growthFactor, int attemptIndex) {
        if (initial == 0 || growthFactor == 1.0) {
            return initial;
        }
        double raw = initial * Math.pow(growthFactor, attemptIndex);
        return Double.isNaN(raw) ? Double.POSITIVE_INFINITY : raw;
    }

    private static double saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
