package org.javai.backoff.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration of attempt budget and backoff shape.
 * A policy holds no mutable state and may be shared by any number of concurrent runs.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .initialWait(Duration.ofMillis(100))
 *     .maxWait(Duration.ofSeconds(5))
 *     .growthFactor(2.0)
 *     .jitterFraction(0.1)
 *     .build();
 * }</pre>
 *
 * @param maxAttempts total invocations of the operation, including the first (at least 1)
 * @param initialWait wait after the first failure
 * @param maxWait ceiling applied before jitter; a value below initialWait simply caps every wait
 * @param growthFactor multiplier applied per attempt (at least 1.0)
 * @param jitterFraction fraction of the wait randomized symmetrically around it, in [0, 1]
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialWait,
        Duration maxWait,
        double growthFactor,
        double jitterFraction
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        Objects.requireNonNull(initialWait, "initialWait must not be null");
        Objects.requireNonNull(maxWait, "maxWait must not be null");
        if (initialWait.isNegative()) {
            throw new IllegalArgumentException("initialWait must not be negative");
        }
        if (maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be negative");
        }
        if (!(growthFactor >= 1.0) || Double.isInfinite(growthFactor)) {
            throw new IllegalArgumentException("growthFactor must be a finite value >= 1.0, was: " + growthFactor);
        }
        if (!(jitterFraction >= 0.0 && jitterFraction <= 1.0)) {
            throw new IllegalArgumentException("jitterFraction must be in [0, 1], was: " + jitterFraction);
        }
    }

    /**
     * Three attempts, 10ms waits, growth 1.5, 10% jitter.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(10), 1.5, 0.1);
    }

    /**
     * A policy that invokes the operation once and never retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Constant waits of the given length, without jitter.
     */
    public static RetryPolicy fixed(int maxAttempts, Duration wait) {
        return new RetryPolicy(maxAttempts, wait, wait, 1.0, 0.0);
    }

    /**
     * Doubling waits from {@code initialWait} up to {@code maxWait}, with 10% jitter.
     */
    public static RetryPolicy exponential(int maxAttempts, Duration initialWait, Duration maxWait) {
        return new RetryPolicy(maxAttempts, initialWait, maxWait, 2.0, 0.1);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialWait, maxWait, growthFactor, jitterFraction);
    }

    public RetryPolicy withJitterFraction(double jitterFraction) {
        return new RetryPolicy(maxAttempts, initialWait, maxWait, growthFactor, jitterFraction);
    }

    /**
     * Creates a builder starting from {@link #defaults()}.
     */
    public static Builder builder() {
        return new Builder(defaults());
    }

    /**
     * Creates a builder starting from this policy's values.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private int maxAttempts;
        private Duration initialWait;
        private Duration maxWait;
        private double growthFactor;
        private double jitterFraction;

        private Builder(RetryPolicy start) {
            this.maxAttempts = start.maxAttempts;
            this.initialWait = start.initialWait;
            this.maxWait = start.maxWait;
            this.growthFactor = start.growthFactor;
            this.jitterFraction = start.jitterFraction;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialWait(Duration initialWait) {
            this.initialWait = initialWait;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder growthFactor(double growthFactor) {
            this.growthFactor = growthFactor;
            return this;
        }

        public Builder jitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
            return this;
        }

        /**
         * Builds the policy.
         *
         * @throws IllegalArgumentException if a value is out of range
         */
        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialWait, maxWait, growthFactor, jitterFraction);
        }
    }
}
