package org.javai.backoff.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class BackoffTest {

    private static final RetryPolicy NO_JITTER = new RetryPolicy(
            5, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, 0.0);

    private final Backoff backoff = new Backoff();

    @Test
    void computeWait_withoutJitter_followsExponentialTable() {
        assertThat(backoff.computeWait(0, NO_JITTER)).isEqualTo(Duration.ofMillis(100));
        assertThat(backoff.computeWait(1, NO_JITTER)).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.computeWait(2, NO_JITTER)).isEqualTo(Duration.ofMillis(400));
        assertThat(backoff.computeWait(3, NO_JITTER)).isEqualTo(Duration.ofMillis(800));
        assertThat(backoff.computeWait(10, NO_JITTER)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void computeWait_withoutJitter_matchesClosedForm() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(100), 1.5, 0.0);

        for (int attempt = 0; attempt < 20; attempt++) {
            double expectedNanos = Math.min(10_000_000 * Math.pow(1.5, attempt), 100_000_000);
            assertThat(backoff.computeWait(attempt, policy))
                    .isEqualTo(Duration.ofNanos(Math.round(expectedNanos)));
        }
    }

    @Test
    void computeWait_withoutJitter_isNonDecreasingThenConstant() {
        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 30; attempt++) {
            Duration wait = backoff.computeWait(attempt, NO_JITTER);
            assertThat(wait).isGreaterThanOrEqualTo(previous);
            previous = wait;
        }
        assertThat(previous).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void computeWait_growthFactorOne_isConstant() {
        RetryPolicy policy = RetryPolicy.fixed(5, Duration.ofMillis(250));

        assertThat(backoff.computeWait(0, policy)).isEqualTo(Duration.ofMillis(250));
        assertThat(backoff.computeWait(7, policy)).isEqualTo(Duration.ofMillis(250));
        assertThat(backoff.computeWait(Integer.MAX_VALUE, policy)).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void computeWait_hugeAttemptIndex_saturatesAtMaxWait() {
        assertThat(backoff.computeWait(Integer.MAX_VALUE, NO_JITTER)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.computeWait(5_000, NO_JITTER)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void computeWait_maxWaitBelowInitial_clampsToMaxWait() {
        RetryPolicy inverted = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofMillis(300), 2.0, 0.0);

        assertThat(backoff.computeWait(0, inverted)).isEqualTo(Duration.ofMillis(300));
    }

    @Test
    void computeWait_zeroInitialWait_isZero() {
        RetryPolicy immediate = new RetryPolicy(3, Duration.ZERO, Duration.ofSeconds(1), 3.0, 1.0);

        assertThat(backoff.computeWait(0, immediate)).isEqualTo(Duration.ZERO);
        assertThat(backoff.computeWait(Integer.MAX_VALUE, immediate)).isEqualTo(Duration.ZERO);
    }

    @Test
    void computeWait_jitterExtremes_spanHalfTheFractionEachWay() {
        RetryPolicy policy = NO_JITTER.withJitterFraction(0.5);

        Duration low = new Backoff(() -> 0.0).computeWait(0, policy);
        Duration mid = new Backoff(() -> 0.5).computeWait(0, policy);

        // 100ms - 0.5 * 0.5 * 100ms
        assertThat(low).isEqualTo(Duration.ofMillis(75));
        assertThat(mid).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void computeWait_jitterAppliesAfterClamp() {
        RetryPolicy policy = NO_JITTER.withJitterFraction(1.0);

        Duration highest = new Backoff(() -> Math.nextDown(1.0)).computeWait(30, policy);

        assertThat(highest).isLessThanOrEqualTo(Duration.ofMillis(7_500));
        assertThat(highest).isGreaterThan(Duration.ofSeconds(5));
    }

    @Test
    void computeWait_withRandomJitter_staysWithinBoundsAndNeverNegative() {
        Random seeded = new Random(42);
        Backoff jittered = new Backoff(seeded::nextDouble);
        RetryPolicy policy = NO_JITTER.withJitterFraction(1.0);

        for (int i = 0; i < 1_000; i++) {
            int attempt = i % 12;
            Duration capped = backoff.computeWait(attempt, NO_JITTER);
            Duration wait = jittered.computeWait(attempt, policy);

            assertThat(wait.isNegative()).isFalse();
            assertThat(wait.toNanos()).isBetween(capped.toNanos() / 2, capped.toNanos() * 3 / 2);
        }
    }

    @Test
    void computeWait_sameSeed_producesSameSequence() {
        RetryPolicy policy = NO_JITTER.withJitterFraction(0.3);
        Backoff first = new Backoff(new Random(7)::nextDouble);
        Backoff second = new Backoff(new Random(7)::nextDouble);

        for (int attempt = 0; attempt < 10; attempt++) {
            assertThat(first.computeWait(attempt, policy)).isEqualTo(second.computeWait(attempt, policy));
        }
    }

    @Test
    void computeWait_negativeAttemptIndex_isRejected() {
        assertThatThrownBy(() -> backoff.computeWait(-1, NO_JITTER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attemptIndex");
    }
}
