package org.javai.backoff.retry;

import org.javai.backoff.Outcome;
import org.javai.backoff.RetryFailure;
import org.javai.backoff.ThrowingSupplier;
import org.javai.backoff.classify.ErrorClassifier;
import org.javai.backoff.ops.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Invokes an operation repeatedly until it succeeds, fails with a non-retryable error,
 * exhausts its attempt budget, or is cancelled while waiting.
 *
 * <p>Runs execute on the calling thread and block only while waiting between attempts.
 * An executor holds no per-run state, so one instance may serve any number of concurrent runs.
 * Cancellation is observed during waits only; an attempt in progress is never interrupted.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryExecutor executor = RetryExecutor.builder()
 *     .reporter(new Log4jRetryReporter())
 *     .build();
 *
 * Outcome<Invoice> invoice = executor.run(
 *     "Billing.fetchInvoice",
 *     CancellationToken.withTimeout(Duration.ofSeconds(10)),
 *     RetryPolicy.exponential(4, Duration.ofMillis(100), Duration.ofSeconds(2)),
 *     () -> billing.fetchInvoice(id),
 *     (error, wait) -> metrics.increment("billing.retry")
 * );
 * }</pre>
 */
public final class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    static final String DEFAULT_OPERATION = "operation";

    private final ErrorClassifier classifier;
    private final Backoff backoff;
    private final RetryReporter reporter;
    private final Waiter waiter;

    private RetryExecutor(ErrorClassifier classifier, Backoff backoff, RetryReporter reporter, Waiter waiter) {
        this.classifier = classifier;
        this.backoff = backoff;
        this.reporter = reporter;
        this.waiter = waiter;
    }

    /**
     * Creates an executor with the default classifier, random jitter and no reporting.
     */
    public static RetryExecutor create() {
        return builder().build();
    }

    /**
     * Creates a builder for configuring a RetryExecutor instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ErrorClassifier classifier = ErrorClassifier.defaults();
        private Backoff backoff = new Backoff();
        private RetryReporter reporter = RetryReporter.noOp();
        private Waiter waiter = Waiter.blocking();

        private Builder() {}

        /**
         * Sets the classifier deciding which errors are retried (optional).
         *
         * @param classifier the error classifier
         * @return this builder
         */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the backoff calculator, e.g. one with a seeded random source (optional).
         *
         * @param backoff the backoff calculator
         * @return this builder
         */
        public Builder backoff(Backoff backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the waiter for testing (package-private).
         */
        Builder waiter(Waiter waiter) {
            this.waiter = Objects.requireNonNull(waiter, "waiter must not be null");
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(classifier, backoff, reporter, waiter);
        }
    }

    /**
     * Runs an operation under a policy.
     *
     * @param token cancels the run while it waits between attempts
     * @param policy attempt budget and backoff shape
     * @param operation the work to attempt
     * @return Ok with the operation's value, or Fail with the terminal reason and last error
     */
    public <T> Outcome<T> run(
            CancellationToken token,
            RetryPolicy policy,
            ThrowingSupplier<T, ? extends Exception> operation
    ) {
        return run(DEFAULT_OPERATION, token, policy, operation, RetryListener.none());
    }

    /**
     * Runs an operation under a policy, notifying {@code onRetry} before each wait.
     */
    public <T> Outcome<T> run(
            CancellationToken token,
            RetryPolicy policy,
            ThrowingSupplier<T, ? extends Exception> operation,
            RetryListener onRetry
    ) {
        return run(DEFAULT_OPERATION, token, policy, operation, onRetry);
    }

    /**
     * Runs a named operation under a policy. The name is used for reporting only.
     *
     * @param operation the operation name
     * @param token cancels the run while it waits between attempts
     * @param policy attempt budget and backoff shape
     * @param work the work to attempt
     * @param onRetry notified with the error and the wait before every retry
     * @return Ok with the work's value, or Fail with the terminal reason and last error
     */
    public <T> Outcome<T> run(
            String operation,
            CancellationToken token,
            RetryPolicy policy,
            ThrowingSupplier<T, ? extends Exception> work,
            RetryListener onRetry
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(onRetry, "onRetry must not be null");

        int attempt = 0;
        while (true) {
            attempt++;
            Exception error;
            try {
                return Outcome.ok(work.get(), attempt);
            } catch (Exception e) {
                error = e;
            }

            if (!classifier.isRetryable(error)) {
                return fail(operation, new RetryFailure.NonRetryable(error, attempt));
            }
            if (attempt >= policy.maxAttempts()) {
                return fail(operation, new RetryFailure.Exhausted(error, attempt));
            }

            Duration wait = backoff.computeWait(attempt - 1, policy);
            logger.debug("Attempt {}/{} of [{}] failed, retrying in {}: {}",
                    attempt, policy.maxAttempts(), operation, wait, error.toString());
            reporter.reportRetryAttempt(operation, attempt, error, wait);
            notifyListener(onRetry, operation, error, wait);

            Optional<Throwable> cancelledBy = awaitCancellation(token, wait);
            if (cancelledBy.isPresent()) {
                return fail(operation, new RetryFailure.Cancelled(error, attempt, cancelledBy.get()));
            }
        }
    }

    private <T> Outcome<T> fail(String operation, RetryFailure failure) {
        reporter.reportFailure(operation, failure);
        return Outcome.fail(failure);
    }

    private static void notifyListener(RetryListener onRetry, String operation, Throwable error, Duration wait) {
        try {
            onRetry.onRetry(error, wait);
        } catch (RuntimeException e) {
            logger.warn("Retry listener for [{}] failed; continuing", operation, e);
        }
    }

    // An interrupt while waiting counts as cancellation; the flag is restored for the caller
    private Optional<Throwable> awaitCancellation(CancellationToken token, Duration wait) {
        try {
            if (waiter.await(token, wait)) {
                return Optional.of(token.cause().orElseGet(() -> new CancellationException("cancelled")));
            }
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.of(e);
        }
    }
}
