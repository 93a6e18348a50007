package org.javai.backoff;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of running an operation under a retry policy.
 * Either {@link Ok} holding the operation's value, or {@link Fail} holding a {@link RetryFailure}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Outcome<Order> outcome = executor.run(token, policy, () -> orders.fetch(id));
 * if (outcome instanceof Outcome.Fail<Order> fail
 *         && fail.retryFailure().reason() == FailureReason.CANCELLED) {
 *     return;
 * }
 * Order order = outcome.getOrThrow();
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome.
     *
     * @param value the value returned by the operation (null for value-less operations)
     * @param attempts how many invocations it took
     */
    record Ok<T>(T value, int attempts) implements Outcome<T> {

        public Ok {
            if (attempts < 1) {
                throw new IllegalArgumentException("attempts must be >= 1, was: " + attempts);
            }
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public Optional<RetryFailure> failure() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value), attempts);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super RetryFailure, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome.
     *
     * @param retryFailure why the run ended, with the last error attached
     */
    record Fail<T>(RetryFailure retryFailure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(retryFailure, "retryFailure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public Optional<RetryFailure> failure() {
            return Optional.of(retryFailure);
        }

        @Override
        public T getOrThrow() {
            throw new RetryFailedException(retryFailure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(retryFailure);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(retryFailure);
        }

        @Override
        public Outcome<T> recover(Function<? super RetryFailure, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(retryFailure), retryFailure.attempts());
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns the terminal failure, or empty for a successful outcome.
     */
    Optional<RetryFailure> failure();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Recovery
    Outcome<T> recover(Function<? super RetryFailure, ? extends T> recovery);

    // Static factories
    static <T> Outcome<T> ok(T value, int attempts) {
        return new Ok<>(value, attempts);
    }

    static <T> Outcome<T> fail(RetryFailure failure) {
        return new Fail<>(failure);
    }
}
