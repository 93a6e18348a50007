package org.javai.backoff;

/**
 * A unit of work that produces a value or fails by throwing.
 * This is the operation the retry executor invokes on every attempt.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
