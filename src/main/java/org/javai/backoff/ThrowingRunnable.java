package org.javai.backoff;

/**
 * A value-less unit of work that may fail by throwing.
 *
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {

    void run() throws E;

    /**
     * Adapts this runnable to a supplier yielding {@code null} on success.
     */
    default ThrowingSupplier<Void, E> asSupplier() {
        return () -> {
            run();
            return null;
        };
    }
}
