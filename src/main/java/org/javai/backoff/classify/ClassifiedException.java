package org.javai.backoff.classify;

import java.util.Objects;

/**
 * Carries an operation's error together with an explicit retryability tag.
 *
 * <p>Operations throw this when they know better than a generic classifier, for example
 * an HTTP 503 response or a database deadlock. The tag is read directly by
 * {@link DefaultErrorClassifier}; the wrapped cause is kept for diagnostics only.</p>
 *
 * <pre>{@code
 * executor.run(token, policy, () -> {
 *     try {
 *         return gateway.charge(payment);
 *     } catch (GatewayBusyException e) {
 *         throw ClassifiedException.retryable(e);
 *     }
 * });
 * }</pre>
 */
public class ClassifiedException extends Exception {

    private final boolean retryable;

    protected ClassifiedException(String message, Throwable cause, boolean retryable) {
        super(message, Objects.requireNonNull(cause, "cause must not be null"));
        this.retryable = retryable;
    }

    /**
     * Tags an error as retryable regardless of what it is.
     */
    public static ClassifiedException retryable(Throwable cause) {
        return new ClassifiedException(messageOf(cause), cause, true);
    }

    /**
     * Tags an error as permanent so it is never retried.
     */
    public static ClassifiedException permanent(Throwable cause) {
        return new ClassifiedException(messageOf(cause), cause, false);
    }

    public boolean isRetryable() {
        return retryable;
    }

    private static String messageOf(Throwable cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
