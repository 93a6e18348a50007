package org.javai.backoff.classify;

import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.InterruptedByTimeoutException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Default retryability rules for common JDK errors.
 *
 * <p>Rules are evaluated in order and the first match wins:</p>
 * <ol>
 *   <li>Cancellation or interruption: not retryable, even when tagged retryable.</li>
 *   <li>{@link ClassifiedException}: whatever its tag says.</li>
 *   <li>Transport timeouts ({@link SocketTimeoutException}, {@link HttpTimeoutException},
 *       {@link TimeoutException}): retryable.</li>
 *   <li>Connection refused ({@link ConnectException}) or reset: retryable.</li>
 *   <li>Anything else: not retryable.</li>
 * </ol>
 *
 * <p>Rules 3 and 4 look through {@link UncheckedIOException}, {@link CompletionException}
 * and {@link ExecutionException} to the transport error inside. No other cause chain is
 * followed: the retryable tag is read from the {@link ClassifiedException} itself.</p>
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    static final DefaultErrorClassifier INSTANCE = new DefaultErrorClassifier();

    private static final int MAX_UNWRAP_DEPTH = 8;

    @Override
    public boolean isRetryable(Throwable error) {
        return isRetryableError(error);
    }

    /**
     * Applies the default rules without an instance, for callers that only need the predicate.
     *
     * @param error the error to classify (null is never retryable)
     * @return true if the error is worth retrying
     */
    public static boolean isRetryableError(Throwable error) {
        if (error == null) {
            return false;
        }

        if (isCancellation(error)) {
            return false;
        }

        if (error instanceof ClassifiedException classified) {
            return !isCancellation(classified.getCause()) && classified.isRetryable();
        }

        Throwable transport = unwrapTransport(error);
        if (isTransientTransport(transport)) {
            return true;
        }

        return isConnectionFailure(transport);
    }

    /**
     * Returns true if the error signals that the caller gave up, not that the operation failed.
     */
    public static boolean isCancellation(Throwable error) {
        if (error instanceof CancellationException || error instanceof InterruptedException) {
            return true;
        }
        if (error instanceof ClosedByInterruptException) {
            return true;
        }
        // SocketTimeoutException is an InterruptedIOException but is a timeout, not an interrupt
        return error instanceof InterruptedIOException
                && !(error instanceof SocketTimeoutException);
    }

    // Lambdas and futures rethrow transport errors inside these wrappers
    private static Throwable unwrapTransport(Throwable error) {
        Throwable current = error;
        for (int depth = 0; depth < MAX_UNWRAP_DEPTH; depth++) {
            boolean wrapper = current instanceof UncheckedIOException
                    || current instanceof CompletionException
                    || current instanceof ExecutionException;
            if (!wrapper || current.getCause() == null) {
                break;
            }
            current = current.getCause();
        }
        return current;
    }

    private static boolean isTransientTransport(Throwable error) {
        return error instanceof SocketTimeoutException
                || error instanceof HttpTimeoutException
                || error instanceof InterruptedByTimeoutException
                || error instanceof TimeoutException;
    }

    private static boolean isConnectionFailure(Throwable error) {
        if (error instanceof ConnectException) {
            return true;
        }
        // The JDK reports resets as a plain SocketException
        if (error instanceof SocketException) {
            String message = error.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                return lower.contains("connection reset") || lower.contains("connection refused");
            }
        }
        return false;
    }
}
