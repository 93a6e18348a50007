package org.javai.backoff.http;

import org.javai.backoff.classify.ClassifiedException;

import java.io.IOException;

/**
 * An HTTP response whose status indicates a transient server-side or rate-limit condition.
 * Always classified retryable.
 */
public class RetryableStatusException extends ClassifiedException {

    private final int statusCode;

    public RetryableStatusException(int statusCode, String body) {
        super("retryable HTTP status " + statusCode + ": " + body,
                new IOException("HTTP " + statusCode), true);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
