package org.javai.backoff.classify;

import java.util.Set;

/**
 * Classifies HTTP response status codes.
 *
 * <p>A response with a failure status is a transport success, so this works on the
 * status code rather than on an error.</p>
 */
public final class HttpStatusClassifier {

    public static final int REQUEST_TIMEOUT = 408;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int GATEWAY_TIMEOUT = 504;

    private static final Set<Integer> RETRYABLE = Set.of(
            REQUEST_TIMEOUT,
            TOO_MANY_REQUESTS,
            INTERNAL_SERVER_ERROR,
            BAD_GATEWAY,
            SERVICE_UNAVAILABLE,
            GATEWAY_TIMEOUT
    );

    private HttpStatusClassifier() {
        // Utility class
    }

    /**
     * Returns true for request timeout, rate limiting and transient server-side statuses.
     *
     * @param statusCode the HTTP status code
     * @return true if repeating the request may succeed
     */
    public static boolean isRetryableStatus(int statusCode) {
        return RETRYABLE.contains(statusCode);
    }
}
