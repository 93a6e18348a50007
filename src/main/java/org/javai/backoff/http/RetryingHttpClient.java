package org.javai.backoff.http;

import org.javai.backoff.Outcome;
import org.javai.backoff.classify.ClassifiedException;
import org.javai.backoff.classify.HttpStatusClassifier;
import org.javai.backoff.retry.CancellationToken;
import org.javai.backoff.retry.RetryExecutor;
import org.javai.backoff.retry.RetryListener;
import org.javai.backoff.retry.RetryPolicy;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Sends HTTP requests with retry on transport errors and retryable response statuses.
 *
 * <p>Every transport {@link IOException} is retried. Responses with a status accepted by
 * {@link HttpStatusClassifier#isRetryableStatus(int)} are retried as well; any other
 * response, including 4xx, is returned to the caller as a success.</p>
 *
 * <p>{@link HttpRequest} bodies are re-published on each attempt, so POST and PUT requests
 * are resent in full. The body of a retried response is closed before the next attempt when
 * it is streamed, for example from {@code BodyHandlers.ofInputStream()}.</p>
 *
 * <pre>{@code
 * RetryingHttpClient client = RetryingHttpClient.create();
 * HttpRequest request = HttpRequest.newBuilder(URI.create("https://api.example.com/payment"))
 *     .POST(HttpRequest.BodyPublishers.ofString("{\"amount\": 100}"))
 *     .header("Content-Type", "application/json")
 *     .build();
 *
 * Outcome<HttpResponse<String>> response = client.send(request, HttpResponse.BodyHandlers.ofString());
 * }</pre>
 */
public final class RetryingHttpClient {

    static final RetryPolicy DEFAULT_POLICY =
            new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, 0.1);

    // Longest error body quoted in a RetryableStatusException message
    private static final int MAX_BODY_EXCERPT = 512;

    private final HttpClient client;
    private final RetryExecutor executor;
    private final RetryPolicy policy;

    public RetryingHttpClient(HttpClient client, RetryExecutor executor, RetryPolicy policy) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * A client with a 30 second connect timeout and the default policy
     * (3 attempts, 100ms growing by 2.0 up to 5s, 10% jitter).
     */
    public static RetryingHttpClient create() {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
        return new RetryingHttpClient(client, RetryExecutor.create(), DEFAULT_POLICY);
    }

    public <T> Outcome<HttpResponse<T>> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        return send(request, handler, CancellationToken.none());
    }

    /**
     * Sends a request, retrying under this client's policy.
     *
     * @param request the request, resent as-is on each attempt
     * @param handler how to read a successful response body
     * @param token cancels the retry loop between attempts
     * @return the first non-retryable response, or the failure that ended the run
     */
    public <T> Outcome<HttpResponse<T>> send(
            HttpRequest request,
            HttpResponse.BodyHandler<T> handler,
            CancellationToken token
    ) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(handler, "handler must not be null");

        String operation = request.method() + " " + request.uri();
        return executor.run(operation, token, policy, () -> attempt(request, handler), RetryListener.none());
    }

    private <T> HttpResponse<T> attempt(HttpRequest request, HttpResponse.BodyHandler<T> handler)
            throws ClassifiedException, InterruptedException {
        HttpResponse<T> response;
        try {
            response = client.send(request, handler);
        } catch (IOException e) {
            throw ClassifiedException.retryable(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }

        if (HttpStatusClassifier.isRetryableStatus(response.statusCode())) {
            RetryableStatusException retryable =
                    new RetryableStatusException(response.statusCode(), excerpt(response.body()));
            discard(response.body(), retryable);
            throw retryable;
        }
        return response;
    }

    // Streamed bodies (ofInputStream, ofLines) hold the connection until closed
    private static void discard(Object body, RetryableStatusException failure) {
        if (body instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                failure.addSuppressed(e);
            }
        }
    }

    static String excerpt(Object body) {
        String text;
        if (body instanceof String s) {
            text = s;
        } else if (body instanceof byte[] bytes) {
            text = new String(bytes, StandardCharsets.UTF_8);
        } else {
            return "";
        }
        return text.length() <= MAX_BODY_EXCERPT ? text : text.substring(0, MAX_BODY_EXCERPT) + "...";
    }
}
