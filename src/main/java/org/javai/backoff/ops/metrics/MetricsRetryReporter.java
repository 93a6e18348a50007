package org.javai.backoff.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.backoff.RetryFailure;
import org.javai.backoff.ops.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Reports retry activity as JSON-lines metrics via SLF4J.
 *
 * <p>One JSON object per event, suitable for metrics aggregation. The tracking key is the
 * operation name, optionally prefixed by a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"billing.fetchInvoice","attemptNumber":1,"waitMs":100,"errorType":"java.net.SocketTimeoutException"}
 * {"eventType":"retry_failed","timestamp":"2024-01-20T10:30:01Z","trackingKey":"billing.fetchInvoice","reason":"EXHAUSTED","attempts":3,"errorType":"java.net.SocketTimeoutException","message":"Read timed out"}
 * }</pre>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.backoff.Metrics";
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, int attemptNumber, Throwable error, Duration wait) {
		ObjectNode event = baseEvent("retry_attempt", operation);
		event.put("attemptNumber", attemptNumber);
		event.put("waitMs", wait.toMillis());
		event.put("errorType", error.getClass().getName());
		emit(event);
	}

	@Override
	public void reportFailure(String operation, RetryFailure failure) {
		ObjectNode event = baseEvent("retry_failed", operation);
		event.put("reason", failure.reason().name());
		event.put("attempts", failure.attempts());
		event.put("errorType", failure.lastError().getClass().getName());
		if (failure.lastError().getMessage() != null) {
			event.put("message", failure.lastError().getMessage());
		}
		emit(event);
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private ObjectNode baseEvent(String eventType, String operation) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", clock.instant().toString());
		event.put("trackingKey", buildTrackingKey(operation));
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			// Reporting must not break the retry loop
			logger.warn("Could not serialize {} event", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
