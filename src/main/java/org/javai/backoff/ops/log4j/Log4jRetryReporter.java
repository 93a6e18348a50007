package org.javai.backoff.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.backoff.FailureReason;
import org.javai.backoff.RetryFailure;
import org.javai.backoff.ops.RetryReporter;

import java.time.Duration;

/**
 * Reports retry activity using Log4j2.
 *
 * <p>Levels by event:
 * <ul>
 *   <li>retry attempt → INFO</li>
 *   <li>{@code EXHAUSTED} → WARN</li>
 *   <li>{@code NON_RETRYABLE} → WARN</li>
 *   <li>{@code CANCELLED} → INFO (the caller asked for it)</li>
 * </ul>
 *
 * <p>Each event carries a marker so log routing can separate retry noise from real failures.
 */
public class Log4jRetryReporter implements RetryReporter {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker RETRY_ABORTED_MARKER = MarkerManager.getMarker("RETRY_ABORTED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.backoff.RetryReporter"));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, int attemptNumber, Throwable error, Duration wait) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of operation [{}] failed, retrying in {} ms. Error: {}",
				attemptNumber,
				operation,
				wait.toMillis(),
				describe(error));
	}

	@Override
	public void reportFailure(String operation, RetryFailure failure) {
		Level level = levelFor(failure.reason());
		Marker marker = failure.reason() == FailureReason.EXHAUSTED
			? RETRY_EXHAUSTED_MARKER
			: RETRY_ABORTED_MARKER;

		logger.atLevel(level)
			.withMarker(marker)
			.withThrowable(failure.lastError())
			.log("Operation [{}] gave up after {} attempts. Reason: {}, Error: {}",
				operation,
				failure.attempts(),
				failure.reason(),
				describe(failure.lastError()));
	}

	private static String describe(Throwable error) {
		return error.getClass().getSimpleName() + ": " + error.getMessage();
	}

	static Level levelFor(FailureReason reason) {
		return switch (reason) {
			case EXHAUSTED, NON_RETRYABLE -> Level.WARN;
			case CANCELLED -> Level.INFO;
		};
	}
}
