package org.javai.backoff.ops;

import org.javai.backoff.RetryFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is logged and the remaining reporters still execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryReporter reporter = CompositeRetryReporter.builder()
 *     .add(new Log4jRetryReporter())
 *     .addIf(metricsEnabled, new MetricsRetryReporter("payments"))
 *     .build();
 * }</pre>
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger logger = LoggerFactory.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 */
	public static CompositeRetryReporter of(Collection<? extends RetryReporter> reporters) {
		return new CompositeRetryReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportRetryAttempt(String operation, int attemptNumber, Throwable error, Duration wait) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(operation, attemptNumber, error, wait);
			} catch (RuntimeException e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	@Override
	public void reportFailure(String operation, RetryFailure failure) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportFailure(operation, failure);
			} catch (RuntimeException e) {
				logReporterError("reportFailure", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, RetryReporter reporter, RuntimeException e) {
		logger.warn("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}

	/**
	 * Builder for creating a {@link CompositeRetryReporter}.
	 */
	public static final class Builder {
		private final List<RetryReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null is ignored.
		 */
		public Builder add(RetryReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 */
		public Builder addIf(boolean condition, RetryReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeRetryReporter build() {
			return new CompositeRetryReporter(reporters);
		}
	}
}
