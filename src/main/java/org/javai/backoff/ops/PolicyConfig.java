package org.javai.backoff.ops;

import org.javai.backoff.retry.RetryPolicy;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves retry policies from system properties and environment variables.
 *
 * <p>For a policy named {@code payments}, each field is looked up as system property
 * {@code backoff.payments.<field>} first, then environment variable
 * {@code BACKOFF_PAYMENTS_<FIELD>}. Unset fields keep the fallback policy's value.</p>
 *
 * <table>
 *   <caption>Fields</caption>
 *   <tr><th>Property</th><th>Environment</th><th>Format</th></tr>
 *   <tr><td>maxAttempts</td><td>MAX_ATTEMPTS</td><td>integer</td></tr>
 *   <tr><td>initialWait</td><td>INITIAL_WAIT</td><td>milliseconds or ISO-8601 ({@code PT0.5S})</td></tr>
 *   <tr><td>maxWait</td><td>MAX_WAIT</td><td>milliseconds or ISO-8601</td></tr>
 *   <tr><td>growthFactor</td><td>GROWTH_FACTOR</td><td>decimal</td></tr>
 *   <tr><td>jitterFraction</td><td>JITTER_FRACTION</td><td>decimal</td></tr>
 * </table>
 */
public final class PolicyConfig {

	private static final String PROPERTY_PREFIX = "backoff.";
	private static final String ENV_PREFIX = "BACKOFF_";

	private final Function<String, String> properties;
	private final Function<String, String> environment;

	PolicyConfig(Function<String, String> properties, Function<String, String> environment) {
		this.properties = Objects.requireNonNull(properties, "properties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * Loads the named policy from the running process's system properties and environment.
	 *
	 * @param name the policy name, e.g. "payments"
	 * @param fallback values used for fields that are not configured
	 * @return the resolved policy
	 * @throws IllegalStateException if a configured value cannot be parsed or is out of range
	 */
	public static RetryPolicy load(String name, RetryPolicy fallback) {
		return new PolicyConfig(System::getProperty, System::getenv).resolve(name, fallback);
	}

	RetryPolicy resolve(String name, RetryPolicy fallback) {
		requireNonEmpty(name, "name");
		Objects.requireNonNull(fallback, "fallback must not be null");

		RetryPolicy.Builder builder = fallback.toBuilder();
		String value;
		if ((value = lookup(name, "maxAttempts")) != null) {
			builder.maxAttempts(parse(name, "maxAttempts", value, Integer::parseInt));
		}
		if ((value = lookup(name, "initialWait")) != null) {
			builder.initialWait(parse(name, "initialWait", value, PolicyConfig::parseDuration));
		}
		if ((value = lookup(name, "maxWait")) != null) {
			builder.maxWait(parse(name, "maxWait", value, PolicyConfig::parseDuration));
		}
		if ((value = lookup(name, "growthFactor")) != null) {
			builder.growthFactor(parse(name, "growthFactor", value, Double::parseDouble));
		}
		if ((value = lookup(name, "jitterFraction")) != null) {
			builder.jitterFraction(parse(name, "jitterFraction", value, Double::parseDouble));
		}

		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException("Invalid retry policy configuration for '" + name + "': " + e.getMessage(), e);
		}
	}

	private String lookup(String name, String field) {
		String value = properties.apply(propertyKey(name, field));
		if (value == null || value.isBlank()) {
			value = environment.apply(envKey(name, field));
		}
		return value == null || value.isBlank() ? null : value.trim();
	}

	static String propertyKey(String name, String field) {
		return PROPERTY_PREFIX + name + "." + field;
	}

	static String envKey(String name, String field) {
		String snakeField = field.replaceAll("([a-z])([A-Z])", "$1_$2");
		return (ENV_PREFIX + name.replaceAll("[^A-Za-z0-9]", "_") + "_" + snakeField).toUpperCase(Locale.ROOT);
	}

	private static <T> T parse(String name, String field, String value, Function<String, T> parser) {
		try {
			return parser.apply(value);
		} catch (NumberFormatException | DateTimeParseException e) {
			throw new IllegalStateException(
				"Invalid value '" + value + "' for " + propertyKey(name, field) + " / " + envKey(name, field), e);
		}
	}

	static Duration parseDuration(String value) {
		if (value.chars().allMatch(Character::isDigit)) {
			return Duration.ofMillis(Long.parseLong(value));
		}
		return Duration.parse(value);
	}

	private static void requireNonEmpty(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " must not be null or empty");
		}
	}
}
