package org.javai.railway;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves configuration from a system property, falling back to an environment variable.
 *
 * <p>Blank values count as absent. A value that is present but cannot be parsed is a
 * configuration error and fails fast with the offending key in the message.
 */
public final class ConfigResolver {

	private static final ConfigResolver SYSTEM = new ConfigResolver(System::getProperty, System::getenv);

	private final Function<String, String> properties;
	private final Function<String, String> environment;

	/**
	 * Creates a resolver over arbitrary lookups. Useful for testing.
	 *
	 * @param properties looks up a system-property style key, returning null when absent
	 * @param environment looks up an environment variable, returning null when absent
	 */
	public ConfigResolver(Function<String, String> properties, Function<String, String> environment) {
		this.properties = Objects.requireNonNull(properties, "properties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * Returns the resolver backed by {@link System#getProperty} and {@link System#getenv}.
	 */
	public static ConfigResolver system() {
		return SYSTEM;
	}

	/**
	 * Resolves a value, system property first.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the value, or empty if neither is set
	 */
	public Optional<String> resolve(String sysProp, String envVar) {
		String value = properties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * Resolves a value that must be present.
	 *
	 * @throws IllegalStateException if neither source is set
	 */
	public String require(String sysProp, String envVar) {
		return resolve(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	public int resolveInt(String sysProp, String envVar, int defaultValue) {
		return resolve(sysProp, envVar)
				.map(value -> parse(sysProp, value, Integer::parseInt))
				.orElse(defaultValue);
	}

	public long resolveLong(String sysProp, String envVar, long defaultValue) {
		return resolve(sysProp, envVar)
				.map(value -> parse(sysProp, value, Long::parseLong))
				.orElse(defaultValue);
	}

	public double resolveDouble(String sysProp, String envVar, double defaultValue) {
		return resolve(sysProp, envVar)
				.map(value -> parse(sysProp, value, Double::parseDouble))
				.orElse(defaultValue);
	}

	private static <N> N parse(String key, String value, Function<String, N> parser) {
		try {
			return parser.apply(value);
		} catch (NumberFormatException e) {
			throw new IllegalStateException("Invalid value '" + value + "' for configuration '" + key + "'", e);
		}
	}
}
