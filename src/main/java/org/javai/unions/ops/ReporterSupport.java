package org.javai.unions.ops;

import java.util.stream.Collectors;
import org.javai.unions.Failure;
import org.javai.unions.Option;

/**
 * Shared utilities for {@link FailureReporter} implementations.
 */
public final class ReporterSupport {

	private ReporterSupport() {
		// Utility class
	}

	/**
	 * Resolves configuration from a system property, falling back to an environment variable.
	 * Blank values count as unset.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value, or none if neither is set
	 */
	public static Option<String> resolveConfig(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return Option.none();
		}
		return Option.some(value.trim());
	}

	/**
	 * The codes of an aggregate's children joined with commas, or the failure's own code.
	 */
	public static String codes(Failure failure) {
		if (!failure.isAggregate()) {
			return failure.code();
		}
		return failure.errors().stream()
				.map(Failure::code)
				.collect(Collectors.joining(","));
	}
}
