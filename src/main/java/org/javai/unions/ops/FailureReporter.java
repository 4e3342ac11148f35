package org.javai.unions.ops;

import org.javai.unions.Failure;

/**
 * Reports failures for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Value types never log on their own; a reporter is hooked in where failures surface:
 * <pre>{@code
 * orders.place(request).onFailure(reporter::report);
 * }</pre>
 */
@FunctionalInterface
public interface FailureReporter {

	/**
	 * Reports a failure occurrence.
	 */
	void report(Failure failure);

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static FailureReporter noOp() {
		return failure -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static FailureReporter composite(FailureReporter... reporters) {
		return CompositeFailureReporter.of(reporters);
	}
}
