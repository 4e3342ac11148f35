package org.javai.unions.ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.unions.Failure;

/**
 * A {@link FailureReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every failure. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * FailureReporter reporter = CompositeFailureReporter.of(
 *     new Log4jFailureReporter(),
 *     MetricsFailureReporter.fromEnvironment()
 * );
 *
 * // Or using the builder for more control:
 * FailureReporter reporter = CompositeFailureReporter.builder()
 *     .add(new Log4jFailureReporter())
 *     .addIf(metricsEnabled, new MetricsFailureReporter("orders"))
 *     .build();
 * }</pre>
 */
public final class CompositeFailureReporter implements FailureReporter {

	private static final Logger LOGGER = LogManager.getLogger(CompositeFailureReporter.class);

	private final List<FailureReporter> reporters;

	private CompositeFailureReporter(List<FailureReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeFailureReporter of(FailureReporter... reporters) {
		return new CompositeFailureReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 */
	public static CompositeFailureReporter of(Collection<? extends FailureReporter> reporters) {
		return new CompositeFailureReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Failure failure) {
		for (FailureReporter reporter : reporters) {
			try {
				reporter.report(failure);
			} catch (RuntimeException e) {
				LOGGER.warn("FailureReporter {} failed to report [{}]", reporter.getClass().getName(), failure.code(), e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	/**
	 * Builder for creating a {@link CompositeFailureReporter}. Null reporters are ignored.
	 */
	public static final class Builder {
		private final List<FailureReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(FailureReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends FailureReporter> reporters) {
			for (FailureReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, FailureReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeFailureReporter build() {
			return new CompositeFailureReporter(reporters);
		}
	}
}
