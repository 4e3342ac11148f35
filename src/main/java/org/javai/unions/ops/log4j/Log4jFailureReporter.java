package org.javai.unions.ops.log4j;

import java.util.Map;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.unions.Failure;
import org.javai.unions.FailureKind;
import org.javai.unions.ops.FailureReporter;
import org.javai.unions.ops.ReporterSupport;

/**
 * Reports failures using Log4j2, marked with {@code FAILURE}.
 *
 * <p>Failures are logged at a level chosen by their {@link FailureKind}:
 * <ul>
 *   <li>{@code GENERAL} → ERROR</li>
 *   <li>{@code CONFLICT}, {@code AUTHENTICATION}, {@code AUTHORIZATION} → WARN</li>
 *   <li>{@code VALIDATION} → INFO</li>
 *   <li>{@code NOT_FOUND} → DEBUG</li>
 *   <li>{@code AGGREGATE} → the most severe level among its children</li>
 * </ul>
 */
public class Log4jFailureReporter implements FailureReporter {

	public static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");

	private final Logger logger;

	/**
	 * Creates a Log4jFailureReporter using the default logger name.
	 */
	public Log4jFailureReporter() {
		this(LogManager.getLogger("org.javai.unions.FailureReporter"));
	}

	public Log4jFailureReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jFailureReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure))
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(failure));
	}

	private static String formatFailureMessage(Failure failure) {
		return "%s [%s]: %s%s%s".formatted(
				failure.kind().typeName(),
				ReporterSupport.codes(failure),
				failure.message(),
				formatMetadata(failure.metadata()),
				formatChildren(failure));
	}

	private static String formatMetadata(Map<String, Object> metadata) {
		if (metadata.isEmpty()) {
			return "";
		}
		return " | metadata={" + metadata.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}

	private static String formatChildren(Failure failure) {
		if (!failure.isAggregate()) {
			return "";
		}
		return " | errors=" + failure.errors();
	}

	static Level levelFor(Failure failure) {
		if (!failure.isAggregate()) {
			return levelFor(failure.kind());
		}
		Level mostSevere = Level.DEBUG;
		for (Failure child : failure.errors()) {
			Level level = levelFor(child.kind());
			if (level.isMoreSpecificThan(mostSevere)) {
				mostSevere = level;
			}
		}
		return mostSevere;
	}

	private static Level levelFor(FailureKind kind) {
		return switch (kind) {
			case GENERAL, AGGREGATE -> Level.ERROR;
			case CONFLICT, AUTHENTICATION, AUTHORIZATION -> Level.WARN;
			case VALIDATION -> Level.INFO;
			case NOT_FOUND -> Level.DEBUG;
		};
	}
}
