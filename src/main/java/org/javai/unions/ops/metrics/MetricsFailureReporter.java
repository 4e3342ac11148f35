package org.javai.unions.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import org.javai.unions.Failure;
import org.javai.unions.ops.FailureReporter;
import org.javai.unions.ops.ReporterSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports failures as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per failure, suitable for metrics aggregation and analysis
 * pipelines. The tracking key is the failure code, prefixed with a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"orders.Stock.Insufficient","kind":"ConflictError",...}
 * }</pre>
 *
 * <p>Constructor options follow the {@code Log4jFailureReporter} pattern:</p>
 * <ul>
 *   <li>{@link #MetricsFailureReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsFailureReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsFailureReporter(String, String)} - with namespace and custom logger name</li>
 *   <li>{@link #fromEnvironment()} - namespace from system property or environment</li>
 * </ul>
 */
public class MetricsFailureReporter implements FailureReporter {

	public static final String NAMESPACE_PROPERTY = "unions.metrics.namespace";
	public static final String NAMESPACE_ENV = "UNIONS_METRICS_NAMESPACE";

	private static final String DEFAULT_LOGGER_NAME = "org.javai.unions.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsFailureReporter with no namespace and the default logger.
	 */
	public MetricsFailureReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsFailureReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsFailureReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsFailureReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	/**
	 * Creates a reporter whose namespace comes from the {@value #NAMESPACE_PROPERTY} system
	 * property or the {@value #NAMESPACE_ENV} environment variable. Neither set means no
	 * namespace.
	 */
	public static MetricsFailureReporter fromEnvironment() {
		return new MetricsFailureReporter(ReporterSupport.resolveConfig(NAMESPACE_PROPERTY, NAMESPACE_ENV).getOrElse(null));
	}

	@Override
	public void report(Failure failure) {
		try {
			logger.info(buildFailureJson(failure));
		} catch (JsonProcessingException e) {
			logger.warn("Could not render failure [{}] as JSON", failure.code(), e);
		}
	}

	String buildFailureJson(Failure failure) throws JsonProcessingException {
		ObjectNode node = MAPPER.createObjectNode();
		node.put("eventType", "failure");
		node.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		node.put("trackingKey", buildTrackingKey(failure));
		node.put("kind", failure.kind().typeName());
		node.put("code", ReporterSupport.codes(failure));
		node.put("message", failure.message());
		if (!failure.metadata().isEmpty()) {
			ObjectNode metadata = node.putObject("metadata");
			for (Map.Entry<String, Object> entry : failure.metadata().entrySet()) {
				metadata.set(entry.getKey(), metadataValue(entry.getValue()));
			}
		}
		node.put("childCount", failure.errors().size());
		return MAPPER.writeValueAsString(node);
	}

	/**
	 * Values Jackson cannot map on its own, such as {@code java.time} types, are written
	 * as their {@code toString()}.
	 */
	static JsonNode metadataValue(Object value) {
		try {
			return MAPPER.valueToTree(value);
		} catch (IllegalArgumentException e) {
			return TextNode.valueOf(String.valueOf(value));
		}
	}

	String buildTrackingKey(Failure failure) {
		String key = failure.hasCode() ? failure.code() : failure.kind().typeName();
		if (namespace == null) {
			return key;
		}
		return namespace + "." + key;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
