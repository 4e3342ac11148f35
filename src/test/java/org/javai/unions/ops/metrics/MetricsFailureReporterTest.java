package org.javai.unions.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.unions.Failure;
import org.javai.unions.FailureBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.Marker;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class MetricsFailureReporterTest {

	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-20T10:30:00Z"), ZoneOffset.UTC);

	private List<String> capturedMessages;
	private Logger capturingLogger;
	private MetricsFailureReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		reporter = new MetricsFailureReporter(null, capturingLogger, CLOCK);
	}

	@Test
	void report_emitsFailureEventAsJsonLine() throws Exception {
		reporter.report(Failure.conflict("Stock.Insufficient", "Only 2 left"));

		assertThat(capturedMessages).hasSize(1);
		JsonNode json = MAPPER.readTree(capturedMessages.get(0));
		assertThat(json.get("eventType").asText()).isEqualTo("failure");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("Stock.Insufficient");
		assertThat(json.get("kind").asText()).isEqualTo("ConflictError");
		assertThat(json.get("code").asText()).isEqualTo("Stock.Insufficient");
		assertThat(json.get("message").asText()).isEqualTo("Only 2 left");
		assertThat(json.get("childCount").asInt()).isZero();
		assertThat(json.has("metadata")).isFalse();
	}

	@Test
	void report_withNamespace_prependsToTrackingKey() throws Exception {
		MetricsFailureReporter reporterWithNamespace = new MetricsFailureReporter("orders", capturingLogger, CLOCK);

		reporterWithNamespace.report(Failure.notFound("Order.NotFound", "No such order"));

		JsonNode json = MAPPER.readTree(capturedMessages.get(0));
		assertThat(json.get("trackingKey").asText()).isEqualTo("orders.Order.NotFound");
	}

	@Test
	void report_withBlankNamespace_usesCodeOnly() {
		MetricsFailureReporter reporterBlankNamespace = new MetricsFailureReporter("  ", capturingLogger, CLOCK);

		assertThat(reporterBlankNamespace.buildTrackingKey(Failure.validation("Name.Required", "Name required")))
				.isEqualTo("Name.Required");
	}

	@Test
	void buildTrackingKey_withoutCode_usesKindName() {
		assertThat(reporter.buildTrackingKey(Failure.validation("Name required"))).isEqualTo("ValidationError");
	}

	@Test
	void report_writesMetadataAsJsonValues() throws Exception {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("orderId", 42);
		metadata.put("sku", "A-1");

		reporter.report(Failure.conflict("Stock.Insufficient", "Only 2 left", metadata));

		JsonNode json = MAPPER.readTree(capturedMessages.get(0));
		assertThat(json.get("metadata").get("orderId").asInt()).isEqualTo(42);
		assertThat(json.get("metadata").get("sku").asText()).isEqualTo("A-1");
	}

	@Test
	void report_metadataJacksonCannotMap_isWrittenAsText() throws Exception {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("seenAt", Instant.parse("2024-01-20T10:00:00Z"));
		metadata.put("retryAfter", Optional.of(5));
		metadata.put("marker", new Object());

		reporter.report(Failure.conflict("Order.Stale", "stale", metadata));

		assertThat(capturedMessages).hasSize(1);
		JsonNode json = MAPPER.readTree(capturedMessages.get(0));
		assertThat(json.get("metadata").get("seenAt").asText()).isEqualTo("2024-01-20T10:00:00Z");
		assertThat(json.get("metadata").has("retryAfter")).isTrue();
		assertThat(json.get("metadata").has("marker")).isTrue();
	}

	@Test
	void report_escapesJsonSpecialCharacters() throws Exception {
		reporter.report(Failure.of("Parse.Error", "Unexpected \"quote\"\nand newline"));

		JsonNode json = MAPPER.readTree(capturedMessages.get(0));
		assertThat(json.get("message").asText()).isEqualTo("Unexpected \"quote\"\nand newline");
	}

	@Test
	void report_aggregate_countsChildren() throws Exception {
		Failure aggregate = new FailureBuilder()
				.append(Failure.validation("Name.Required", "Name required"))
				.append(Failure.validation("Age.Invalid", "Age invalid"))
				.build();

		reporter.report(aggregate);

		JsonNode json = MAPPER.readTree(capturedMessages.get(0));
		assertThat(json.get("kind").asText()).isEqualTo("AggregateError");
		assertThat(json.get("code").asText()).isEqualTo("Name.Required,Age.Invalid");
		assertThat(json.get("childCount").asInt()).isEqualTo(2);
	}

	@Test
	void constructors_defaultLoggerName() {
		assertThatCode(() -> new MetricsFailureReporter()).doesNotThrowAnyException();
		assertThatCode(() -> new MetricsFailureReporter("myapp")).doesNotThrowAnyException();
		assertThatCode(() -> new MetricsFailureReporter("myapp", "custom.logger")).doesNotThrowAnyException();
		assertThatCode(MetricsFailureReporter::fromEnvironment).doesNotThrowAnyException();
	}

	/**
	 * A simple SLF4J Logger implementation that captures info messages for testing.
	 */
	private static class CapturingLogger implements Logger {
		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.messages = messages;
		}

		@Override
		public String getName() { return "test"; }

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public void trace(String msg) {}

		@Override
		public void trace(String format, Object arg) {}

		@Override
		public void trace(String format, Object arg1, Object arg2) {}

		@Override
		public void trace(String format, Object... arguments) {}

		@Override
		public void trace(String msg, Throwable t) {}

		@Override
		public boolean isTraceEnabled(Marker marker) { return false; }

		@Override
		public void trace(Marker marker, String msg) {}

		@Override
		public void trace(Marker marker, String format, Object arg) {}

		@Override
		public void trace(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void trace(Marker marker, String format, Object... arguments) {}

		@Override
		public void trace(Marker marker, String msg, Throwable t) {}

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public void debug(String msg) {}

		@Override
		public void debug(String format, Object arg) {}

		@Override
		public void debug(String format, Object arg1, Object arg2) {}

		@Override
		public void debug(String format, Object... arguments) {}

		@Override
		public void debug(String msg, Throwable t) {}

		@Override
		public boolean isDebugEnabled(Marker marker) { return false; }

		@Override
		public void debug(Marker marker, String msg) {}

		@Override
		public void debug(Marker marker, String format, Object arg) {}

		@Override
		public void debug(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void debug(Marker marker, String format, Object... arguments) {}

		@Override
		public void debug(Marker marker, String msg, Throwable t) {}

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public void info(String msg) {
			messages.add(msg);
		}

		@Override
		public void info(String format, Object arg) {}

		@Override
		public void info(String format, Object arg1, Object arg2) {}

		@Override
		public void info(String format, Object... arguments) {}

		@Override
		public void info(String msg, Throwable t) {}

		@Override
		public boolean isInfoEnabled(Marker marker) { return true; }

		@Override
		public void info(Marker marker, String msg) {}

		@Override
		public void info(Marker marker, String format, Object arg) {}

		@Override
		public void info(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void info(Marker marker, String format, Object... arguments) {}

		@Override
		public void info(Marker marker, String msg, Throwable t) {}

		@Override
		public boolean isWarnEnabled() { return false; }

		@Override
		public void warn(String msg) {}

		@Override
		public void warn(String format, Object arg) {}

		@Override
		public void warn(String format, Object... arguments) {}

		@Override
		public void warn(String format, Object arg1, Object arg2) {}

		@Override
		public void warn(String msg, Throwable t) {}

		@Override
		public boolean isWarnEnabled(Marker marker) { return false; }

		@Override
		public void warn(Marker marker, String msg) {}

		@Override
		public void warn(Marker marker, String format, Object arg) {}

		@Override
		public void warn(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void warn(Marker marker, String format, Object... arguments) {}

		@Override
		public void warn(Marker marker, String msg, Throwable t) {}

		@Override
		public boolean isErrorEnabled() { return false; }

		@Override
		public void error(String msg) {}

		@Override
		public void error(String format, Object arg) {}

		@Override
		public void error(String format, Object arg1, Object arg2) {}

		@Override
		public void error(String format, Object... arguments) {}

		@Override
		public void error(String msg, Throwable t) {}

		@Override
		public boolean isErrorEnabled(Marker marker) { return false; }

		@Override
		public void error(Marker marker, String msg) {}

		@Override
		public void error(Marker marker, String format, Object arg) {}

		@Override
		public void error(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void error(Marker marker, String format, Object... arguments) {}

		@Override
		public void error(Marker marker, String msg, Throwable t) {}
	}
}
