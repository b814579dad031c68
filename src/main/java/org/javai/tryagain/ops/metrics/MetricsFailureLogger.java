package org.javai.tryagain.ops.metrics;

import org.javai.tryagain.ops.FailureLogContext;
import org.javai.tryagain.ops.FatalLogger;
import org.javai.tryagain.ops.RecoverableLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Logs the failures of a retried call as JSON-lines metrics via SLF4J.
 *
 * <p>Each event becomes one JSON object, suitable for metrics aggregation. The tracking key
 * is the operation name of the {@link FailureLogContext}, optionally prefixed by a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"recoverable_failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.quote.fetch","errorType":"Throttled",...}
 * {"eventType":"fatal_failure","timestamp":"2024-01-20T10:30:03Z","trackingKey":"myapp.quote.fetch","errorType":"HttpStatusError",...}
 * }</pre>
 *
 * <p>Logging never throws: a failure to log is itself logged at WARN and otherwise ignored.</p>
 *
 * @param <R> The recoverable error type
 * @param <F> The fatal error type
 */
public class MetricsFailureLogger<R, F> implements RecoverableLogger<R, FailureLogContext>, FatalLogger<F, FailureLogContext> {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.tryagain.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final Logger selfLogger = LoggerFactory.getLogger(MetricsFailureLogger.class);

	private final String namespace;
	private final Logger logger;

	/**
	 * Creates a MetricsFailureLogger with no namespace and the default logger.
	 */
	public MetricsFailureLogger() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsFailureLogger with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsFailureLogger(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsFailureLogger with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsFailureLogger(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsFailureLogger(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void logRecoverable(R error, Instant occurredAt, FailureLogContext context) {
		try {
			logger.info(buildRecoverableJson(error, occurredAt, context));
		} catch (RuntimeException e) {
			selfLogger.warn("Could not emit recoverable failure metric for {}", context.operation(), e);
		}
	}

	@Override
	public void logFatal(F error, Instant occurredAt, FailureLogContext context) {
		try {
			logger.info(buildFatalJson(error, occurredAt, context));
		} catch (RuntimeException e) {
			selfLogger.warn("Could not emit fatal failure metric for {}", context.operation(), e);
		}
	}

	private String buildRecoverableJson(R error, Instant occurredAt, FailureLogContext context) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "recoverable_failure", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(occurredAt), false);
		appendField(sb, "trackingKey", buildTrackingKey(context), false);
		appendError(sb, error);
		appendContext(sb, context);
		sb.append("}");
		return sb.toString();
	}

	private String buildFatalJson(F error, Instant occurredAt, FailureLogContext context) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "fatal_failure", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(occurredAt), false);
		appendField(sb, "trackingKey", buildTrackingKey(context), false);
		appendError(sb, error);
		appendContext(sb, context);
		sb.append("}");
		return sb.toString();
	}

	String buildTrackingKey(FailureLogContext context) {
		if (namespace == null) {
			return context.operation();
		}
		return namespace + "." + context.operation();
	}

	private void appendError(StringBuilder sb, Object error) {
		appendField(sb, "errorType", error.getClass().getSimpleName(), false);
		appendField(sb, "error", String.valueOf(error), false);
	}

	private void appendContext(StringBuilder sb, FailureLogContext context) {
		appendField(sb, "operation", context.operation(), false);
		if (context.correlationId() != null) {
			appendField(sb, "correlationId", context.correlationId(), false);
		}
		appendTags(sb, context.tags());
	}

	private void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private void appendTags(StringBuilder sb, Map<String, String> tags) {
		if (tags.isEmpty()) {
			return;
		}
		sb.append(",\"tags\":{");
		boolean first = true;
		for (Map.Entry<String, String> entry : tags.entrySet()) {
			if (!first) {
				sb.append(",");
			}
			sb.append("\"").append(escapeJson(entry.getKey())).append("\":\"")
			  .append(escapeJson(entry.getValue())).append("\"");
			first = false;
		}
		sb.append("}");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
