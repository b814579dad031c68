package org.javai.tryagain.ops.log4j;

import org.apache.logging.log4j.LogBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.tryagain.ops.FailureLogContext;
import org.javai.tryagain.ops.FatalLogger;
import org.javai.tryagain.ops.RecoverableLogger;

import java.time.Instant;
import java.util.Map;

/**
 * Logs the failures of a retried call using Log4j2.
 *
 * <p>Recoverable failures are logged at INFO with the {@code RECOVERABLE_FAILURE} marker, the
 * fatal error at ERROR with the {@code FATAL_FAILURE} marker. A fatal error that is a
 * {@link Throwable} is attached to the log event. Operation name, correlation ID and tags come
 * from the {@link FailureLogContext}.
 *
 * @param <R> The recoverable error type
 * @param <F> The fatal error type
 */
public class Log4jFailureLogger<R, F> implements RecoverableLogger<R, FailureLogContext>, FatalLogger<F, FailureLogContext> {

	private static final Marker RECOVERABLE_MARKER = MarkerManager.getMarker("RECOVERABLE_FAILURE");
	private static final Marker FATAL_MARKER = MarkerManager.getMarker("FATAL_FAILURE");

	private final Logger logger;

	/**
	 * Creates a Log4jFailureLogger using the default logger name.
	 */
	public Log4jFailureLogger() {
		this(LogManager.getLogger("org.javai.tryagain.Failures"));
	}

	/**
	 * Creates a Log4jFailureLogger with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jFailureLogger(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jFailureLogger with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jFailureLogger(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void logRecoverable(R error, Instant occurredAt, FailureLogContext context) {
		logger.atInfo()
			.withMarker(RECOVERABLE_MARKER)
			.log("Recoverable failure in operation [{}] at {}: {}{}",
				context.operation(),
				occurredAt,
				error,
				formatContext(context));
	}

	@Override
	public void logFatal(F error, Instant occurredAt, FailureLogContext context) {
		LogBuilder event = logger.atError().withMarker(FATAL_MARKER);
		if (error instanceof Throwable throwable) {
			event = event.withThrowable(throwable);
		}
		event.log("Fatal failure in operation [{}] at {}: {}{}",
			context.operation(),
			occurredAt,
			error,
			formatContext(context));
	}

	private static String formatContext(FailureLogContext context) {
		return formatCorrelationId(context.correlationId()) + formatTags(context.tags());
	}

	private static String formatCorrelationId(String correlationId) {
		return correlationId != null ? " | correlationId=" + correlationId : "";
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags.isEmpty()) {
			return "";
		}
		return " | tags={" + tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}
}
