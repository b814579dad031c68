package org.javai.tryagain.ops;

import java.time.Instant;

/**
 * The diagnostic side channel of one retried call: a caller-owned context and two
 * optional loggers sharing it.
 *
 * <p>Either logger may be null; a missing logger changes nothing about the returned result.
 *
 * <p>Example usage:
 * <pre>{@code
 * FailureLogContext context = FailureLogContext.forOperation("inventory.reserve");
 * Log4jFailureLogger<Throttled, HttpStatusError> log4j = new Log4jFailureLogger<>();
 *
 * Result<Reservation, HttpStatusError> result = retrier.run(
 *     this::reserve,
 *     request,
 *     FailureLoggers.of(context, log4j, log4j));
 * }</pre>
 *
 * @param context the caller's mutable logging context, may be null
 * @param fatalLogger the fatal logger, may be null
 * @param recoverableLogger the recoverable logger, may be null
 * @param <R> The recoverable error type
 * @param <F> The fatal error type
 * @param <C> The logging context type
 */
public record FailureLoggers<R, F, C>(
		C context,
		FatalLogger<? super F, ? super C> fatalLogger,
		RecoverableLogger<? super R, ? super C> recoverableLogger
) {

	/**
	 * No context, no loggers.
	 */
	public static <R, F, C> FailureLoggers<R, F, C> none() {
		return new FailureLoggers<>(null, null, null);
	}

	public static <R, F, C> FailureLoggers<R, F, C> of(
			C context,
			FatalLogger<? super F, ? super C> fatalLogger,
			RecoverableLogger<? super R, ? super C> recoverableLogger) {
		return new FailureLoggers<>(context, fatalLogger, recoverableLogger);
	}

	public static <R, F, C> FailureLoggers<R, F, C> fatalOnly(C context, FatalLogger<? super F, ? super C> fatalLogger) {
		return new FailureLoggers<>(context, fatalLogger, null);
	}

	public boolean hasRecoverableLogger() {
		return recoverableLogger != null;
	}

	public boolean hasFatalLogger() {
		return fatalLogger != null;
	}

	/**
	 * Passes a recoverable failure to the recoverable logger, if there is one.
	 */
	public void logRecoverable(R error, Instant occurredAt) {
		if (recoverableLogger != null) {
			recoverableLogger.logRecoverable(error, occurredAt, context);
		}
	}

	/**
	 * Passes the fatal error to the fatal logger, if there is one.
	 */
	public void logFatal(F error, Instant occurredAt) {
		if (fatalLogger != null) {
			fatalLogger.logFatal(error, occurredAt, context);
		}
	}
}
