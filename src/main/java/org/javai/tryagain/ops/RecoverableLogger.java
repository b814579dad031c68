package org.javai.tryagain.ops;

import java.time.Instant;

/**
 * Receives the recoverable failures of a retried operation once the operation has ended
 * in a fatal error, oldest first.
 *
 * @param <R> The recoverable error type
 * @param <C> The caller-owned logging context type
 */
@FunctionalInterface
public interface RecoverableLogger<R, C> {

	/**
	 * Logs one recoverable failure.
	 *
	 * @param error the recoverable error
	 * @param occurredAt when it was observed
	 * @param context the caller's logging context, lent for the duration of the call
	 */
	void logRecoverable(R error, Instant occurredAt, C context);
}
