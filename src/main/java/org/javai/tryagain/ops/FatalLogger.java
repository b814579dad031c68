package org.javai.tryagain.ops;

import java.time.Instant;

/**
 * Receives the fatal error that ended a retried operation. Called once, after every
 * recoverable failure of the same call has been passed to the {@link RecoverableLogger}.
 *
 * @param <F> The fatal error type
 * @param <C> The caller-owned logging context type
 */
@FunctionalInterface
public interface FatalLogger<F, C> {

	void logFatal(F error, Instant occurredAt, C context);
}
