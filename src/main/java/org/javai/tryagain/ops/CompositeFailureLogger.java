package org.javai.tryagain.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A logger that delegates every event to several loggers sharing the same context.
 *
 * <p>If a delegate throws, the exception is logged at WARN and the remaining delegates still
 * receive the event.
 *
 * <p>Example usage:
 * <pre>{@code
 * CompositeFailureLogger<Throttled, HttpStatusError, FailureLogContext> sinks =
 *     CompositeFailureLogger.<Throttled, HttpStatusError, FailureLogContext>builder()
 *         .add(new Log4jFailureLogger<>())
 *         .add(new MetricsFailureLogger<>("myapp"))
 *         .fatal((error, at, context) -> alerts.raise(context.operation(), error))
 *         .build();
 *
 * FailureLoggers.of(context, sinks, sinks);
 * }</pre>
 *
 * @param <R> The recoverable error type
 * @param <F> The fatal error type
 * @param <C> The logging context type
 */
public final class CompositeFailureLogger<R, F, C> implements RecoverableLogger<R, C>, FatalLogger<F, C> {

	private static final Logger logger = LogManager.getLogger(CompositeFailureLogger.class);

	private final List<RecoverableLogger<? super R, ? super C>> recoverableLoggers;
	private final List<FatalLogger<? super F, ? super C>> fatalLoggers;

	private CompositeFailureLogger(
			List<RecoverableLogger<? super R, ? super C>> recoverableLoggers,
			List<FatalLogger<? super F, ? super C>> fatalLoggers) {
		this.recoverableLoggers = List.copyOf(recoverableLoggers);
		this.fatalLoggers = List.copyOf(fatalLoggers);
	}

	/**
	 * Creates a builder for constructing a composite logger.
	 *
	 * @return a new builder
	 */
	public static <R, F, C> Builder<R, F, C> builder() {
		return new Builder<>();
	}

	@Override
	public void logRecoverable(R error, Instant occurredAt, C context) {
		for (RecoverableLogger<? super R, ? super C> delegate : recoverableLoggers) {
			try {
				delegate.logRecoverable(error, occurredAt, context);
			} catch (RuntimeException e) {
				logDelegateError("logRecoverable", delegate, e);
			}
		}
	}

	@Override
	public void logFatal(F error, Instant occurredAt, C context) {
		for (FatalLogger<? super F, ? super C> delegate : fatalLoggers) {
			try {
				delegate.logFatal(error, occurredAt, context);
			} catch (RuntimeException e) {
				logDelegateError("logFatal", delegate, e);
			}
		}
	}

	/**
	 * Returns the number of delegates receiving recoverable failures.
	 */
	public int recoverableSize() {
		return recoverableLoggers.size();
	}

	/**
	 * Returns the number of delegates receiving fatal failures.
	 */
	public int fatalSize() {
		return fatalLoggers.size();
	}

	private static void logDelegateError(String method, Object delegate, RuntimeException e) {
		logger.warn("{} failed for {}", method, delegate.getClass().getName(), e);
	}

	/**
	 * Builder for creating a {@link CompositeFailureLogger}.
	 */
	public static final class Builder<R, F, C> {
		private final List<RecoverableLogger<? super R, ? super C>> recoverableLoggers = new ArrayList<>();
		private final List<FatalLogger<? super F, ? super C>> fatalLoggers = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a logger that receives both recoverable and fatal failures.
		 *
		 * @param delegate the logger to add
		 * @return this builder
		 */
		public <L extends RecoverableLogger<? super R, ? super C> & FatalLogger<? super F, ? super C>> Builder<R, F, C> add(L delegate) {
			if (delegate != null) {
				recoverableLoggers.add(delegate);
				fatalLoggers.add(delegate);
			}
			return this;
		}

		/**
		 * Adds a logger that receives recoverable failures only.
		 *
		 * @param delegate the logger to add
		 * @return this builder
		 */
		public Builder<R, F, C> recoverable(RecoverableLogger<? super R, ? super C> delegate) {
			if (delegate != null) {
				recoverableLoggers.add(delegate);
			}
			return this;
		}

		/**
		 * Adds a logger that receives the fatal failure only.
		 *
		 * @param delegate the logger to add
		 * @return this builder
		 */
		public Builder<R, F, C> fatal(FatalLogger<? super F, ? super C> delegate) {
			if (delegate != null) {
				fatalLoggers.add(delegate);
			}
			return this;
		}

		/**
		 * Builds the composite logger.
		 *
		 * @return the composite logger
		 */
		public CompositeFailureLogger<R, F, C> build() {
			return new CompositeFailureLogger<>(recoverableLoggers, fatalLoggers);
		}
	}
}
