package org.javai.tryagain.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.tryagain.Outcome;
import org.javai.tryagain.Result;
import org.javai.tryagain.ops.FailureLoggers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Repeatedly calls an operation until it succeeds, fails fatally, or its recoverable error
 * decides to give up.
 *
 * <p>The retrier never decides on its own to stop: there is no attempt limit here. Whether and
 * how long to wait is up to the {@link Retryable} carried by each recoverable failure, which
 * sees every recoverable failure recorded so far in the same call.
 *
 * <p>When the call ends in a fatal error, the recorded recoverable failures go to the
 * recoverable logger in the order they happened, then the fatal error goes to the fatal logger,
 * then the call returns. A successful call logs nothing.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.create();
 *
 * Result<Quote, HttpStatusError> quote = retrier.run(
 *     quoteClient::fetch,
 *     symbol,
 *     FailureLoggers.of(context, fatalLogger, recoverableLogger));
 *
 * CompletableFuture<Result<Quote, HttpStatusError>> later = retrier.runAsync(
 *     quoteClient::fetchAsync,
 *     symbol,
 *     FailureLoggers.none());
 * }</pre>
 */
public final class Retrier {

    private static final Logger logger = LogManager.getLogger(Retrier.class);

    private static final ScheduledExecutorService SHARED_SCHEDULER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "try-again-scheduler");
        t.setDaemon(true);
        return t;
    });

    private final Clock clock;
    private final Sleeper sleeper;
    private final AsyncSleeper asyncSleeper;

    private Retrier(Clock clock, Sleeper sleeper, AsyncSleeper asyncSleeper) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.asyncSleeper = Objects.requireNonNull(asyncSleeper, "asyncSleeper must not be null");
    }

    /**
     * A retrier with the system clock, {@link Thread#sleep} and a shared daemon scheduler.
     */
    public static Retrier create() {
        return builder().build();
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Thread::sleep;
        private AsyncSleeper asyncSleeper;

        private Builder() {}

        /**
         * Sets the clock that timestamps failures (optional, defaults to the UTC system clock).
         *
         * @param clock the clock to use
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets how {@link #run} waits between attempts (optional, defaults to {@link Thread#sleep}).
         *
         * @param sleeper the blocking sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets how {@link #runAsync} waits between attempts (optional, defaults to a shared daemon scheduler).
         *
         * @param asyncSleeper the non-blocking sleeper
         * @return this builder
         */
        public Builder asyncSleeper(AsyncSleeper asyncSleeper) {
            this.asyncSleeper = Objects.requireNonNull(asyncSleeper, "asyncSleeper must not be null");
            return this;
        }

        /**
         * Makes {@link #runAsync} wait between attempts on the given scheduler.
         *
         * @param scheduler the scheduler that ends each wait
         * @return this builder
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            return asyncSleeper(AsyncSleeper.on(scheduler));
        }

        /**
         * Builds the Retrier instance.
         *
         * @return a configured Retrier
         */
        public Retrier build() {
            AsyncSleeper effectiveAsyncSleeper = asyncSleeper != null ? asyncSleeper : AsyncSleeper.on(SHARED_SCHEDULER);
            return new Retrier(clock, sleeper, effectiveAsyncSleeper);
        }
    }

    /**
     * Calls {@code operation} with {@code argument} until it terminates. The argument is handed
     * over as is on every attempt, which suits immutable arguments.
     *
     * @see #run(Function, Object, UnaryOperator, FailureLoggers)
     */
    public <A, T, R extends Retryable<R, F>, F, C> Result<T, F> run(
            Function<? super A, ? extends Outcome<T, R, F>> operation,
            A argument,
            FailureLoggers<R, F, C> loggers
    ) {
        return run(operation, argument, UnaryOperator.identity(), loggers);
    }

    /**
     * Calls {@code operation} with a fresh copy of {@code argument} until it succeeds, fails
     * fatally, or a recoverable failure gives up. Blocks the calling thread while waiting.
     *
     * @param operation one attempt
     * @param argument the argument of every attempt
     * @param duplicator makes the copy of {@code argument} passed to each attempt
     * @param loggers context and optional loggers that see the failures of a fatal call
     * @return Ok with the successful value, or Err with the fatal error
     * @throws RetryInterruptedException if interrupted while waiting; nothing is logged
     */
    public <A, T, R extends Retryable<R, F>, F, C> Result<T, F> run(
            Function<? super A, ? extends Outcome<T, R, F>> operation,
            A argument,
            UnaryOperator<A> duplicator,
            FailureLoggers<R, F, C> loggers
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(duplicator, "duplicator must not be null");
        Objects.requireNonNull(loggers, "loggers must not be null");

        Attempts<T, R, F, C> attempts = new Attempts<>(clock, loggers);
        while (true) {
            Step<T, F> step = attempts.classify(operation.apply(duplicator.apply(argument)));
            if (step.isDone()) {
                return step.result();
            }
            sleep(step.delay(), attempts.count());
        }
    }

    /**
     * Non-blocking {@link #run(Function, Object, FailureLoggers)}.
     *
     * @see #runAsync(Function, Object, UnaryOperator, FailureLoggers)
     */
    public <A, T, R extends Retryable<R, F>, F, C> CompletableFuture<Result<T, F>> runAsync(
            Function<? super A, ? extends CompletionStage<? extends Outcome<T, R, F>>> operation,
            A argument,
            FailureLoggers<R, F, C> loggers
    ) {
        return runAsync(operation, argument, UnaryOperator.identity(), loggers);
    }

    /**
     * Same as {@link #run(Function, Object, UnaryOperator, FailureLoggers)} for an operation that
     * completes later. Waits between attempts are scheduled rather than slept, so no thread is
     * held while waiting.
     *
     * <p>Cancelling the returned future stops retrying: no further attempt starts, an in-flight
     * attempt that is a {@link Future} is cancelled, and nothing is logged. If an attempt completes
     * exceptionally, the returned future completes exceptionally with the same cause and nothing
     * is logged.
     *
     * @return a future of Ok with the successful value, or Err with the fatal error
     */
    public <A, T, R extends Retryable<R, F>, F, C> CompletableFuture<Result<T, F>> runAsync(
            Function<? super A, ? extends CompletionStage<? extends Outcome<T, R, F>>> operation,
            A argument,
            UnaryOperator<A> duplicator,
            FailureLoggers<R, F, C> loggers
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(duplicator, "duplicator must not be null");
        Objects.requireNonNull(loggers, "loggers must not be null");

        CompletableFuture<Result<T, F>> result = new CompletableFuture<>();
        attemptAsync(operation, argument, duplicator, new Attempts<>(clock, loggers), result);
        return result;
    }

    private <A, T, R extends Retryable<R, F>, F, C> void attemptAsync(
            Function<? super A, ? extends CompletionStage<? extends Outcome<T, R, F>>> operation,
            A argument,
            UnaryOperator<A> duplicator,
            Attempts<T, R, F, C> attempts,
            CompletableFuture<Result<T, F>> result
    ) {
        if (result.isDone()) {
            logger.debug("Retrying stopped after {} attempt(s): result already completed", attempts.count());
            return;
        }

        CompletionStage<? extends Outcome<T, R, F>> attempt;
        try {
            attempt = Objects.requireNonNull(operation.apply(duplicator.apply(argument)), "operation returned null stage");
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        if (attempt instanceof Future<?> inFlight) {
            result.whenComplete((ignored, failure) -> {
                if (result.isCancelled()) {
                    inFlight.cancel(true);
                }
            });
        }

        attempt.whenComplete((outcome, failure) -> {
            if (result.isDone()) {
                return;
            }
            if (failure != null) {
                result.completeExceptionally(unwrap(failure));
                return;
            }

            Step<T, F> step;
            try {
                step = attempts.classify(outcome);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }
            if (step.isDone()) {
                result.complete(step.result());
                return;
            }

            waitAsync(step.delay()).whenComplete((ignored, sleepFailure) -> {
                if (sleepFailure != null) {
                    result.completeExceptionally(unwrap(sleepFailure));
                    return;
                }
                attemptAsync(operation, argument, duplicator, attempts, result);
            });
        });
    }

    private CompletionStage<Void> waitAsync(Duration delay) {
        if (delay.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        return asyncSleeper.sleep(delay);
    }

    private void sleep(Duration duration, int attemptsSoFar) {
        if (duration.isZero()) {
            return;
        }
        try {
            sleeper.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryInterruptedException(attemptsSoFar, e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if ((failure instanceof CompletionException || failure instanceof ExecutionException) && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    /**
     * What to do after one attempt: finish with a result, or wait and try again.
     */
    private record Step<T, F>(Result<T, F> result, Duration delay) {

        static <T, F> Step<T, F> done(Result<T, F> result) {
            return new Step<>(result, null);
        }

        static <T, F> Step<T, F> retryAfter(Duration delay) {
            return new Step<>(null, delay);
        }

        boolean isDone() {
            return result != null;
        }
    }

    /**
     * The state of one call: how many attempts were made and which recoverable failures were
     * retried. Not shared between calls.
     */
    private static final class Attempts<T, R extends Retryable<R, F>, F, C> {

        private final Clock clock;
        private final FailureLoggers<R, F, C> loggers;
        private final List<FailureRecord<R>> history = new ArrayList<>(5);
        private final List<FailureRecord<R>> historyView = Collections.unmodifiableList(history);
        private int count;

        Attempts(Clock clock, FailureLoggers<R, F, C> loggers) {
            this.clock = clock;
            this.loggers = loggers;
        }

        int count() {
            return count;
        }

        Step<T, F> classify(Outcome<T, R, F> outcome) {
            Objects.requireNonNull(outcome, "operation returned null outcome");
            count++;

            if (outcome instanceof Outcome.Ok<T, R, F> ok) {
                if (count > 1) {
                    logger.debug("Succeeded on attempt {}", count);
                }
                return Step.done(Result.ok(ok.value()));
            }

            if (outcome instanceof Outcome.Recoverable<T, R, F> recoverable) {
                R error = recoverable.error();
                Instant now = clock.instant();
                RetryDecision decision = Objects.requireNonNull(
                        error.waitTime(now, historyView), "waitTime must not return null");

                if (decision instanceof RetryDecision.Retry retry) {
                    history.add(new FailureRecord<>(error, now));
                    logger.debug("Attempt {} failed recoverably ({}), retrying in {}", count, error, retry.delay());
                    return Step.retryAfter(retry.delay());
                }

                String reason = ((RetryDecision.GiveUp) decision).reason();
                logger.debug("Giving up after attempt {} ({}): {}", count, error, reason != null ? reason : "no reason given");
                flushHistory();
                F fatal = error.toFatal();
                loggers.logFatal(fatal, now);
                return Step.done(Result.err(fatal));
            }

            F fatal = ((Outcome.Fatal<T, R, F>) outcome).error();
            Instant now = clock.instant();
            logger.debug("Attempt {} failed fatally ({}) after {} recoverable failure(s)", count, fatal, history.size());
            flushHistory();
            loggers.logFatal(fatal, now);
            return Step.done(Result.err(fatal));
        }

        private void flushHistory() {
            if (!loggers.hasRecoverableLogger()) {
                return;
            }
            for (FailureRecord<R> failure : history) {
                loggers.logRecoverable(failure.error(), failure.occurredAt());
            }
        }
    }
}
