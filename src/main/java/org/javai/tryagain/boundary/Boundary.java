package org.javai.tryagain.boundary;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.tryagain.Outcome;
import org.javai.tryagain.retry.Backoff;
import org.javai.tryagain.retry.Retryable;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Adapts work that throws checked exceptions into operations a
 * {@link org.javai.tryagain.retry.Retrier} can drive: the result becomes
 * {@link Outcome.Ok}, a checked exception is classified into
 * {@link Outcome.Recoverable} or {@link Outcome.Fatal}.
 *
 * <p>RuntimeExceptions (defects) are not caught; they propagate and end the retried call.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary<TransientFailure, Exception> boundary = Boundary.transientOnly(Backoff.gapDoubling());
 *
 * Result<HttpResponse<String>, Exception> response = retrier.run(
 *     boundary.wrap("HttpClient.send", request -> httpClient.send(request, BodyHandlers.ofString())),
 *     request,
 *     FailureLoggers.none());
 * }</pre>
 *
 * @param <R> The recoverable error type
 * @param <F> The fatal error type
 */
public final class Boundary<R extends Retryable<R, F>, F> {

    private static final Logger logger = LogManager.getLogger(Boundary.class);

    private final FailureClassifier<R, F> classifier;

    private Boundary(FailureClassifier<R, F> classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Creates a Boundary with a custom classifier.
     *
     * @param classifier the classifier for translating exceptions to failures
     * @return a Boundary using the classifier
     */
    public static <R extends Retryable<R, F>, F> Boundary<R, F> of(FailureClassifier<R, F> classifier) {
        return new Boundary<>(classifier);
    }

    /**
     * Creates a Boundary that retries exceptions {@link TransientExceptions} considers
     * transient, with the given backoff, and fails fatally with any other exception.
     *
     * @param backoff the strategy bound to each transient failure
     * @return a Boundary over {@link TransientFailure}
     */
    public static Boundary<TransientFailure, Exception> transientOnly(Backoff backoff) {
        Objects.requireNonNull(backoff, "backoff must not be null");
        return new Boundary<>(FailureClassifier.<TransientFailure, Exception>byTransience(e -> new TransientFailure(e, backoff), e -> e));
    }

    /**
     * Executes work once, translating a checked exception into a failed Outcome.
     *
     * @param operation The operation name for context and logging
     * @param work The work to execute
     * @return Ok with the result, or a classified failure
     */
    public <T> Outcome<T, R, F> call(String operation, ThrowingSupplier<? extends T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            // Defects propagate; they are not operational failures.
            throw e;
        } catch (Exception e) {
            return classify(operation, e);
        }
    }

    /**
     * Turns a throwing function into an operation for {@link org.javai.tryagain.retry.Retrier#run}.
     *
     * @param operation The operation name for context and logging
     * @param work The work of one attempt
     * @return a function performing one classified attempt
     */
    public <A, T> Function<A, Outcome<T, R, F>> wrap(
            String operation,
            ThrowingFunction<? super A, ? extends T, ? extends Exception> work
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return argument -> call(operation, () -> work.apply(argument));
    }

    /**
     * Turns an asynchronous function into an operation for
     * {@link org.javai.tryagain.retry.Retrier#runAsync}. A stage completing exceptionally with a
     * checked exception is classified; with anything else it stays exceptional.
     *
     * @param operation The operation name for context and logging
     * @param work The work of one attempt
     * @return a function performing one classified attempt
     */
    public <A, T> Function<A, CompletionStage<Outcome<T, R, F>>> wrapAsync(
            String operation,
            Function<? super A, ? extends CompletionStage<? extends T>> work
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return argument -> work.apply(argument).handle((value, failure) -> {
            if (failure == null) {
                return Outcome.ok(value);
            }
            Throwable cause = unwrap(failure);
            if (cause instanceof Exception e && !(cause instanceof RuntimeException)) {
                return classify(operation, e);
            }
            throw failure instanceof CompletionException ce ? ce : new CompletionException(cause);
        });
    }

    private <T> Outcome<T, R, F> classify(String operation, Exception e) {
        Outcome<?, R, F> classified = Objects.requireNonNull(
                classifier.classify(operation, e), "classifier must not return null");

        if (classified instanceof Outcome.Recoverable<?, R, F> recoverable) {
            logger.debug("Operation [{}] failed recoverably: {}", operation, e.toString());
            return new Outcome.Recoverable<>(recoverable.error());
        }
        if (classified instanceof Outcome.Fatal<?, R, F> fatal) {
            logger.debug("Operation [{}] failed fatally: {}", operation, e.toString());
            return new Outcome.Fatal<>(fatal.error());
        }
        throw new IllegalStateException("classifier reported success for " + e);
    }

    private static Throwable unwrap(Throwable failure) {
        if ((failure instanceof CompletionException || failure instanceof ExecutionException) && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
