package org.javai.tryagain.boundary;

import org.javai.tryagain.Outcome;
import org.javai.tryagain.retry.Retryable;

import java.util.Objects;
import java.util.function.Function;

/**
 * Classifies a checked exception as a recoverable or a fatal failure.
 * Implementations should be deterministic and must never report success.
 *
 * @param <R> The recoverable error type
 * @param <F> The fatal error type
 */
@FunctionalInterface
public interface FailureClassifier<R extends Retryable<R, F>, F> {

    /**
     * Classifies an exception.
     *
     * @param operation The operation that was being performed
     * @param exception The exception that occurred
     * @return {@link Outcome.Recoverable} or {@link Outcome.Fatal}
     */
    Outcome<?, R, F> classify(String operation, Exception exception);

    /**
     * Exceptions that {@link TransientExceptions#isTransient(Throwable)} accepts become
     * recoverable, all others fatal.
     *
     * @param recoverable builds the recoverable error from a transient exception
     * @param fatal builds the fatal error from any other exception
     */
    static <R extends Retryable<R, F>, F> FailureClassifier<R, F> byTransience(
            Function<? super Exception, ? extends R> recoverable,
            Function<? super Exception, ? extends F> fatal
    ) {
        Objects.requireNonNull(recoverable);
        Objects.requireNonNull(fatal);

        return (operation, exception) -> {
            if (TransientExceptions.isTransient(exception)) {
                R error = recoverable.apply(exception);
                return new Outcome.Recoverable<Object, R, F>(error);
            }
            F error = fatal.apply(exception);
            return new Outcome.Fatal<Object, R, F>(error);
        };
    }
}
