package org.javai.tryagain;

import org.javai.tryagain.retry.Retryable;

import java.util.Objects;
import java.util.function.Function;

/**
 * Classifies the result of a single attempt of an operation.
 * Exactly one of {@link Ok}, {@link Recoverable} or {@link Fatal}.
 *
 * <p>The recoverable leg carries an error type that knows its own retry policy and the
 * fatal error it turns into once retrying is abandoned. Because {@code R} declares
 * {@code Retryable<R, F>}, the fatal type of an outcome is fixed by its recoverable type.
 *
 * @param <T> The type of the successful value
 * @param <R> The recoverable error type
 * @param <F> The fatal error type
 */
public sealed interface Outcome<T, R extends Retryable<R, F>, F>
        permits Outcome.Ok, Outcome.Recoverable, Outcome.Fatal {

    /**
     * The attempt succeeded.
     *
     * @param value the successful value, may be null
     */
    record Ok<T, R extends Retryable<R, F>, F>(T value) implements Outcome<T, R, F> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isRecoverable() {
            return false;
        }

        @Override
        public boolean isFatal() {
            return false;
        }

        @Override
        public <U> Outcome<U, R, F> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }
    }

    /**
     * The attempt failed in a way that may be worth retrying.
     *
     * @param error the recoverable error
     */
    record Recoverable<T, R extends Retryable<R, F>, F>(R error) implements Outcome<T, R, F> {

        public Recoverable {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isRecoverable() {
            return true;
        }

        @Override
        public boolean isFatal() {
            return false;
        }

        @Override
        public <U> Outcome<U, R, F> map(Function<? super T, ? extends U> mapper) {
            return new Recoverable<>(error);
        }
    }

    /**
     * The attempt failed and retrying cannot help.
     *
     * @param error the fatal error
     */
    record Fatal<T, R extends Retryable<R, F>, F>(F error) implements Outcome<T, R, F> {

        public Fatal {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isRecoverable() {
            return false;
        }

        @Override
        public boolean isFatal() {
            return true;
        }

        @Override
        public <U> Outcome<U, R, F> map(Function<? super T, ? extends U> mapper) {
            return new Fatal<>(error);
        }
    }

    // Query methods
    boolean isOk();
    boolean isRecoverable();
    boolean isFatal();

    // Transformations
    <U> Outcome<U, R, F> map(Function<? super T, ? extends U> mapper);

    // Static factories
    static <T, R extends Retryable<R, F>, F> Outcome<T, R, F> ok(T value) {
        return new Ok<>(value);
    }

    static <T, R extends Retryable<R, F>, F> Outcome<T, R, F> recoverable(R error) {
        return new Recoverable<>(error);
    }

    static <T, R extends Retryable<R, F>, F> Outcome<T, R, F> fatal(F error) {
        return new Fatal<>(error);
    }
}
