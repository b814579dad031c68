package org.javai.tryagain;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The terminal result of a retried operation: either {@link Ok} with the successful value
 * or {@link Err} with the fatal error that ended the retrying.
 *
 * <p>Intermediate recoverable failures never appear here; they are visible only through
 * the loggers handed to {@link org.javai.tryagain.retry.Retrier}.
 *
 * @param <T> The type of the successful value
 * @param <F> The fatal error type
 */
public sealed interface Result<T, F> permits Result.Ok, Result.Err {

    /**
     * A successful result.
     *
     * @param value the successful value
     */
    record Ok<T, F>(T value) implements Result<T, F> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isErr() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Result<U, F> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U, F> flatMap(Function<? super T, ? extends Result<U, F>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <G> Result<T, G> mapErr(Function<? super F, ? extends G> mapper) {
            return new Ok<>(value);
        }

        @Override
        public Result<T, F> recover(Function<? super F, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed result.
     *
     * @param error the fatal error
     */
    record Err<T, F>(F error) implements Result<T, F> {

        public Err {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isErr() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new FatalResultException(error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Result<U, F> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(error);
        }

        @Override
        public <U> Result<U, F> flatMap(Function<? super T, ? extends Result<U, F>> mapper) {
            return new Err<>(error);
        }

        @Override
        public <G> Result<T, G> mapErr(Function<? super F, ? extends G> mapper) {
            Objects.requireNonNull(mapper);
            return new Err<>(mapper.apply(error));
        }

        @Override
        public Result<T, F> recover(Function<? super F, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(error));
        }
    }

    // Query methods
    boolean isOk();
    boolean isErr();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Result<U, F> map(Function<? super T, ? extends U> mapper);
    <U> Result<U, F> flatMap(Function<? super T, ? extends Result<U, F>> mapper);
    <G> Result<T, G> mapErr(Function<? super F, ? extends G> mapper);

    // Recovery
    Result<T, F> recover(Function<? super F, ? extends T> recovery);

    // Static factories
    static <T, F> Result<T, F> ok(T value) {
        return new Ok<>(value);
    }

    static <T, F> Result<T, F> err(F error) {
        return new Err<>(error);
    }
}
