package org.javai.tryagain.boundary;

/**
 * A function that may throw a checked exception.
 * Used by {@link Boundary} to wrap calls to third-party APIs.
 *
 * @param <A> The argument type
 * @param <T> The result type
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<A, T, E extends Exception> {

    T apply(A argument) throws E;
}
