package org.javai.tryagain;

/**
 * Thrown when {@link Result#getOrThrow()} is called on a failed result.
 * Unchecked because it signals misuse: the caller should have checked {@link Result#isErr()}
 * or matched on the result first.
 */
public class FatalResultException extends RuntimeException {

    private final transient Object error;

    public FatalResultException(Object error) {
        super("Result failed: " + error, error instanceof Throwable t ? t : null);
        this.error = error;
    }

    public Object error() {
        return error;
    }
}
