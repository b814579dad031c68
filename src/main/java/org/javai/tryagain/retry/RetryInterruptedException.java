package org.javai.tryagain.retry;

/**
 * Thrown by {@link Retrier#run} when the thread is interrupted while waiting between attempts.
 * The interrupt flag is restored before throwing. Failures recorded so far are discarded
 * without reaching any logger.
 */
public class RetryInterruptedException extends RuntimeException {

    private final int attempts;

    public RetryInterruptedException(int attempts, InterruptedException cause) {
        super("Interrupted while waiting to retry after " + attempts + " attempt(s)", cause);
        this.attempts = attempts;
    }

    /**
     * The number of attempts made before the interrupt.
     */
    public int attempts() {
        return attempts;
    }
}
