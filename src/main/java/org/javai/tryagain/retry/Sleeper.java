package org.javai.tryagain.retry;

/**
 * Blocks the calling thread between attempts of {@link Retrier#run}.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
}
