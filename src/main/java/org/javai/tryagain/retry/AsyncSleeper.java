package org.javai.tryagain.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Non-blocking wait between attempts of {@link Retrier#runAsync}: returns a stage that
 * completes once the delay has elapsed, without holding a thread meanwhile.
 */
@FunctionalInterface
public interface AsyncSleeper {

    CompletionStage<Void> sleep(Duration delay);

    /**
     * Completes the returned stages from the given scheduler.
     */
    static AsyncSleeper on(ScheduledExecutorService scheduler) {
        Objects.requireNonNull(scheduler, "scheduler must not be null");
        return delay -> {
            CompletableFuture<Void> elapsed = new CompletableFuture<>();
            scheduler.schedule(() -> elapsed.complete(null), delay.toNanos(), TimeUnit.NANOSECONDS);
            return elapsed;
        };
    }
}
