package org.javai.tryagain.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * The decision a {@link Retryable} makes about a recoverable failure.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry immediate() {
            return new Retry(Duration.ZERO);
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }

        @Override
        public Optional<Duration> waitTime() {
            return Optional.of(delay);
        }
    }

    /**
     * Stop retrying; the current failure becomes fatal.
     */
    record GiveUp(String reason) implements RetryDecision {
        public GiveUp() {
            this(null);
        }

        public static GiveUp because(String reason) {
            return new GiveUp(reason);
        }

        @Override
        public Optional<Duration> waitTime() {
            return Optional.empty();
        }
    }

    /**
     * The time to wait before the next attempt, or empty when giving up.
     */
    Optional<Duration> waitTime();

    /**
     * Adapts an optional wait time: present means retry after it, empty means give up.
     */
    static RetryDecision of(Optional<Duration> waitTime) {
        Objects.requireNonNull(waitTime, "waitTime must not be null");
        return waitTime.<RetryDecision>map(Retry::new).orElseGet(GiveUp::new);
    }
}
