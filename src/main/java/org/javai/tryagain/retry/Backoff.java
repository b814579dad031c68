package org.javai.tryagain.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A reusable wait-time strategy driven by the failure history of one {@link Retrier} call.
 * {@link Retryable} implementations bind one of these and delegate
 * {@link Retryable#waitTime(Instant, List)} to it.
 *
 * <p>Strategies that count attempts treat the current failure as attempt
 * {@code history.size() + 1}.
 */
@FunctionalInterface
public interface Backoff {

    /**
     * Decides whether and when to retry.
     *
     * @param now when the current failure was observed
     * @param history earlier failures of the current call, oldest first
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(Instant now, List<? extends FailureRecord<?>> history);

    /**
     * Wraps this strategy with a time budget measured from the first recorded failure.
     * Once the budget is used up the result is GiveUp regardless of this strategy.
     */
    default Backoff withBudget(Duration budget) {
        Objects.requireNonNull(budget, "budget must not be null");
        Backoff delegate = this;
        return (now, history) -> {
            if (!history.isEmpty()) {
                Duration elapsed = Duration.between(history.get(0).occurredAt(), now);
                if (elapsed.compareTo(budget) >= 0) {
                    return RetryDecision.GiveUp.because("budget exhausted");
                }
            }
            return delegate.decide(now, history);
        };
    }

    /**
     * A strategy that never retries.
     */
    static Backoff giveUp() {
        return (now, history) -> RetryDecision.GiveUp.because("no-retry policy");
    }

    /**
     * Fixed delay between attempts, giving up when the current failure is attempt {@code maxAttempts}.
     */
    static Backoff fixed(Duration delay, int maxAttempts) {
        Objects.requireNonNull(delay);
        requireValidAttempts(maxAttempts);

        return (now, history) -> {
            if (history.size() + 1 >= maxAttempts) {
                return RetryDecision.GiveUp.because("max attempts reached");
            }
            return RetryDecision.Retry.after(delay);
        };
    }

    /**
     * Exponential backoff by attempt count: {@code initialDelay * 2^(attempt-1)}, capped at
     * {@code maxDelay}, giving up when the current failure is attempt {@code maxAttempts}.
     */
    static Backoff exponential(Duration initialDelay, Duration maxDelay, int maxAttempts) {
        Objects.requireNonNull(initialDelay);
        Objects.requireNonNull(maxDelay);
        requireValidAttempts(maxAttempts);

        return (now, history) -> {
            int attemptNumber = history.size() + 1;
            if (attemptNumber >= maxAttempts) {
                return RetryDecision.GiveUp.because("max attempts reached");
            }

            // Shift is bounded so the multiplier cannot overflow; the cap applies long before.
            long multiplier = 1L << Math.min(attemptNumber - 1, 30);
            Duration delay = initialDelay.multipliedBy(multiplier);
            if (delay.compareTo(maxDelay) > 0) {
                delay = maxDelay;
            }
            return RetryDecision.Retry.after(delay);
        };
    }

    /**
     * {@link #gapDoubling(Duration, Duration)} with a one second first wait and a thirty second ceiling.
     */
    static Backoff gapDoubling() {
        return gapDoubling(Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    /**
     * Waits twice as long as the gap between the current failure and the previous one.
     * The first failure, or a gap that runs backwards, waits {@code initialDelay}.
     * A gap longer than {@code ceiling} gives up.
     *
     * <p>Since each gap contains the previous wait, waits roughly double each time until the
     * gap passes the ceiling.
     */
    static Backoff gapDoubling(Duration initialDelay, Duration ceiling) {
        Objects.requireNonNull(initialDelay);
        Objects.requireNonNull(ceiling);
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }

        return (now, history) -> {
            if (history.isEmpty()) {
                return RetryDecision.Retry.after(initialDelay);
            }
            Instant previous = history.get(history.size() - 1).occurredAt();
            Duration gap = Duration.between(previous, now);
            if (gap.isNegative()) {
                return RetryDecision.Retry.after(initialDelay);
            }
            if (gap.compareTo(ceiling) > 0) {
                return RetryDecision.GiveUp.because("gap of " + gap + " exceeds " + ceiling);
            }
            return RetryDecision.Retry.after(gap.multipliedBy(2));
        };
    }

    private static void requireValidAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
    }
}
