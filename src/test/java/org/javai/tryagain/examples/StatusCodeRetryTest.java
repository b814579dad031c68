package org.javai.tryagain.examples;

import org.javai.tryagain.Outcome;
import org.javai.tryagain.Result;
import org.javai.tryagain.TestClock;
import org.javai.tryagain.ops.FailureLoggers;
import org.javai.tryagain.retry.Backoff;
import org.javai.tryagain.retry.FailureRecord;
import org.javai.tryagain.retry.Retrier;
import org.javai.tryagain.retry.RetryDecision;
import org.javai.tryagain.retry.Retryable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

/**
 * Halves even numbers right away. Odd numbers come back with HTTP status 200 as a
 * recoverable error unless a coin flip lets them through.
 */
class StatusCodeRetryTest {

    private static final Instant START = Instant.parse("2024-01-20T10:30:00Z");

    record RetryingStatusCode(int status) implements Retryable<RetryingStatusCode, Integer> {

        private static final Backoff BACKOFF = Backoff.gapDoubling();

        @Override
        public Integer toFatal() {
            return status;
        }

        @Override
        public RetryDecision waitTime(Instant now, List<FailureRecord<RetryingStatusCode>> history) {
            return BACKOFF.decide(now, history);
        }
    }

    private TestClock clock;
    private List<Duration> waits;
    private List<String> events;
    private FailureLoggers<RetryingStatusCode, Integer, List<String>> loggers;

    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        waits = new ArrayList<>();
        events = new ArrayList<>();
        loggers = FailureLoggers.of(
                events,
                (status, at, context) -> context.add("fatal " + status + " at +" + Duration.between(START, at).toSeconds() + "s"),
                (error, at, context) -> context.add("recoverable " + error.status() + " at +" + Duration.between(START, at).toSeconds() + "s"));
    }

    @Test
    void evenArgument_succeedsImmediately() {
        Result<Integer, Integer> result = retrier().run(halveWith(coins()), 4, loggers);

        assertThat(result).isEqualTo(Result.ok(2));
        assertThat(waits).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    void oddArgument_luckyCoin_succeedsAfterOneSecond() {
        Result<Integer, Integer> result = retrier().run(halveWith(coins(false, true)), 3, loggers);

        assertThat(result).isEqualTo(Result.ok(1));
        assertThat(waits).containsExactly(Duration.ofSeconds(1));
        assertThat(events).isEmpty();
    }

    @Test
    void oddArgument_unluckyCoin_givesUpOnceGapPassesThirtySeconds() {
        Result<Integer, Integer> result = retrier().run(halveWith(coins()), 3, loggers);

        assertThat(result).isEqualTo(Result.err(200));
        assertThat(waits).containsExactly(
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                Duration.ofSeconds(4),
                Duration.ofSeconds(8),
                Duration.ofSeconds(16),
                Duration.ofSeconds(32));
        assertThat(events).containsExactly(
                "recoverable 200 at +0s",
                "recoverable 200 at +1s",
                "recoverable 200 at +3s",
                "recoverable 200 at +7s",
                "recoverable 200 at +15s",
                "recoverable 200 at +31s",
                "fatal 200 at +63s");
    }

    @Test
    void oddArgument_async_endsWithSameResultAsBlockingRun() {
        Retrier retrier = Retrier.builder()
                .clock(clock)
                .asyncSleeper(delay -> {
                    waits.add(delay);
                    clock.advance(delay);
                    return CompletableFuture.completedFuture(null);
                })
                .build();
        Function<Integer, Outcome<Integer, RetryingStatusCode, Integer>> halve = halveWith(coins(false, false, true));

        Result<Integer, Integer> result = retrier.runAsync(
                (Integer u) -> CompletableFuture.completedFuture(halve.apply(u)), 3, loggers).join();

        assertThat(result).isEqualTo(Result.ok(1));
        assertThat(waits).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    private Retrier retrier() {
        return Retrier.builder()
                .clock(clock)
                .sleeper(millis -> {
                    waits.add(Duration.ofMillis(millis));
                    clock.advance(Duration.ofMillis(millis));
                })
                .build();
    }

    /**
     * One attempt: even numbers are halved, odd numbers only when the next coin comes up true.
     */
    private static Function<Integer, Outcome<Integer, RetryingStatusCode, Integer>> halveWith(Iterator<Boolean> coin) {
        return u -> {
            if (u % 2 == 0 || coin.next()) {
                return Outcome.ok(u >> 1);
            }
            return Outcome.recoverable(new RetryingStatusCode(200));
        };
    }

    /**
     * The given flips, then tails forever.
     */
    private static Iterator<Boolean> coins(Boolean... flips) {
        Iterator<Boolean> scripted = List.of(flips).iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Boolean next() {
                return scripted.hasNext() ? scripted.next() : Boolean.FALSE;
            }
        };
    }
}
