package org.javai.tryagain.retry;

import java.time.Instant;
import java.util.List;

/**
 * Capability of a recoverable error type: it decides how long to wait before the next
 * attempt, and what fatal error it becomes once retrying is abandoned.
 *
 * <p>The decision sees the whole history of recoverable failures recorded so far in the
 * current {@link Retrier} call, not only the most recent one. A gap-based exponential
 * backoff ({@link Backoff#gapDoubling()}) ignores which errors occurred; another
 * implementation might give up early when the same cause keeps repeating.
 *
 * <p>Implementations typically bind a {@link Backoff} when constructed and delegate to it:
 * <pre>{@code
 * record Throttled(int status) implements Retryable<Throttled, HttpStatusError> {
 *     private static final Backoff BACKOFF = Backoff.gapDoubling();
 *
 *     public HttpStatusError toFatal() {
 *         return new HttpStatusError(status);
 *     }
 *
 *     public RetryDecision waitTime(Instant now, List<FailureRecord<Throttled>> history) {
 *         return BACKOFF.decide(now, history);
 *     }
 * }
 * }</pre>
 *
 * @param <R> The implementing recoverable error type itself
 * @param <F> The fatal error type this recoverable error converts to
 */
public interface Retryable<R extends Retryable<R, F>, F> {

    /**
     * Converts this error into its fatal form. Called at most once, on the attempt that
     * ends retrying; the recoverable value is not used afterwards.
     */
    F toFatal();

    /**
     * Decides what to do about this failure.
     *
     * @param now when this failure was observed
     * @param history the earlier recoverable failures of the current call, oldest first,
     *                not including this one; unmodifiable
     * @return {@link RetryDecision.Retry} with the time to wait before the next attempt,
     *         or {@link RetryDecision.GiveUp} to stop now
     */
    RetryDecision waitTime(Instant now, List<FailureRecord<R>> history);
}
