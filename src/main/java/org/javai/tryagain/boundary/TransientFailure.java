package org.javai.tryagain.boundary;

import org.javai.tryagain.retry.Backoff;
import org.javai.tryagain.retry.FailureRecord;
import org.javai.tryagain.retry.RetryDecision;
import org.javai.tryagain.retry.Retryable;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A transient exception carrying the backoff that decides whether to retry it.
 * Becomes the exception itself when retrying is abandoned.
 *
 * @param cause the exception that made the attempt fail
 * @param backoff the strategy bound to this failure
 */
public record TransientFailure(Exception cause, Backoff backoff) implements Retryable<TransientFailure, Exception> {

    public TransientFailure {
        Objects.requireNonNull(cause, "cause must not be null");
        Objects.requireNonNull(backoff, "backoff must not be null");
    }

    @Override
    public Exception toFatal() {
        return cause;
    }

    @Override
    public RetryDecision waitTime(Instant now, List<FailureRecord<TransientFailure>> history) {
        return backoff.decide(now, history);
    }

    @Override
    public String toString() {
        return "TransientFailure[" + cause + "]";
    }
}
