package org.javai.tryagain.retry;

import java.time.Instant;
import java.util.Objects;

/**
 * A recoverable failure together with the time it was observed.
 *
 * @param error the recoverable error
 * @param occurredAt when the orchestrator observed it
 */
public record FailureRecord<R>(R error, Instant occurredAt) {

    public FailureRecord {
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }
}
