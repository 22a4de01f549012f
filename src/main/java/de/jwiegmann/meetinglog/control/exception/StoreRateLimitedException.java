package de.jwiegmann.meetinglog.control.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Quota des Stores erschöpft. Aufrufer sollen warten und nicht blind wiederholen.
 */
@Getter
public class StoreRateLimitedException extends StoreException {

    private final Duration retryAfter;

    public StoreRateLimitedException(Operation operation, String table, Duration retryAfter) {
        super(operation, table, "store quota exhausted for " + operation.name().toLowerCase() + " on '" + table + "'");
        this.retryAfter = retryAfter;
    }
}
