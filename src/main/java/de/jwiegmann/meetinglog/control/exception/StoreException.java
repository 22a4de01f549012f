package de.jwiegmann.meetinglog.control.exception;

import lombok.Getter;

/**
 * Lese- oder Schreibfehler des Record Stores.
 */
@Getter
public class StoreException extends RuntimeException {

    public enum Operation {READ, APPEND}

    private final Operation operation;
    private final String table;

    public StoreException(Operation operation, String table, String message) {
        super(message);
        this.operation = operation;
        this.table = table;
    }

    public StoreException(Operation operation, String table, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.table = table;
    }
}
