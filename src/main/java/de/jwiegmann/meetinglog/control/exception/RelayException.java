package de.jwiegmann.meetinglog.control.exception;

import lombok.Getter;

/**
 * Fehler beim Upload eines Anhangs über das Relay.
 * Die Art des Fehlers entscheidet, ob ein erneuter Versuch sinnvoll ist.
 */
@Getter
public class RelayException extends RuntimeException {

    public enum Kind {
        TRANSPORT,          // Nicht-2xx oder Netzwerkfehler
        MALFORMED_RESPONSE, // Antwort ist kein gültiges Relay-JSON
        APPLICATION_ERROR   // Relay hat mit status != success geantwortet
    }

    private final Kind kind;

    public RelayException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RelayException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind != Kind.APPLICATION_ERROR;
    }
}
