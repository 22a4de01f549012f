package de.jwiegmann.meetinglog.boundary.dto.status;

/**
 * Status eines Warenkorb-Eintrags nach einem Commit-Lauf.
 */
public enum CommitItemStatus {
    APPENDED,   // Record geschrieben (ggf. ohne Anhang)
    FAILED,     // Append fehlgeschlagen, Lauf abgebrochen
    SKIPPED     // nach einem Abbruch nicht mehr versucht
}
