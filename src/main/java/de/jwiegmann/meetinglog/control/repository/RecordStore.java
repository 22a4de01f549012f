package de.jwiegmann.meetinglog.control.repository;

import java.util.List;

/**
 * Append-only Tabellenspeicher (Zugangsliste und Record-Log).
 * Quota-Überschreitungen werden als StoreRateLimitedException gemeldet, alle anderen Fehler als StoreException.
 */
public interface RecordStore {

    /**
     * Liefert alle Datenzeilen der Tabelle in Store-Reihenfolge, ohne Kopfzeile.
     */
    List<List<String>> readAll(String table);

    void appendRow(String table, List<String> row);
}
