package de.jwiegmann.meetinglog.entity;

import java.util.ArrayList;
import java.util.List;

/**
 * FIFO-Liste der gestagten Einträge. Die Reihenfolge hier ist die Commit-Reihenfolge.
 */
public class Cart {

    private final List<CartItem> items = new ArrayList<>();

    public synchronized void append(CartItem item) {
        items.add(item);
    }

    /**
     * Entfernt genau die übergebenen Einträge (Vergleich per Identität). Was zwischenzeitlich
     * hinzugekommen ist, bleibt in seiner Reihenfolge erhalten.
     */
    public synchronized void removeCommitted(List<CartItem> committed) {
        items.removeIf(item -> committed.stream().anyMatch(c -> c == item));
    }

    public synchronized void clear() {
        items.clear();
    }

    /**
     * Unveränderliche Kopie des aktuellen Stands, kann beliebig oft erzeugt werden.
     */
    public synchronized List<CartItem> items() {
        return List.copyOf(items);
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized boolean isEmpty() {
        return items.isEmpty();
    }
}
