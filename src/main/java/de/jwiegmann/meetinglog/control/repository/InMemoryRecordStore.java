package de.jwiegmann.meetinglog.control.repository;

import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.exception.StoreException;
import de.jwiegmann.meetinglog.control.exception.StoreRateLimitedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Einfacher In-Memory Record Store.
 * Map Struktur: Map<tableName, List<row>>. Die Zugangsliste wird aus der Konfiguration befüllt,
 * Lese- und Schreib-Quota werden pro Minute gezählt (0 = unbegrenzt).
 */
@Slf4j
@Repository
public class InMemoryRecordStore implements RecordStore {

    private static final Duration QUOTA_WINDOW = Duration.ofMinutes(1);

    private final Map<String, List<List<String>>> tables = new ConcurrentHashMap<>();
    private final QuotaWindow readQuota;
    private final QuotaWindow writeQuota;

    public InMemoryRecordStore(MeetingLogProperties properties, Clock clock) {
        MeetingLogProperties.Store store = properties.getStore();
        this.readQuota = new QuotaWindow(store.getReadQuotaPerMinute(), clock);
        this.writeQuota = new QuotaWindow(store.getWriteQuotaPerMinute(), clock);

        List<List<String>> directory = table(store.getDirectoryTable());
        store.getDirectory().forEach(seed ->
                directory.add(List.of(
                        Objects.requireNonNullElse(seed.getDepartment(), ""),
                        Objects.requireNonNullElse(seed.getGroup(), ""),
                        Objects.requireNonNullElse(seed.getPassword(), ""))));
        table(store.getRecordsTable());

        log.info("In-memory record store '{}' ready, {} directory rows", store.getId(), directory.size());
    }

    @Override
    public List<List<String>> readAll(String table) {
        if (!readQuota.tryAcquire()) {
            throw new StoreRateLimitedException(StoreException.Operation.READ, table, readQuota.retryAfter());
        }
        List<List<String>> rows = tables.get(table);
        if (rows == null) {
            throw new StoreException(StoreException.Operation.READ, table, "unknown table '" + table + "'");
        }
        synchronized (rows) {
            return rows.stream().map(List::copyOf).toList();
        }
    }

    @Override
    public void appendRow(String table, List<String> row) {
        if (!writeQuota.tryAcquire()) {
            throw new StoreRateLimitedException(StoreException.Operation.APPEND, table, writeQuota.retryAfter());
        }
        List<List<String>> rows = tables.get(table);
        if (rows == null) {
            throw new StoreException(StoreException.Operation.APPEND, table, "unknown table '" + table + "'");
        }
        synchronized (rows) {
            rows.add(List.copyOf(row));
        }
    }

    private List<List<String>> table(String name) {
        return tables.computeIfAbsent(name, k -> new ArrayList<>());
    }

    /**
     * Festes Zeitfenster von einer Minute.
     */
    private static final class QuotaWindow {

        private final int limit;
        private final Clock clock;
        private Instant windowStart;
        private int used;

        QuotaWindow(int limit, Clock clock) {
            this.limit = limit;
            this.clock = clock;
            this.windowStart = clock.instant();
        }

        synchronized boolean tryAcquire() {
            if (limit <= 0) {
                return true;
            }
            Instant now = clock.instant();
            if (!now.isBefore(windowStart.plus(QUOTA_WINDOW))) {
                windowStart = now;
                used = 0;
            }
            if (used >= limit) {
                return false;
            }
            used++;
            return true;
        }

        synchronized Duration retryAfter() {
            Duration remaining = Duration.between(clock.instant(), windowStart.plus(QUOTA_WINDOW));
            return remaining.isNegative() ? Duration.ZERO : remaining;
        }
    }
}
