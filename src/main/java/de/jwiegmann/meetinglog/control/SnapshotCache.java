package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.exception.StoreException;
import de.jwiegmann.meetinglog.control.repository.RecordStore;
import de.jwiegmann.meetinglog.entity.CacheSnapshot;
import de.jwiegmann.meetinglog.entity.DirectoryEntry;
import de.jwiegmann.meetinglog.entity.MeetingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Zeitlich begrenzter Snapshot von Zugangsliste und Record-Log.
 * <p>
 * Innerhalb der TTL wird der Store nicht erneut gelesen. Gleichzeitige Aufrufer während eines laufenden
 * Fetches warten auf dessen Ergebnis, statt einen eigenen Fetch zu starten. Nach {@link #invalidate()} wird
 * ein bereits laufender Fetch nicht mehr als Snapshot übernommen, da er den Schreibvorgang evtl. nicht sieht.
 * Fehler beim Fetch werden durchgereicht, abgelaufene Daten werden nie ausgeliefert.
 */
@Slf4j
@Component
public class SnapshotCache {

    private final RecordStore recordStore;
    private final RowMapper rowMapper;
    private final Clock clock;
    private final Duration ttl;
    private final String directoryTable;
    private final String recordsTable;

    private final Object lock = new Object();

    // guarded by lock
    private CacheSnapshot snapshot;
    private long generation;
    private CompletableFuture<CacheSnapshot> inFlight;
    private long inFlightGeneration;

    public SnapshotCache(RecordStore recordStore, RowMapper rowMapper, Clock clock, MeetingLogProperties properties) {
        this.recordStore = recordStore;
        this.rowMapper = rowMapper;
        this.clock = clock;
        this.ttl = properties.getCache().getTtl();
        this.directoryTable = properties.getStore().getDirectoryTable();
        this.recordsTable = properties.getStore().getRecordsTable();
    }

    /**
     * Liefert den aktuellen Snapshot oder lädt ihn neu, wenn er älter als die TTL ist.
     *
     * @throws StoreException wenn der Store nicht gelesen werden kann
     */
    public CacheSnapshot get() {
        CompletableFuture<CacheSnapshot> fetch;
        long fetchGeneration;
        boolean owner = false;

        synchronized (lock) {
            if (isFresh(snapshot)) {
                log.debug("Snapshot cache hit (fetchedAt={})", snapshot.getFetchedAt());
                return snapshot;
            }
            if (inFlight == null || inFlightGeneration != generation) {
                inFlight = new CompletableFuture<>();
                inFlightGeneration = generation;
                owner = true;
            }
            fetch = inFlight;
            fetchGeneration = inFlightGeneration;
        }

        if (owner) {
            return fetchAndPublish(fetch, fetchGeneration);
        }
        return await(fetch);
    }

    /**
     * Erzwingt beim nächsten {@link #get()} einen frischen Fetch, unabhängig von der restlichen TTL.
     */
    public void invalidate() {
        synchronized (lock) {
            snapshot = null;
            generation++;
        }
        log.debug("Snapshot cache invalidated");
    }

    private CacheSnapshot fetchAndPublish(CompletableFuture<CacheSnapshot> fetch, long fetchGeneration) {
        CacheSnapshot fresh;
        try {
            fresh = load();
        } catch (Throwable e) {
            // auch bei Errors aufräumen, sonst warten spätere Aufrufer ewig auf diesen Fetch
            synchronized (lock) {
                if (inFlight == fetch) {
                    inFlight = null;
                }
            }
            fetch.completeExceptionally(e);
            throw e;
        }

        synchronized (lock) {
            if (fetchGeneration == generation) {
                snapshot = fresh;
            }
            if (inFlight == fetch) {
                inFlight = null;
            }
        }
        fetch.complete(fresh);
        return fresh;
    }

    private CacheSnapshot load() {
        Instant fetchedAt = clock.instant();
        List<DirectoryEntry> directory;
        List<MeetingRecord> records;
        try {
            directory = recordStore.readAll(directoryTable).stream().map(rowMapper::toDirectoryEntry).toList();
            records = recordStore.readAll(recordsTable).stream().map(rowMapper::toRecord).toList();
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException(StoreException.Operation.READ, recordsTable, "snapshot fetch failed: " + e.getMessage(), e);
        }
        log.info("Snapshot refreshed: {} directory rows, {} records", directory.size(), records.size());
        return new CacheSnapshot(directory, records, fetchedAt);
    }

    private boolean isFresh(CacheSnapshot candidate) {
        return candidate != null
                && Duration.between(candidate.getFetchedAt(), clock.instant()).compareTo(ttl) < 0;
    }

    private static CacheSnapshot await(CompletableFuture<CacheSnapshot> fetch) {
        try {
            return fetch.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
