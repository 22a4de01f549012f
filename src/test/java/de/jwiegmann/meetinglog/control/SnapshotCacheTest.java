package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.config.MeetingLogProperties;
import de.jwiegmann.meetinglog.control.exception.StoreException;
import de.jwiegmann.meetinglog.control.exception.StoreRateLimitedException;
import de.jwiegmann.meetinglog.entity.CacheSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class SnapshotCacheTest {

    private MutableClock clock;
    private RecordingRecordStore store;
    private SnapshotCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T08:00:00Z"));
        store = new RecordingRecordStore().withDirectoryRow("Office A", "G1", "pw1");
        MeetingLogProperties properties = new MeetingLogProperties();
        properties.getCache().setTtl(Duration.ofSeconds(60));
        cache = new SnapshotCache(store, new RowMapper(), clock, properties);
    }

    @Test
    void get_within_ttl_fetches_only_once() {
        CacheSnapshot first = cache.get();
        clock.advance(Duration.ofSeconds(59));
        CacheSnapshot second = cache.get();

        assertThat(second).isSameAs(first);
        assertThat(store.recordReads()).isEqualTo(1);
        assertThat(first.getDirectory()).hasSize(1);
    }

    @Test
    void get_after_ttl_fetches_again() {
        cache.get();
        clock.advance(Duration.ofSeconds(60));
        cache.get();

        assertThat(store.recordReads()).isEqualTo(2);
    }

    @Test
    void invalidate_forces_fresh_fetch_regardless_of_remaining_ttl() {
        CacheSnapshot before = cache.get();
        store.appendRow(RecordingRecordStore.RECORDS,
                List.of("id-1", "2024-03-01 08:00:00", "2024-03-01", "Office A", "G1", "Bericht", ""));

        cache.invalidate();
        CacheSnapshot after = cache.get();

        assertThat(store.recordReads()).isEqualTo(2);
        assertThat(before.getRecords()).isEmpty();
        assertThat(after.getRecords()).extracting("id").containsExactly("id-1");
    }

    @Test
    void fetch_failure_is_propagated_and_stale_data_is_not_served() {
        cache.get();
        clock.advance(Duration.ofMinutes(2));
        store.failReads(new StoreRateLimitedException(StoreException.Operation.READ, "records", Duration.ofSeconds(30)));

        assertThatThrownBy(() -> cache.get())
                .isInstanceOf(StoreRateLimitedException.class);

        // nach Behebung wieder normal
        store.failReads(null);
        assertThat(cache.get().getDirectory()).hasSize(1);
    }

    @Test
    void unexpected_store_failure_is_wrapped_as_read_error() {
        store.failReads(new IllegalStateException("socket closed"));

        assertThatThrownBy(() -> cache.get())
                .isInstanceOf(StoreException.class)
                .extracting("operation").isEqualTo(StoreException.Operation.READ);
    }

    @Test
    void concurrent_callers_share_one_in_flight_fetch() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch gate = new CountDownLatch(1);
        store.blockReads(entered, gate);

        ExecutorService executor = Executors.newFixedThreadPool(5);
        try {
            List<Future<CacheSnapshot>> results = new ArrayList<>();
            results.add(executor.submit(cache::get));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            for (int i = 0; i < 4; i++) {
                results.add(executor.submit(cache::get));
            }
            Thread.sleep(100);
            gate.countDown();

            CacheSnapshot first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<CacheSnapshot> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
            assertThat(store.recordReads()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void fetch_started_before_invalidate_is_not_installed() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch gate = new CountDownLatch(1);
        store.blockReads(entered, gate);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<CacheSnapshot> pending = executor.submit(cache::get);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            // Append + Invalidate, während der Fetch noch den alten Stand liest
            cache.invalidate();
            gate.countDown();

            assertThat(pending.get(5, TimeUnit.SECONDS)).isNotNull();
        } finally {
            executor.shutdownNow();
        }

        cache.get();
        assertThat(store.recordReads()).isEqualTo(2);
    }

    @Test
    void error_during_fetch_does_not_leave_a_dangling_in_flight_fetch() {
        store.breakReads(new StackOverflowError("tief"));

        assertThatThrownBy(() -> cache.get()).isInstanceOf(StackOverflowError.class);

        store.breakReads(null);
        CacheSnapshot snapshot = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> cache.get());
        assertThat(snapshot.getDirectory()).hasSize(1);
    }
}
