// file: server/src/test/java/io/admitq/server/ReaperTest.java
package io.admitq.server;

import io.admitq.core.EnqueueRequest;
import io.admitq.core.QueueEntry;
import io.admitq.storage.DurableQueueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sweep removes exactly:
 *  - STARTED entries with startedAt older than 24h,
 *  - CANCELED entries,
 *  - QUEUED entries with queuedAt older than 7 days.
 */
class ReaperTest {

    @TempDir Path dir;

    private static final Instant T0 = Instant.parse("2026-07-01T00:00:00Z");
    private static final Instant NOW = T0.plus(Duration.ofDays(8));

    private final TestClock clock = new TestClock(T0);
    private DurableQueueStore store;
    private Reaper reaper;

    @BeforeEach
    void setUp() {
        store = TestStores.open(dir, clock);
        reaper = new Reaper(store, clock, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        reaper.stop();
        store.close();
    }

    private String enqueueAt(Instant at) {
        clock.set(at);
        return store.enqueue(new EnqueueRequest("org-1", "agent-1", "sched", 0));
    }

    private Set<String> remainingIds() {
        return store.findAll(e -> true).stream().map(QueueEntry::id).collect(Collectors.toSet());
    }

    @Test
    void sweep_removes_exactly_the_expired_entries() {
        String queuedOld = enqueueAt(T0);
        String queuedFresh = enqueueAt(NOW.minus(Duration.ofDays(6)));
        String startedOld = enqueueAt(NOW.minus(Duration.ofHours(26)));
        store.markStarted(startedOld, NOW.minus(Duration.ofHours(25)));
        String startedFresh = enqueueAt(NOW.minus(Duration.ofHours(2)));
        store.markStarted(startedFresh, NOW.minus(Duration.ofHours(1)));
        String canceled = enqueueAt(NOW.minus(Duration.ofMinutes(5)));
        store.markCanceled(canceled);

        int removed = reaper.sweep(NOW);

        assertEquals(3, removed);
        assertEquals(Set.of(queuedFresh, startedFresh), remainingIds());
        assertFalse(remainingIds().contains(queuedOld));
    }

    @Test
    void started_25h_ago_is_removed_but_1h_ago_is_kept() {
        String stale = enqueueAt(NOW.minus(Duration.ofHours(30)));
        store.markStarted(stale, NOW.minus(Duration.ofHours(25)));
        String recent = enqueueAt(NOW.minus(Duration.ofHours(30)));
        store.markStarted(recent, NOW.minus(Duration.ofHours(1)));

        reaper.sweep(NOW);

        assertTrue(store.get(stale).isEmpty());
        assertTrue(store.get(recent).isPresent());
    }

    @Test
    void second_sweep_is_a_no_op() {
        String c = enqueueAt(T0);
        store.markCanceled(c);

        assertEquals(1, reaper.sweep(NOW));
        assertEquals(0, reaper.sweep(NOW));
    }

    @Test
    void custom_thresholds_are_honoured() {
        Reaper strict = new Reaper(store, clock, Duration.ofHours(1), Duration.ofMinutes(10), Duration.ofHours(1));
        String queued = enqueueAt(NOW.minus(Duration.ofHours(2)));
        String started = enqueueAt(NOW.minus(Duration.ofMinutes(30)));
        store.markStarted(started, NOW.minus(Duration.ofMinutes(20)));

        assertEquals(2, strict.sweep(NOW));
        assertTrue(store.get(queued).isEmpty());
        assertTrue(store.get(started).isEmpty());
    }

    @Test
    void scheduled_sweeps_run_in_background() throws Exception {
        String c = enqueueAt(NOW);
        store.markCanceled(c);
        Reaper fast = new Reaper(store, clock, Duration.ofMillis(20));
        try {
            fast.start();
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (store.get(c).isPresent() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertTrue(store.get(c).isEmpty());
        } finally {
            fast.stop();
        }
    }
}
