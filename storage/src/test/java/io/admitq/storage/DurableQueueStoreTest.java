// file: storage/src/test/java/io/admitq/storage/DurableQueueStoreTest.java
package io.admitq.storage;

import io.admitq.core.EnqueueRequest;
import io.admitq.core.EntryNotFoundException;
import io.admitq.core.EntryStatus;
import io.admitq.core.InvalidStateException;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueScope;
import io.admitq.core.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DurableQueueStoreTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private MutableClock clock;
    private DurableQueueStore store;

    @BeforeEach
    void open() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new DurableQueueStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new SnapshotPolicy(1_000), clock);
    }

    @AfterEach
    void close() {
        store.close();
    }

    private String enqueue(String org, String agent, int priority) {
        String id = store.enqueue(new EnqueueRequest(org, agent, "sched-" + agent, priority));
        clock.advance(Duration.ofSeconds(1));
        return id;
    }

    @Test
    void enqueue_rejects_blank_ids_and_out_of_range_priority() {
        assertThrows(ValidationException.class, () -> store.enqueue(new EnqueueRequest("", "a", "s", 0)));
        assertThrows(ValidationException.class, () -> store.enqueue(new EnqueueRequest("o", " ", "s", 0)));
        assertThrows(ValidationException.class, () -> store.enqueue(new EnqueueRequest("o", "a", null, 0)));
        assertThrows(ValidationException.class,
                () -> store.enqueue(new EnqueueRequest("o", "a", "s", QueueEntry.MAX_PRIORITY + 1)));
        assertThrows(ValidationException.class,
                () -> store.enqueue(new EnqueueRequest("o", "a", "s", QueueEntry.MIN_PRIORITY - 1)));
        assertEquals(0, store.size());
    }

    @Test
    void new_entry_is_queued_with_timestamps_from_clock() {
        Instant before = clock.instant();
        String id = enqueue("org-1", "agent-1", 3);

        QueueEntry e = store.get(id).orElseThrow();
        assertEquals(EntryStatus.QUEUED, e.status());
        assertEquals(before, e.queuedAt());
        assertEquals(before, e.createdAt());
        assertNull(e.startedAt());
        assertEquals(3, e.priority());
    }

    @Test
    void list_queued_orders_by_priority_then_queued_at() {
        String low1 = enqueue("org-1", "agent-1", 5);
        String high = enqueue("org-1", "agent-2", 10);
        String low2 = enqueue("org-1", "agent-1", 5);
        enqueue("org-2", "agent-9", 100); // other org must not leak in

        List<String> ids = store.listQueued(QueueScope.byOrg("org-1")).stream().map(QueueEntry::id).toList();
        assertEquals(List.of(high, low1, low2), ids);
        assertEquals(high, store.oldestQueued("org-1").orElseThrow().id());
    }

    @Test
    void identical_priority_and_time_fall_back_to_id_order() {
        // clock does not move between these two
        String a = store.enqueue(new EnqueueRequest("org-1", "agent-1", "s", 0));
        String b = store.enqueue(new EnqueueRequest("org-1", "agent-1", "s", 0));

        List<String> ids = store.listQueued(QueueScope.byOrg("org-1")).stream().map(QueueEntry::id).toList();
        List<String> expected = a.compareTo(b) < 0 ? List.of(a, b) : List.of(b, a);
        assertEquals(expected, ids);
    }

    @Test
    void list_by_agent_spans_orgs_and_keeps_order() {
        String x = enqueue("org-1", "agent-1", 1);
        enqueue("org-1", "agent-2", 50);
        String y = enqueue("org-2", "agent-1", 7);

        List<String> ids = store.listQueued(QueueScope.byAgent("agent-1")).stream().map(QueueEntry::id).toList();
        assertEquals(List.of(y, x), ids);
    }

    @Test
    void oldest_queued_is_empty_for_unknown_or_drained_org() {
        assertTrue(store.oldestQueued("nobody").isEmpty());

        String id = enqueue("org-1", "agent-1", 0);
        store.markStarted(id, clock.instant());
        assertTrue(store.oldestQueued("org-1").isEmpty());
    }

    @Test
    void mark_started_moves_entry_out_of_queued_indexes() {
        String id = enqueue("org-1", "agent-1", 0);
        Instant at = clock.instant();

        QueueEntry started = store.markStarted(id, at);

        assertEquals(EntryStatus.STARTED, started.status());
        assertEquals(at, started.startedAt());
        assertTrue(store.listQueued(QueueScope.byOrg("org-1")).isEmpty());
        assertTrue(store.listQueued(QueueScope.byAgent("agent-1")).isEmpty());
        assertEquals(started, store.get(id).orElseThrow());
    }

    @Test
    void transitions_fail_for_unknown_or_non_queued_entries() {
        assertThrows(EntryNotFoundException.class, () -> store.markStarted("missing", clock.instant()));
        assertThrows(EntryNotFoundException.class, () -> store.markCanceled("missing"));

        String id = enqueue("org-1", "agent-1", 0);
        store.markStarted(id, clock.instant());

        var again = assertThrows(InvalidStateException.class, () -> store.markStarted(id, clock.instant()));
        assertEquals(EntryStatus.STARTED, again.actual());
        assertThrows(InvalidStateException.class, () -> store.markCanceled(id));

        String other = enqueue("org-1", "agent-1", 0);
        store.markCanceled(other);
        assertThrows(InvalidStateException.class, () -> store.markStarted(other, clock.instant()));
    }

    @Test
    void remove_deletes_any_status_and_fails_when_absent() {
        String id = enqueue("org-1", "agent-1", 0);
        store.markCanceled(id);

        store.remove(id);

        assertTrue(store.get(id).isEmpty());
        assertThrows(EntryNotFoundException.class, () -> store.remove(id));
    }

    @Test
    void remove_if_rechecks_condition() {
        String id = enqueue("org-1", "agent-1", 0);

        assertFalse(store.removeIf(id, e -> !e.isQueued()));
        assertTrue(store.get(id).isPresent());
        assertTrue(store.removeIf(id, QueueEntry::isQueued));
        assertFalse(store.removeIf(id, e -> true));
    }

    @Test
    void count_by_agent_counts_only_queued() {
        enqueue("org-1", "agent-1", 0);
        enqueue("org-1", "agent-1", 0);
        String started = enqueue("org-1", "agent-2", 0);
        enqueue("org-1", "agent-3", 0);
        store.markStarted(started, clock.instant());

        assertEquals(Map.of("agent-1", 2, "agent-3", 1), store.countByAgent("org-1"));
        assertEquals(Map.of(), store.countByAgent("nobody"));
    }

    @Test
    void orgs_with_queued_tracks_pending_work() {
        String a = enqueue("org-1", "agent-1", 0);
        enqueue("org-2", "agent-2", 0);
        store.markCanceled(a);

        assertEquals(Set.of("org-2"), store.orgsWithQueued());
    }

    @Test
    void find_filters_by_org_and_predicate() {
        String a = enqueue("org-1", "agent-1", 0);
        String b = enqueue("org-1", "agent-1", 0);
        enqueue("org-2", "agent-1", 0);
        store.markStarted(b, clock.instant());

        assertEquals(List.of(b), store.find("org-1", e -> e.status() == EntryStatus.STARTED)
                .stream().map(QueueEntry::id).toList());
        assertEquals(2, store.find("org-1", e -> true).size());
        assertEquals(3, store.findAll(e -> true).size());
        assertTrue(store.find("org-1", e -> e.id().equals(a)).get(0).isQueued());
    }
}
