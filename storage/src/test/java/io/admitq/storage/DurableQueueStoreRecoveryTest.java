// file: storage/src/test/java/io/admitq/storage/DurableQueueStoreRecoveryTest.java
package io.admitq.storage;

import io.admitq.core.EnqueueRequest;
import io.admitq.core.EntryStatus;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueScope;
import io.admitq.core.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class DurableQueueStoreRecoveryTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));

    private DurableQueueStore open(int snapshotEvery) {
        return new DurableQueueStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new SnapshotPolicy(snapshotEvery), clock);
    }

    private Path activeSegment() throws Exception {
        try (Stream<Path> files = Files.list(walDir)) {
            return files.filter(p -> p.toString().endsWith(".log")).sorted().reduce((a, b) -> b).orElseThrow();
        }
    }

    @Test
    void entries_and_transitions_survive_restart() {
        var store1 = open(1_000);
        String a = store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s1", 5));
        clock.advance(Duration.ofMinutes(1));
        String b = store1.enqueue(new EnqueueRequest("org-1", "agent-2", "s2", 10));
        clock.advance(Duration.ofMinutes(1));
        String c = store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s3", 1));
        Instant startedAt = clock.instant();
        store1.markStarted(b, startedAt);
        store1.markCanceled(c);
        // "Crash": drop reference without close; new instance recovers from disk
        var store2 = open(1_000);

        assertEquals(List.of(a), store2.listQueued(QueueScope.byOrg("org-1")).stream().map(QueueEntry::id).toList());
        QueueEntry started = store2.get(b).orElseThrow();
        assertEquals(EntryStatus.STARTED, started.status());
        assertEquals(startedAt, started.startedAt());
        assertEquals(EntryStatus.CANCELED, store2.get(c).orElseThrow().status());
        store2.close();
        store1.close();
    }

    @Test
    void removed_entries_stay_removed_after_snapshot_and_replay() {
        var store1 = open(3); // snapshot after every third write
        String a = store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s", 0));
        String b = store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s", 0));
        store1.markStarted(a, clock.instant());      // third write -> snapshot
        store1.remove(a);                            // replayed from WAL
        String c = store1.enqueue(new EnqueueRequest("org-2", "agent-3", "s", 9));
        store1.close();

        var store2 = open(3);

        assertTrue(store2.get(a).isEmpty());
        assertTrue(store2.get(b).orElseThrow().isQueued());
        assertTrue(store2.get(c).orElseThrow().isQueued());
        assertEquals(2, store2.size());
        store2.close();
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        var store1 = open(1_000);
        String a = store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s", 0));
        String b = store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s", 0));
        store1.close();

        // Append a third record but only part of it (simulate torn write)
        QueueEntry torn = QueueEntry.newQueued("torn", new EnqueueRequest("org-1", "agent-1", "s", 0), clock.instant());
        byte[] r3 = RecordCodec.encode(RecordCodec.LogRecord.enqueue(99, torn));
        try (OutputStream out = Files.newOutputStream(activeSegment(), APPEND)) {
            out.write(r3, 0, r3.length - 5);
            out.flush();
        }

        var store2 = open(1_000);
        assertTrue(store2.get(a).isPresent());
        assertTrue(store2.get(b).isPresent());
        assertTrue(store2.get("torn").isEmpty());

        // writes after recovery must be readable on the next restart
        String c = store2.enqueue(new EnqueueRequest("org-1", "agent-1", "s", 0));
        store2.close();

        var store3 = open(1_000);
        assertTrue(store3.get(c).isPresent());
        assertEquals(3, store3.size());
        store3.close();
    }

    @Test
    void corrupt_crc_stops_replay_at_that_record() throws Exception {
        var store1 = open(1_000);
        store1.close();

        QueueEntry e1 = QueueEntry.newQueued("e1", new EnqueueRequest("org-1", "agent-1", "s", 0), clock.instant());
        QueueEntry e2 = QueueEntry.newQueued("e2", new EnqueueRequest("org-1", "agent-1", "s", 0), clock.instant());
        byte[] r1 = RecordCodec.encode(RecordCodec.LogRecord.enqueue(1, e1));
        byte[] r2 = RecordCodec.encode(RecordCodec.LogRecord.enqueue(2, e2));
        r2[r2.length - 1] ^= 0x7F; // flip payload bits, CRC no longer matches
        try (OutputStream out = Files.newOutputStream(activeSegment(), APPEND)) {
            out.write(r1);
            out.write(r2);
        }

        var store2 = open(1_000);
        assertTrue(store2.get("e1").isPresent());
        assertTrue(store2.get("e2").isEmpty());
        store2.close();
    }

    @Test
    void explicit_snapshot_drops_covered_wal_segments() throws Exception {
        var store1 = new DurableQueueStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir));
        for (int i = 0; i < 3; i++) {
            store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s", i));
        }
        assertTrue(Files.size(activeSegment()) > 0);

        store1.snapshot();

        try (Stream<Path> files = Files.list(walDir)) {
            assertEquals(1, files.filter(p -> p.toString().endsWith(".log")).count());
        }
        assertEquals(0, Files.size(activeSegment()));
        store1.close();

        var store2 = new DurableQueueStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir));
        assertEquals(3, store2.listQueued(QueueScope.byOrg("org-1")).size());
        store2.close();
    }

    @Test
    void failed_snapshot_keeps_the_write_and_is_retried_on_the_next_one() {
        FileSnapshotter disk = new FileSnapshotter(snapDir);
        AtomicBoolean diskFull = new AtomicBoolean(false);
        AtomicInteger attempts = new AtomicInteger();
        Snapshotter flaky = new Snapshotter() {
            @Override
            public String writeSnapshot(long lastLsn, Collection<QueueEntry> entries) {
                attempts.incrementAndGet();
                if (diskFull.get()) {
                    throw new StorageException("disk full", null);
                }
                return disk.writeSnapshot(lastLsn, entries);
            }

            @Override
            public LoadedSnapshot loadLatest() {
                return disk.loadLatest();
            }
        };

        var store1 = new DurableQueueStore(new FileWal(walDir, 1L << 60), flaky, new SnapshotPolicy(2), clock);
        assertEquals(1, attempts.get()); // startup compaction
        diskFull.set(true);

        String a = store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s1", 0));
        String b = store1.enqueue(new EnqueueRequest("org-1", "agent-1", "s2", 0)); // snapshot due, fails
        assertEquals(2, attempts.get());
        store1.markStarted(a, clock.instant()); // retried, fails again
        assertEquals(3, attempts.get());
        assertEquals(EntryStatus.STARTED, store1.get(a).orElseThrow().status());

        diskFull.set(false);
        String c = store1.enqueue(new EnqueueRequest("org-2", "agent-2", "s3", 0)); // retried, succeeds
        assertEquals(4, attempts.get());
        store1.enqueue(new EnqueueRequest("org-2", "agent-2", "s4", 0)); // counter restarted, no snapshot
        assertEquals(4, attempts.get());
        store1.close();

        var store2 = open(1_000);
        assertEquals(EntryStatus.STARTED, store2.get(a).orElseThrow().status());
        assertTrue(store2.get(b).orElseThrow().isQueued());
        assertTrue(store2.get(c).orElseThrow().isQueued());
        assertEquals(4, store2.size());
        store2.close();
    }
}
