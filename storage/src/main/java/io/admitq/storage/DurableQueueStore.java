// file: src/main/java/io/admitq/storage/DurableQueueStore.java
package io.admitq.storage;

import io.admitq.core.EnqueueRequest;
import io.admitq.core.EntryNotFoundException;
import io.admitq.core.EntryStatus;
import io.admitq.core.InvalidStateException;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueOrder;
import io.admitq.core.QueueScope;
import io.admitq.core.StorageException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.function.LongFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Durable queue store.
 * <p>
 * Responsibilities:
 *  - Maintain per-org partitions in memory: all entries by id, plus a sorted
 *    index of queued entries (O(log n) insert/remove).
 *  - Maintain a per-agent sorted index of queued entries.
 *  - On mutation (under the org's partition lock):
 *      1) Validate the transition against current state.
 *      2) Assign the next lsn, encode the WAL record, append+fsync.
 *      3) Apply it to memory.
 *      4) Rotate WAL segment if needed.
 *      5) Possibly write a snapshot and drop WAL segments it covers.
 *    Steps 4 and 5 never fail the mutation: once the record is durable the
 *    caller sees success, and a failed snapshot is retried on the next write.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records with lsn greater than the snapshot's.
 * <p>
 * Locking:
 *  - Partition locks are per org and reentrant.
 *  - The journal lock serializes WAL access and memory application across
 *    orgs; it is always taken after a partition lock, never before.
 */
public class DurableQueueStore implements QueueStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableQueueStore.class.getName());

    private final Map<String, OrgPartition> orgs = new ConcurrentHashMap<>();
    private final Map<String, String> orgOfEntry = new ConcurrentHashMap<>();
    private final Map<String, NavigableSet<QueueEntry>> queuedByAgent = new ConcurrentHashMap<>();

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;

    private final Object journalLock = new Object();
    private long lastLsn; // guarded by journalLock
    private boolean snapshotDue; // guarded by journalLock

    public DurableQueueStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    public DurableQueueStore(Wal wal, Snapshotter snaps) {
        this(wal, snaps, new SnapshotPolicy(10_000), Clock.systemUTC());
    }

    // ---------- mutations ----------

    @Override
    public String enqueue(EnqueueRequest request) {
        Objects.requireNonNull(request, "request");
        request.validate();

        String id = UUID.randomUUID().toString();
        OrgPartition p = partition(request.orgId());
        p.lock.lock();
        try {
            QueueEntry entry = QueueEntry.newQueued(id, request, clock.instant());
            journal(lsn -> RecordCodec.LogRecord.enqueue(lsn, entry));
        } finally {
            p.lock.unlock();
        }
        return id;
    }

    @Override
    public QueueEntry markStarted(String entryId, Instant startedAt) {
        Objects.requireNonNull(startedAt, "startedAt");
        return transition(entryId, EntryStatus.STARTED,
                lsn -> RecordCodec.LogRecord.started(lsn, entryId, startedAt));
    }

    @Override
    public QueueEntry markCanceled(String entryId) {
        return transition(entryId, EntryStatus.CANCELED,
                lsn -> RecordCodec.LogRecord.canceled(lsn, entryId));
    }

    @Override
    public void remove(String entryId) {
        if (!removeIf(entryId, e -> true)) {
            throw new EntryNotFoundException(entryId);
        }
    }

    @Override
    public boolean removeIf(String entryId, Predicate<QueueEntry> condition) {
        Objects.requireNonNull(condition, "condition");
        String orgId = orgOfEntry.get(entryId);
        if (orgId == null) {
            return false;
        }
        OrgPartition p = partition(orgId);
        p.lock.lock();
        try {
            QueueEntry current = p.entries.get(entryId);
            if (current == null || !condition.test(current)) {
                return false;
            }
            journal(lsn -> RecordCodec.LogRecord.removed(lsn, entryId));
            return true;
        } finally {
            p.lock.unlock();
        }
    }

    private QueueEntry transition(String entryId, EntryStatus target, LongFunction<RecordCodec.LogRecord> record) {
        Objects.requireNonNull(entryId, "entryId");
        String orgId = orgOfEntry.get(entryId);
        if (orgId == null) {
            throw new EntryNotFoundException(entryId);
        }
        OrgPartition p = partition(orgId);
        p.lock.lock();
        try {
            QueueEntry current = p.entries.get(entryId);
            if (current == null) {
                throw new EntryNotFoundException(entryId);
            }
            if (!current.isQueued()) {
                throw new InvalidStateException(entryId, current.status(), target);
            }
            journal(record);
            return p.entries.get(entryId);
        } finally {
            p.lock.unlock();
        }
    }

    // ---------- reads ----------

    @Override
    public List<QueueEntry> listQueued(QueueScope scope) {
        Objects.requireNonNull(scope, "scope");
        NavigableSet<QueueEntry> index = switch (scope.kind()) {
            case ORG -> {
                OrgPartition p = orgs.get(scope.id());
                yield p == null ? null : p.queued;
            }
            case AGENT -> queuedByAgent.get(scope.id());
        };
        return index == null ? List.of() : List.copyOf(index);
    }

    @Override
    public Optional<QueueEntry> oldestQueued(String orgId) {
        OrgPartition p = orgs.get(orgId);
        if (p == null) {
            return Optional.empty();
        }
        Iterator<QueueEntry> it = p.queued.iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    @Override
    public Map<String, Integer> countByAgent(String orgId) {
        OrgPartition p = orgs.get(orgId);
        if (p == null) {
            return Map.of();
        }
        return p.queued.stream()
                .collect(Collectors.groupingBy(QueueEntry::agentId, HashMap::new, Collectors.summingInt(e -> 1)));
    }

    @Override
    public Optional<QueueEntry> get(String entryId) {
        String orgId = orgOfEntry.get(entryId);
        if (orgId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(partition(orgId).entries.get(entryId));
    }

    @Override
    public List<QueueEntry> find(String orgId, Predicate<QueueEntry> predicate) {
        OrgPartition p = orgs.get(orgId);
        if (p == null) {
            return List.of();
        }
        return p.entries.values().stream().filter(predicate).sorted(QueueOrder.COMPARATOR).toList();
    }

    @Override
    public List<QueueEntry> findAll(Predicate<QueueEntry> predicate) {
        List<QueueEntry> out = new ArrayList<>();
        for (OrgPartition p : orgs.values()) {
            for (QueueEntry e : p.entries.values()) {
                if (predicate.test(e)) {
                    out.add(e);
                }
            }
        }
        return out;
    }

    @Override
    public Set<String> orgsWithQueued() {
        return orgs.values().stream()
                .filter(p -> !p.queued.isEmpty())
                .map(p -> p.orgId)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public <T> T withOrgLock(String orgId, Supplier<T> action) {
        OrgPartition p = partition(orgId);
        p.lock.lock();
        try {
            return action.get();
        } finally {
            p.lock.unlock();
        }
    }

    /** Number of entries held, any status. */
    public int size() {
        return orgOfEntry.size();
    }

    @Override
    public void close() {
        wal.close();
    }

    // ---------- journal + apply ----------

    /**
     * Append one record and apply it. Caller holds the partition lock of the
     * record's org, so validation done by the caller still holds here.
     */
    private void journal(LongFunction<RecordCodec.LogRecord> build) {
        synchronized (journalLock) {
            RecordCodec.LogRecord rec = build.apply(lastLsn + 1);

            // 1) append + fsync. If this throws, memory is untouched.
            wal.append(RecordCodec.encode(rec));

            // 2) apply to memory
            apply(rec);
            lastLsn = rec.lsn();

            // 3) housekeeping. The record is durable and applied, so a failure
            //    here is logged and retried on the next write, never rethrown.
            if (snapPolicy.recordWrite()) {
                snapshotDue = true;
            }
            try {
                wal.rotateIfNeeded();
                if (snapshotDue) {
                    snapshotLocked();
                }
            } catch (StorageException e) {
                log.log(Level.WARNING, "WAL housekeeping failed after lsn " + lastLsn + "; retrying on next write", e);
            }
        }
    }

    /** Write a snapshot now and drop the WAL segments it covers. */
    public void snapshot() {
        synchronized (journalLock) {
            snapshotLocked();
        }
    }

    private void snapshotLocked() {
        List<QueueEntry> all = findAll(e -> true);
        String id = snaps.writeSnapshot(lastLsn, all);
        snapshotDue = false;
        wal.rotate();
        int dropped = wal.deleteInactiveSegments();
        log.info(() -> String.format("snapshot %s written (lsn=%d, entries=%d, walSegmentsDropped=%d)",
                id, lastLsn, all.size(), dropped));
    }

    private void apply(RecordCodec.LogRecord rec) {
        switch (rec.op()) {
            case ENQUEUE -> insert(rec.entry());
            case STARTED -> replace(rec.entryId(), e -> e.started(rec.at()));
            case CANCELED -> replace(rec.entryId(), QueueEntry::canceled);
            case REMOVED -> delete(rec.entryId());
        }
    }

    private void insert(QueueEntry e) {
        OrgPartition p = partition(e.orgId());
        p.entries.put(e.id(), e);
        orgOfEntry.put(e.id(), e.orgId());
        if (e.isQueued()) {
            p.queued.add(e);
            agentIndex(e.agentId()).add(e);
        }
    }

    private void replace(String entryId, UnaryOperator<QueueEntry> change) {
        QueueEntry old = lookup(entryId);
        if (old == null) {
            log.warning(() -> "ignoring transition for unknown entry " + entryId);
            return;
        }
        unindex(old);
        insert(change.apply(old));
    }

    private void delete(String entryId) {
        QueueEntry old = lookup(entryId);
        if (old == null) {
            return;
        }
        unindex(old);
        partition(old.orgId()).entries.remove(entryId);
        orgOfEntry.remove(entryId);
    }

    private void unindex(QueueEntry old) {
        if (!old.isQueued()) {
            return;
        }
        partition(old.orgId()).queued.remove(old);
        NavigableSet<QueueEntry> byAgent = queuedByAgent.get(old.agentId());
        if (byAgent != null) {
            byAgent.remove(old);
        }
    }

    private QueueEntry lookup(String entryId) {
        String orgId = orgOfEntry.get(entryId);
        return orgId == null ? null : partition(orgId).entries.get(entryId);
    }

    private OrgPartition partition(String orgId) {
        return orgs.computeIfAbsent(orgId, OrgPartition::new);
    }

    private NavigableSet<QueueEntry> agentIndex(String agentId) {
        return queuedByAgent.computeIfAbsent(agentId, k -> new ConcurrentSkipListSet<>(QueueOrder.COMPARATOR));
    }

    // ---------- recovery ----------

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records newer than the snapshot, in order.
     */
    private void recover() {
        long fromLsn = 0L;
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            loaded.entries().forEach(this::insert);
            fromLsn = loaded.lastLsn();
        }
        long last = fromLsn;
        int replayed = 0;

        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec.lsn() <= fromLsn) {
                    continue;
                }
                apply(rec);
                last = rec.lsn();
                replayed++;
            }
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Recovery failed", e);
        }

        int snapshotCount = loaded == null ? 0 : loaded.entries().size();
        int replayedCount = replayed;
        long recoveredLsn = last;
        log.info(() -> String.format("queue store recovered: %d entries from snapshot, %d WAL records replayed, lsn=%d",
                snapshotCount, replayedCount, recoveredLsn));

        // Compact right away: appends must never land behind a torn tail,
        // which the reader would stop at on the next restart.
        synchronized (journalLock) {
            lastLsn = last;
            snapshotLocked();
        }
    }
}
