// file: src/main/java/io/admitq/storage/Snapshotter.java
package io.admitq.storage;

import io.admitq.core.QueueEntry;

import java.util.Collection;
import java.util.List;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of every queue entry at some log sequence number.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records whose lsn is greater than the snapshot's.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current entries.
     *
     * @param lastLsn  sequence number of the last WAL record reflected in {@code entries}
     * @param entries  every entry, whatever its status
     * @return snapshot identifier (e.g., filename).
     */
    String writeSnapshot(long lastLsn, Collection<QueueEntry> entries);

    /** Load the latest snapshot if present, or null when none exists. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id, its lsn and its data */
    record LoadedSnapshot(String id, long lastLsn, List<QueueEntry> entries) {}
}
