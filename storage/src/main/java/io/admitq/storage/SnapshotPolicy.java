// file: src/main/java/io/admitq/storage/SnapshotPolicy.java
package io.admitq.storage;

/**
 * Snapshot policy that triggers a full snapshot after every N writes.
 * <p>
 * Bounds worst-case recovery time by limiting WAL replay length.
 * Not thread-safe: the store calls it under its journal lock.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private int sinceLast;

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each successful durable write. Returns true when a snapshot is due. */
    public boolean recordWrite() {
        if (++sinceLast >= everyOps) {
            sinceLast = 0;
            return true;
        }
        return false;
    }
}
