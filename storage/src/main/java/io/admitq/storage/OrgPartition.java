// file: storage/src/main/java/io/admitq/storage/OrgPartition.java
package io.admitq.storage;

import io.admitq.core.QueueEntry;
import io.admitq.core.QueueOrder;

import java.util.Map;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * All entries of one organization.
 * <p>
 *  - entries: every entry by id, any status.
 *  - queued:  QUEUED entries only, sorted by QueueOrder.
 *  - lock:    serializes mutations for this org; readers go lock-free.
 */
final class OrgPartition {
    final String orgId;
    final ReentrantLock lock = new ReentrantLock();
    final Map<String, QueueEntry> entries = new ConcurrentHashMap<>();
    final NavigableSet<QueueEntry> queued = new ConcurrentSkipListSet<>(QueueOrder.COMPARATOR);

    OrgPartition(String orgId) {
        this.orgId = orgId;
    }
}
