// file: server/src/main/java/io/admitq/server/PositionCalculator.java
package io.admitq.server;

import io.admitq.core.EntryNotFoundException;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueOrder;
import io.admitq.core.QueueScope;
import io.admitq.storage.QueueStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes the 1-based rank of queued entries within their organization.
 * <p>
 * Position = 1 + number of queued peers in the same org that precede the
 * target under {@link QueueOrder}. Read-only; no locks are taken, so a
 * position may be stale by the time the caller sees it.
 */
public final class PositionCalculator {

    /** A queued entry with its rank at the time of the read. */
    public record RankedEntry(QueueEntry entry, int position) {}

    private final QueueStore store;

    public PositionCalculator(QueueStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @throws EntryNotFoundException if the entry does not exist, belongs to
     *         another org, or is no longer queued.
     */
    public int position(String orgId, String entryId) {
        QueueEntry target = store.get(entryId)
                .filter(e -> e.orgId().equals(orgId))
                .filter(QueueEntry::isQueued)
                .orElseThrow(() -> new EntryNotFoundException(entryId,
                        "no queued entry " + entryId + " in org " + orgId));

        int ahead = 0;
        for (QueueEntry peer : store.listQueued(QueueScope.byOrg(orgId))) {
            if (QueueOrder.precedes(peer, target)) {
                ahead++;
            } else {
                break; // list is sorted
            }
        }
        return ahead + 1;
    }

    /** All queued entries of the org, best first, with their positions. */
    public List<RankedEntry> positions(String orgId) {
        List<QueueEntry> queued = store.listQueued(QueueScope.byOrg(orgId));
        List<RankedEntry> out = new ArrayList<>(queued.size());
        for (int i = 0; i < queued.size(); i++) {
            out.add(new RankedEntry(queued.get(i), i + 1));
        }
        return out;
    }
}
