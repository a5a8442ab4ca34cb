// file: server/src/main/java/io/admitq/server/QueueService.java
package io.admitq.server;

import io.admitq.core.AdmissionDecision;
import io.admitq.core.EnqueueRequest;
import io.admitq.core.EntryNotFoundException;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueScope;
import io.admitq.storage.QueueStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Caller-facing operations of the queue, shared by the HTTP layer and tests.
 * <p>
 * Responsibilities:
 *  - Enqueue and immediately attempt admission for the new entry's org.
 *  - Cancel (optionally removing the entry right away) and explicit removal.
 *  - Job completion: release the running slot, then drain the org's queue.
 *  - Read paths: listing with positions, single position, summary, status.
 */
public final class QueueService {
    private static final Logger log = Logger.getLogger(QueueService.class.getName());

    /** Result of an enqueue: the entry as it stands after the admission attempt. */
    public record Enqueued(QueueEntry entry, AdmissionDecision decision, Integer position) {}

    private final QueueStore store;
    private final AdmissionController admission;
    private final PositionCalculator positions;
    private final QueueSummary summary;
    private final Reaper reaper;
    private final RunningJobTracker running;
    private final Clock clock;
    private final boolean removeOnCancel;

    public QueueService(QueueStore store,
                        AdmissionController admission,
                        PositionCalculator positions,
                        QueueSummary summary,
                        Reaper reaper,
                        RunningJobTracker running,
                        Clock clock,
                        boolean removeOnCancel) {
        this.store = Objects.requireNonNull(store, "store");
        this.admission = Objects.requireNonNull(admission, "admission");
        this.positions = Objects.requireNonNull(positions, "positions");
        this.summary = Objects.requireNonNull(summary, "summary");
        this.reaper = Objects.requireNonNull(reaper, "reaper");
        this.running = Objects.requireNonNull(running, "running");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.removeOnCancel = removeOnCancel;
    }

    public Enqueued enqueue(EnqueueRequest request) {
        String id = store.enqueue(request);
        AdmissionDecision decision = admission.tryAdmit(request.orgId(), request.agentId(), running);

        QueueEntry current = store.get(id).orElseThrow(() -> new EntryNotFoundException(id));
        Integer position = null;
        if (current.isQueued()) {
            try {
                position = positions.position(current.orgId(), id);
            } catch (EntryNotFoundException raced) {
                // admitted or canceled by another thread after our read
                current = store.get(id).orElse(current);
            }
        }
        return new Enqueued(current, decision, position);
    }

    public AdmissionDecision tryAdmit(String orgId, String agentId) {
        return admission.tryAdmit(orgId, agentId, running);
    }

    /**
     * Cancel a queued entry. With remove-on-cancel configured the entry is
     * deleted immediately instead of waiting for the reaper.
     */
    public QueueEntry cancel(String entryId) {
        QueueEntry canceled = store.markCanceled(entryId);
        if (removeOnCancel) {
            store.removeIf(entryId, e -> !e.isQueued());
        }
        log.info(() -> "canceled entry " + entryId + " (org=" + canceled.orgId() + ")");
        return canceled;
    }

    public void remove(String entryId) {
        store.remove(entryId);
    }

    /** A running job finished: free its slot and start whatever now fits. */
    public List<QueueEntry> complete(String orgId, String agentId) {
        running.release(orgId, agentId);
        return admission.admitReady(orgId, running);
    }

    public int position(String orgId, String entryId) {
        return positions.position(orgId, entryId);
    }

    /**
     * Queued entries of the scope, best first. Positions are always org-wide,
     * also for an agent listing.
     */
    public List<PositionCalculator.RankedEntry> list(QueueScope scope) {
        if (scope.kind() == QueueScope.Kind.ORG) {
            return positions.positions(scope.id());
        }
        List<PositionCalculator.RankedEntry> out = new ArrayList<>();
        for (QueueEntry e : store.listQueued(scope)) {
            try {
                out.add(new PositionCalculator.RankedEntry(e, positions.position(e.orgId(), e.id())));
            } catch (EntryNotFoundException left) {
                // left the queue since the listing was taken
            }
        }
        return out;
    }

    public QueueSummary.Summary summarize(String orgId) {
        return summary.summarize(orgId);
    }

    public ConcurrencyStatus status(String orgId, String agentId) {
        return admission.status(orgId, agentId, running);
    }

    public int runningInOrg(String orgId) {
        return running.countRunningByOrg(orgId);
    }

    public int sweep() {
        return reaper.sweep(clock.instant());
    }
}
