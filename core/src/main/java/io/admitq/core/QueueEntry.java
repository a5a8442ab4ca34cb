// file: src/main/java/io/admitq/core/QueueEntry.java
package io.admitq.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable request to run one backup job.
 * <p>
 * Fields:
 *  - id:          unique identifier, assigned at creation.
 *  - orgId:       owning tenant.
 *  - agentId:     worker agent that will run the job.
 *  - scheduleId:  job definition.
 *  - priority:    higher value = higher priority, in [MIN_PRIORITY, MAX_PRIORITY].
 *  - queuedAt:    fairness tie-break (earlier wins).
 *  - startedAt:   set exactly once, when the entry is admitted.
 *  - status:      QUEUED, STARTED or CANCELED.
 *  - createdAt:   audit timestamp.
 * <p>
 * Invariants:
 *  - startedAt != null iff status == STARTED.
 *  - A transition returns a new instance; identity fields never change.
 */
public record QueueEntry(
        String id,
        String orgId,
        String agentId,
        String scheduleId,
        int priority,
        Instant queuedAt,
        Instant startedAt,
        EntryStatus status,
        Instant createdAt
) {
    public static final int MIN_PRIORITY = -1000;
    public static final int MAX_PRIORITY = 1000;

    public QueueEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(orgId, "orgId");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(scheduleId, "scheduleId");
        Objects.requireNonNull(queuedAt, "queuedAt");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        if ((status == EntryStatus.STARTED) != (startedAt != null)) {
            throw new IllegalArgumentException(
                    "startedAt must be set iff status is STARTED (status=" + status + ")");
        }
    }

    /** Fresh QUEUED entry; queuedAt and createdAt are both {@code now}. */
    public static QueueEntry newQueued(String id, EnqueueRequest req, Instant now) {
        return new QueueEntry(id, req.orgId(), req.agentId(), req.scheduleId(), req.priority(),
                now, null, EntryStatus.QUEUED, now);
    }

    public QueueEntry started(Instant at) {
        Objects.requireNonNull(at, "at");
        return new QueueEntry(id, orgId, agentId, scheduleId, priority,
                queuedAt, at, EntryStatus.STARTED, createdAt);
    }

    public QueueEntry canceled() {
        return new QueueEntry(id, orgId, agentId, scheduleId, priority,
                queuedAt, null, EntryStatus.CANCELED, createdAt);
    }

    public boolean isQueued() {
        return status == EntryStatus.QUEUED;
    }
}
