// file: src/main/java/io/admitq/storage/QueueStore.java
package io.admitq.storage;

import io.admitq.core.EnqueueRequest;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueScope;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Ordered, durable collection of queue entries.
 * <p>
 * Semantics:
 *  - Every mutation is durable before it returns.
 *  - Queued listings are ordered by QueueOrder: priority desc, queuedAt asc, id asc.
 *  - Mutations of one organization's entries are linearizable with each other;
 *    different organizations never contend on the same partition lock.
 */
public interface QueueStore {

    /**
     * Insert a new QUEUED entry.
     *
     * @return the new entry's id
     * @throws io.admitq.core.ValidationException if an id is empty or priority is out of range
     */
    String enqueue(EnqueueRequest request);

    /** Queued entries for an org or an agent, in rank order. */
    List<QueueEntry> listQueued(QueueScope scope);

    /** The single highest-ranked queued entry for the org, if any. */
    Optional<QueueEntry> oldestQueued(String orgId);

    /**
     * QUEUED -> STARTED.
     *
     * @throws io.admitq.core.EntryNotFoundException if the entry is absent
     * @throws io.admitq.core.InvalidStateException  if the entry is not QUEUED
     */
    QueueEntry markStarted(String entryId, Instant startedAt);

    /** QUEUED -> CANCELED; same failures as {@link #markStarted}. */
    QueueEntry markCanceled(String entryId);

    /**
     * Delete an entry whatever its status.
     *
     * @throws io.admitq.core.EntryNotFoundException if the entry is absent
     */
    void remove(String entryId);

    /**
     * Delete the entry only if it still matches {@code condition} when checked
     * under the org's partition lock.
     *
     * @return true if the entry was removed
     */
    boolean removeIf(String entryId, Predicate<QueueEntry> condition);

    /** Queued entry counts grouped by agent. */
    Map<String, Integer> countByAgent(String orgId);

    Optional<QueueEntry> get(String entryId);

    /** Entries of one org (any status) matching the predicate. */
    List<QueueEntry> find(String orgId, Predicate<QueueEntry> predicate);

    /** Entries of every org (any status) matching the predicate. */
    List<QueueEntry> findAll(Predicate<QueueEntry> predicate);

    /** Organizations that currently have at least one queued entry. */
    Set<String> orgsWithQueued();

    /**
     * Run {@code action} while holding the org's partition lock.
     * Store mutations for the same org may be called from inside the action.
     */
    <T> T withOrgLock(String orgId, Supplier<T> action);
}
