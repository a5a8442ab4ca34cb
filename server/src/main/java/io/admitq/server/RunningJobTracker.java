// file: server/src/main/java/io/admitq/server/RunningJobTracker.java
package io.admitq.server;

import io.admitq.core.AdmissionListener;
import io.admitq.core.EntryStatus;
import io.admitq.core.QueueEntry;
import io.admitq.core.RunningCountProvider;
import io.admitq.storage.QueueStore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * In-process count of running jobs per org and per agent.
 * <p>
 * Incremented when an entry is admitted, decremented when the caller reports
 * completion through {@link #release}. Counters never go below zero, so a
 * duplicate or unknown completion is harmless.
 * <p>
 * Counters live in memory only. After a restart they are rebuilt from the
 * STARTED entries still held by the store ({@link #restoredFrom}).
 */
public final class RunningJobTracker implements RunningCountProvider, AdmissionListener {
    private static final Logger log = Logger.getLogger(RunningJobTracker.class.getName());

    private final Map<String, AtomicInteger> byOrg = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> byAgent = new ConcurrentHashMap<>();

    /** A tracker counting every STARTED entry of {@code store} as running. */
    public static RunningJobTracker restoredFrom(QueueStore store) {
        RunningJobTracker tracker = new RunningJobTracker();
        List<QueueEntry> started = store.findAll(e -> e.status() == EntryStatus.STARTED);
        started.forEach(tracker::onAdmitted);
        log.info(() -> "running counts restored from " + started.size() + " started entries");
        return tracker;
    }

    @Override
    public void onAdmitted(QueueEntry entry) {
        counter(byOrg, entry.orgId()).incrementAndGet();
        counter(byAgent, entry.agentId()).incrementAndGet();
    }

    /** A job of {@code orgId} running on {@code agentId} finished. */
    public void release(String orgId, String agentId) {
        decrement(byOrg, orgId);
        decrement(byAgent, agentId);
    }

    @Override
    public int countRunningByOrg(String orgId) {
        AtomicInteger c = byOrg.get(orgId);
        return c == null ? 0 : c.get();
    }

    @Override
    public int countRunningByAgent(String agentId) {
        AtomicInteger c = byAgent.get(agentId);
        return c == null ? 0 : c.get();
    }

    private static AtomicInteger counter(Map<String, AtomicInteger> m, String key) {
        return m.computeIfAbsent(key, k -> new AtomicInteger());
    }

    private static void decrement(Map<String, AtomicInteger> m, String key) {
        AtomicInteger c = m.get(key);
        if (c != null) {
            c.getAndUpdate(v -> v > 0 ? v - 1 : 0);
        }
    }
}
