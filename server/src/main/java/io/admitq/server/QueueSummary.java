// file: server/src/main/java/io/admitq/server/QueueSummary.java
package io.admitq.server;

import io.admitq.core.EntryStatus;
import io.admitq.core.QueueEntry;
import io.admitq.storage.QueueStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Aggregate read view over one organization's queue.
 * <p>
 * Waits are measured over STARTED entries whose startedAt falls inside the
 * trailing window (24h by default); the average is 0.0 when there are none.
 */
public final class QueueSummary {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

    /**
     * @param oldestQueuedAt earliest queuedAt among queued entries, null if none
     * @param byAgent        queued count per agent
     */
    public record Summary(
            String orgId,
            int totalQueued,
            Instant oldestQueuedAt,
            Map<String, Integer> byAgent,
            double avgWaitMinutes,
            int startedInWindow
    ) {}

    private final QueueStore store;
    private final Clock clock;
    private final Duration window;

    public QueueSummary(QueueStore store, Clock clock) {
        this(store, clock, DEFAULT_WINDOW);
    }

    public QueueSummary(QueueStore store, Clock clock, Duration window) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be > 0");
        }
    }

    public Summary summarize(String orgId) {
        Objects.requireNonNull(orgId, "orgId");

        List<QueueEntry> queued = store.find(orgId, QueueEntry::isQueued);
        Instant oldest = null;
        for (QueueEntry e : queued) {
            if (oldest == null || e.queuedAt().isBefore(oldest)) {
                oldest = e.queuedAt();
            }
        }

        Instant since = clock.instant().minus(window);
        List<QueueEntry> started = store.find(orgId,
                e -> e.status() == EntryStatus.STARTED && e.startedAt().isAfter(since));
        double avg = 0.0;
        if (!started.isEmpty()) {
            double totalMinutes = 0.0;
            for (QueueEntry e : started) {
                totalMinutes += Duration.between(e.queuedAt(), e.startedAt()).toMillis() / 60_000.0;
            }
            avg = totalMinutes / started.size();
        }

        return new Summary(orgId, queued.size(), oldest,
                new TreeMap<>(store.countByAgent(orgId)), avg, started.size());
    }
}
