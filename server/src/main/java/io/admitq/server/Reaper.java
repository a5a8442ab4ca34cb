// file: server/src/main/java/io/admitq/server/Reaper.java
package io.admitq.server;

import io.admitq.core.QueueEntry;
import io.admitq.storage.QueueStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic cleanup of finished and abandoned queue entries.
 * <p>
 * An entry is expired when it is:
 *  - STARTED with startedAt older than {@code startedTtl} (default 24h),
 *  - CANCELED, or
 *  - QUEUED with queuedAt older than {@code queuedTtl} (default 7 days).
 * <p>
 * Each removal re-checks the predicate under the org lock
 * ({@link QueueStore#removeIf}), so an entry promoted between the scan and
 * the removal is left alone. A failed tick is logged and retried on the next one.
 */
public final class Reaper {
    private static final Logger log = Logger.getLogger(Reaper.class.getName());

    public static final Duration DEFAULT_STARTED_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_QUEUED_TTL = Duration.ofDays(7);

    private final QueueStore store;
    private final Clock clock;
    private final Duration startedTtl;
    private final Duration queuedTtl;
    private final Duration period;

    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "queue-reaper");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean started = false;

    public Reaper(QueueStore store, Clock clock, Duration period) {
        this(store, clock, period, DEFAULT_STARTED_TTL, DEFAULT_QUEUED_TTL);
    }

    public Reaper(QueueStore store, Clock clock, Duration period, Duration startedTtl, Duration queuedTtl) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.period = Objects.requireNonNull(period, "period");
        this.startedTtl = Objects.requireNonNull(startedTtl, "startedTtl");
        this.queuedTtl = Objects.requireNonNull(queuedTtl, "queuedTtl");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
    }

    public void start() {
        if (started) {
            return;
        }
        started = true;
        exec.scheduleAtFixedRate(this::tick, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        exec.shutdownNow();
    }

    /** Remove every entry expired as of {@code now}. Returns the number removed. */
    public int sweep(Instant now) {
        Objects.requireNonNull(now, "now");
        Predicate<QueueEntry> expired = expiredAt(now);

        List<QueueEntry> candidates = store.findAll(expired);
        int removed = 0;
        for (QueueEntry e : candidates) {
            if (store.removeIf(e.id(), expired)) {
                removed++;
            }
        }
        int count = removed;
        if (count > 0) {
            log.info(() -> "reaper removed " + count + " expired queue entries");
        }
        return removed;
    }

    Predicate<QueueEntry> expiredAt(Instant now) {
        Instant startedCutoff = now.minus(startedTtl);
        Instant queuedCutoff = now.minus(queuedTtl);
        return e -> switch (e.status()) {
            case STARTED -> e.startedAt().isBefore(startedCutoff);
            case CANCELED -> true;
            case QUEUED -> e.queuedAt().isBefore(queuedCutoff);
        };
    }

    private void tick() {
        try {
            sweep(clock.instant());
        } catch (Exception e) {
            log.log(Level.WARNING, "reaper sweep failed; retrying next tick", e);
        }
    }
}
