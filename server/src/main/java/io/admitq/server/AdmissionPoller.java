// file: server/src/main/java/io/admitq/server/AdmissionPoller.java
package io.admitq.server;

import io.admitq.core.QueueEntry;
import io.admitq.core.RunningCountProvider;
import io.admitq.storage.QueueStore;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Safety net for missed admission triggers.
 * <p>
 * On a fixed interval, drains every org that has queued entries through
 * {@link AdmissionController#admitReady}. A failure for one org is logged and
 * does not stop the others.
 */
public final class AdmissionPoller {
    private static final Logger log = Logger.getLogger(AdmissionPoller.class.getName());

    private final QueueStore store;
    private final AdmissionController admission;
    private final RunningCountProvider running;
    private final Duration period;

    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "admission-poller");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean started = false;

    public AdmissionPoller(QueueStore store, AdmissionController admission,
                           RunningCountProvider running, Duration period) {
        this.store = Objects.requireNonNull(store, "store");
        this.admission = Objects.requireNonNull(admission, "admission");
        this.running = Objects.requireNonNull(running, "running");
        this.period = Objects.requireNonNull(period, "period");
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

    /** One polling round. Returns the number of entries admitted. */
    int pollOnce() {
        int total = 0;
        for (String orgId : store.orgsWithQueued()) {
            try {
                List<QueueEntry> admitted = admission.admitReady(orgId, running);
                total += admitted.size();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "admission poll failed for org " + orgId, e);
            }
        }
        return total;
    }

    private void tick() {
        try {
            int n = pollOnce();
            if (n > 0) {
                log.info(() -> "admission poll started " + n + " queued entries");
            }
        } catch (Exception e) {
            log.log(Level.WARNING, "admission poll tick failed", e);
        }
    }
}
