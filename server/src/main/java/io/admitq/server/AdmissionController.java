// file: server/src/main/java/io/admitq/server/AdmissionController.java
package io.admitq.server;

import io.admitq.core.AdmissionDecision;
import io.admitq.core.AdmissionListener;
import io.admitq.core.BlockReason;
import io.admitq.core.ConcurrencyCeiling;
import io.admitq.core.ConcurrencyCeilingProvider;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueScope;
import io.admitq.core.RunningCountProvider;
import io.admitq.storage.QueueStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Decides whether the best-ranked queued entry of an org may start.
 * <p>
 * Responsibilities:
 *  - Take the org lock (via {@link QueueStore#withOrgLock}) so the
 *    "count running, compare to ceiling, mark started" sequence is atomic
 *    per org.
 *  - Take the candidate agent's lock stripe for the agent ceiling check.
 *    Locks are always acquired org first, then agent stripe, and never more
 *    than one stripe at a time.
 *  - Promote the candidate and notify the {@link AdmissionListener} before
 *    releasing the locks, so the running count seen by the next attempt
 *    already includes it.
 * <p>
 * A blocked candidate is never skipped: lower-ranked entries wait behind it
 * even if their own agent has spare capacity.
 */
public final class AdmissionController {
    private static final Logger log = Logger.getLogger(AdmissionController.class.getName());

    /** Rough per-entry wait used for the status estimate. */
    static final Duration WAIT_PER_QUEUED_ENTRY = Duration.ofMinutes(30);

    private static final int AGENT_LOCK_STRIPES = 64;

    private final QueueStore store;
    private final ConcurrencyCeilingProvider ceilings;
    private final AdmissionListener listener;
    private final Clock clock;
    private final ReentrantLock[] agentLocks = new ReentrantLock[AGENT_LOCK_STRIPES];

    public AdmissionController(QueueStore store,
                               ConcurrencyCeilingProvider ceilings,
                               AdmissionListener listener,
                               Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.ceilings = Objects.requireNonNull(ceilings, "ceilings");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (int i = 0; i < agentLocks.length; i++) {
            agentLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Try to start the best-ranked queued entry of {@code orgId}.
     *
     * @param agentId agent whose event triggered this attempt; only logged.
     *                The agent ceiling is checked for the candidate's agent.
     */
    public AdmissionDecision tryAdmit(String orgId, String agentId, RunningCountProvider running) {
        Objects.requireNonNull(orgId, "orgId");
        Objects.requireNonNull(running, "running");

        return store.withOrgLock(orgId, () -> {
            Optional<QueueEntry> best = store.oldestQueued(orgId);
            if (best.isEmpty()) {
                return AdmissionDecision.noCandidate();
            }
            QueueEntry candidate = best.get();
            ConcurrencyCeiling ceiling = ceilings.ceilingFor(orgId, candidate.agentId());

            if (ceiling.orgSaturated(running.countRunningByOrg(orgId))) {
                log.fine(() -> "org " + orgId + " saturated, candidate " + candidate.id() + " waits");
                return new AdmissionDecision.Blocked(BlockReason.ORG_SATURATED, candidate);
            }

            ReentrantLock agentLock = agentLockFor(candidate.agentId());
            agentLock.lock();
            try {
                if (ceiling.agentSaturated(running.countRunningByAgent(candidate.agentId()))) {
                    log.fine(() -> "agent " + candidate.agentId() + " saturated, candidate "
                            + candidate.id() + " waits");
                    return new AdmissionDecision.Blocked(BlockReason.AGENT_SATURATED, candidate);
                }
                QueueEntry started = store.markStarted(candidate.id(), clock.instant());
                listener.onAdmitted(started);
                log.info(() -> String.format("admitted entry %s (org=%s, agent=%s, priority=%d, trigger=%s)",
                        started.id(), orgId, started.agentId(), started.priority(), agentId));
                return new AdmissionDecision.Admitted(started);
            } finally {
                agentLock.unlock();
            }
        });
    }

    private ReentrantLock agentLockFor(String agentId) {
        return agentLocks[Math.floorMod(agentId.hashCode(), agentLocks.length)];
    }

    /** Admit entries of {@code orgId} until the next attempt is blocked or nothing is queued. */
    public List<QueueEntry> admitReady(String orgId, RunningCountProvider running) {
        List<QueueEntry> admitted = new ArrayList<>();
        while (true) {
            AdmissionDecision d = tryAdmit(orgId, null, running);
            if (!(d instanceof AdmissionDecision.Admitted a)) {
                return admitted;
            }
            admitted.add(a.entry());
        }
    }

    /**
     * Snapshot of limits, load and queue depth for an org and, optionally, one agent.
     * Not taken under locks.
     */
    public ConcurrencyStatus status(String orgId, String agentId, RunningCountProvider running) {
        Objects.requireNonNull(orgId, "orgId");
        ConcurrencyCeiling ceiling = agentId == null
                ? ConcurrencyCeiling.of(ceilings.orgCeiling(orgId), OptionalInt.empty())
                : ceilings.ceilingFor(orgId, agentId);

        int runningInOrg = running.countRunningByOrg(orgId);
        int runningOnAgent = agentId == null ? 0 : running.countRunningByAgent(agentId);
        int queuedInOrg = store.listQueued(QueueScope.byOrg(orgId)).size();
        int queuedOnAgent = agentId == null ? 0 : store.listQueued(QueueScope.byAgent(agentId)).size();

        boolean canStart = !ceiling.orgSaturated(runningInOrg) && !ceiling.agentSaturated(runningOnAgent);
        Duration wait = canStart ? Duration.ZERO : WAIT_PER_QUEUED_ENTRY.multipliedBy(queuedInOrg);

        return new ConcurrencyStatus(orgId, agentId, ceiling.orgMax(), ceiling.agentMax(),
                runningInOrg, runningOnAgent, queuedInOrg, queuedOnAgent, canStart, wait);
    }
}
