// file: server/src/test/java/io/admitq/server/QueueServiceTest.java
package io.admitq.server;

import io.admitq.core.AdmissionDecision;
import io.admitq.core.EnqueueRequest;
import io.admitq.core.EntryNotFoundException;
import io.admitq.core.EntryStatus;
import io.admitq.core.InvalidStateException;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueScope;
import io.admitq.storage.DurableQueueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueueServiceTest {

    @TempDir Path dir;

    private final TestClock clock = new TestClock(Instant.parse("2026-09-01T10:00:00Z"));
    private DurableQueueStore store;
    private CeilingRegistry ceilings;
    private RunningJobTracker tracker;

    @BeforeEach
    void setUp() {
        store = TestStores.open(dir, clock);
        ceilings = new CeilingRegistry();
        tracker = new RunningJobTracker();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private QueueService service(boolean removeOnCancel) {
        AdmissionController admission = new AdmissionController(store, ceilings, tracker, clock);
        return new QueueService(store, admission, new PositionCalculator(store),
                new QueueSummary(store, clock), new Reaper(store, clock, Duration.ofHours(1)),
                tracker, clock, removeOnCancel);
    }

    private QueueService.Enqueued enqueue(QueueService svc, String org, String agent, int priority) {
        QueueService.Enqueued r = svc.enqueue(new EnqueueRequest(org, agent, "sched", priority));
        clock.advance(Duration.ofSeconds(1));
        return r;
    }

    @Test
    void enqueue_starts_immediately_when_capacity_allows() {
        QueueService svc = service(false);

        QueueService.Enqueued r = enqueue(svc, "org-1", "agent-1", 0);

        assertTrue(r.decision() instanceof AdmissionDecision.Admitted);
        assertEquals(EntryStatus.STARTED, r.entry().status());
        assertNull(r.position());
    }

    @Test
    void enqueue_waits_with_position_when_ceiling_reached() {
        ceilings.setOrgCeiling("org-1", 1);
        QueueService svc = service(false);
        enqueue(svc, "org-1", "agent-1", 0);

        QueueService.Enqueued second = enqueue(svc, "org-1", "agent-1", 0);
        QueueService.Enqueued third = enqueue(svc, "org-1", "agent-2", 0);

        assertTrue(second.decision() instanceof AdmissionDecision.Blocked);
        assertTrue(second.entry().isQueued());
        assertEquals(1, second.position());
        assertEquals(2, third.position());
    }

    @Test
    void complete_releases_slot_and_admits_next() {
        ceilings.setOrgCeiling("org-1", 1);
        QueueService svc = service(false);
        QueueEntry running = enqueue(svc, "org-1", "agent-1", 0).entry();
        String waiting = enqueue(svc, "org-1", "agent-2", 0).entry().id();

        List<QueueEntry> admitted = svc.complete("org-1", running.agentId());

        assertEquals(1, admitted.size());
        assertEquals(waiting, admitted.get(0).id());
        assertEquals(1, svc.runningInOrg("org-1"));
    }

    @Test
    void cancel_keeps_entry_until_sweep_by_default() {
        ceilings.setOrgCeiling("org-1", 1);
        QueueService svc = service(false);
        enqueue(svc, "org-1", "agent-1", 0);
        String waiting = enqueue(svc, "org-1", "agent-1", 0).entry().id();

        QueueEntry canceled = svc.cancel(waiting);

        assertEquals(EntryStatus.CANCELED, canceled.status());
        assertEquals(EntryStatus.CANCELED, store.get(waiting).orElseThrow().status());
        assertThrows(InvalidStateException.class, () -> svc.cancel(waiting));
        assertEquals(1, svc.sweep());
        assertTrue(store.get(waiting).isEmpty());
    }

    @Test
    void cancel_with_remove_on_cancel_deletes_immediately() {
        ceilings.setOrgCeiling("org-1", 1);
        QueueService svc = service(true);
        enqueue(svc, "org-1", "agent-1", 0);
        String waiting = enqueue(svc, "org-1", "agent-1", 0).entry().id();

        svc.cancel(waiting);

        assertTrue(store.get(waiting).isEmpty());
        assertThrows(EntryNotFoundException.class, () -> svc.cancel(waiting));
    }

    @Test
    void agent_listing_reports_org_wide_positions() {
        ceilings.setOrgCeiling("org-1", 1);
        QueueService svc = service(false);
        enqueue(svc, "org-1", "agent-1", 0);           // runs
        String a = enqueue(svc, "org-1", "agent-1", 0).entry().id();
        String b = enqueue(svc, "org-1", "agent-2", 5).entry().id();

        List<PositionCalculator.RankedEntry> forAgent1 = svc.list(QueueScope.byAgent("agent-1"));
        List<PositionCalculator.RankedEntry> forOrg = svc.list(QueueScope.byOrg("org-1"));

        assertEquals(1, forAgent1.size());
        assertEquals(a, forAgent1.get(0).entry().id());
        assertEquals(2, forAgent1.get(0).position());
        assertEquals(b, forOrg.get(0).entry().id());
        assertEquals(2, forOrg.size());
    }
}
