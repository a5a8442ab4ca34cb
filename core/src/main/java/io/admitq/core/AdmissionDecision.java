// file: src/main/java/io/admitq/core/AdmissionDecision.java
package io.admitq.core;

import java.util.Objects;

/**
 * Outcome of one admission attempt for an organization.
 * <p>
 *  - NoCandidate: nothing is queued for the org.
 *  - Blocked:     the best-ranked candidate exists but a ceiling is reached.
 *  - Admitted:    the candidate was promoted to STARTED.
 * <p>
 * None of these are errors; failures are reported with exceptions.
 */
public sealed interface AdmissionDecision
        permits AdmissionDecision.NoCandidate, AdmissionDecision.Blocked, AdmissionDecision.Admitted {

    record NoCandidate() implements AdmissionDecision {}

    record Blocked(BlockReason reason, QueueEntry candidate) implements AdmissionDecision {
        public Blocked {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(candidate, "candidate");
        }
    }

    record Admitted(QueueEntry entry) implements AdmissionDecision {
        public Admitted {
            Objects.requireNonNull(entry, "entry");
        }
    }

    static AdmissionDecision noCandidate() {
        return new NoCandidate();
    }
}
