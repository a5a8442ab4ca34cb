// file: core/src/main/java/io/admitq/core/ConcurrencyCeilingProvider.java
package io.admitq.core;

import java.util.OptionalInt;

/**
 * Source of per-organization and per-agent concurrency limits.
 * An empty result means the scope is unlimited.
 */
public interface ConcurrencyCeilingProvider {

    OptionalInt orgCeiling(String orgId);

    OptionalInt agentCeiling(String agentId);

    /** Resolve both limits for one admission decision. */
    default ConcurrencyCeiling ceilingFor(String orgId, String agentId) {
        return ConcurrencyCeiling.of(orgCeiling(orgId), agentCeiling(agentId));
    }
}
