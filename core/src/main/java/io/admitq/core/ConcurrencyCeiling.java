// file: core/src/main/java/io/admitq/core/ConcurrencyCeiling.java
package io.admitq.core;

import java.util.OptionalInt;

/**
 * Concurrency ceilings that apply to one admission decision.
 * A null limit means "unlimited".
 */
public record ConcurrencyCeiling(Integer orgMax, Integer agentMax) {

    public static final ConcurrencyCeiling UNLIMITED = new ConcurrencyCeiling(null, null);

    public ConcurrencyCeiling {
        if (orgMax != null && orgMax < 1) {
            throw new IllegalArgumentException("orgMax must be >= 1 when set, got " + orgMax);
        }
        if (agentMax != null && agentMax < 1) {
            throw new IllegalArgumentException("agentMax must be >= 1 when set, got " + agentMax);
        }
    }

    public static ConcurrencyCeiling of(OptionalInt orgMax, OptionalInt agentMax) {
        return new ConcurrencyCeiling(
                orgMax.isPresent() ? orgMax.getAsInt() : null,
                agentMax.isPresent() ? agentMax.getAsInt() : null);
    }

    public boolean orgSaturated(int runningInOrg) {
        return orgMax != null && runningInOrg >= orgMax;
    }

    public boolean agentSaturated(int runningOnAgent) {
        return agentMax != null && runningOnAgent >= agentMax;
    }
}
