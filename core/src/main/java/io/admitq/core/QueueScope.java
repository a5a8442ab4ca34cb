// file: core/src/main/java/io/admitq/core/QueueScope.java
package io.admitq.core;

import java.util.Objects;

/**
 * Scope of a listing or of a running count: a whole organization or a single agent.
 */
public record QueueScope(Kind kind, String id) {

    public enum Kind { ORG, AGENT }

    public QueueScope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    public static QueueScope byOrg(String orgId) {
        return new QueueScope(Kind.ORG, orgId);
    }

    public static QueueScope byAgent(String agentId) {
        return new QueueScope(Kind.AGENT, agentId);
    }
}
