// file: core/src/main/java/io/admitq/core/BlockReason.java
package io.admitq.core;

/** Why the best candidate of an organization could not start. */
public enum BlockReason {
    ORG_SATURATED,
    AGENT_SATURATED
}
