// file: server/src/main/java/io/admitq/server/ConcurrencyStatus.java
package io.admitq.server;

import java.time.Duration;

/**
 * Point-in-time view of the concurrency situation for one org/agent pair.
 *
 * @param orgMax            org ceiling, null if unlimited
 * @param agentMax          agent ceiling, null if unlimited (or no agent given)
 * @param runningInOrg      jobs currently running in the org
 * @param runningOnAgent    jobs currently running on the agent (0 if no agent given)
 * @param queuedInOrg       entries waiting in the org
 * @param queuedOnAgent     entries waiting for the agent (0 if no agent given)
 * @param canStartNow       true if neither ceiling is reached
 * @param estimatedWait     30 minutes per queued org entry when blocked, otherwise zero
 */
public record ConcurrencyStatus(
        String orgId,
        String agentId,
        Integer orgMax,
        Integer agentMax,
        int runningInOrg,
        int runningOnAgent,
        int queuedInOrg,
        int queuedOnAgent,
        boolean canStartNow,
        Duration estimatedWait
) {
}
