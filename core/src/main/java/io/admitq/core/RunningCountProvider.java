// file: core/src/main/java/io/admitq/core/RunningCountProvider.java
package io.admitq.core;

/**
 * Current number of running backup jobs per scope.
 * <p>
 * Supplied by the job-execution tracker. Implementations must be safe to call
 * from multiple admission threads at once.
 */
public interface RunningCountProvider {

    int countRunningByOrg(String orgId);

    int countRunningByAgent(String agentId);
}
