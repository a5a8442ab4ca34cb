// file: server/src/main/java/io/admitq/server/dto/StatusResponse.java
package io.admitq.server.dto;

import io.admitq.server.ConcurrencyStatus;

/** JSON response for GET /concurrency/status. */
public class StatusResponse {
    public String orgId;
    public String agentId;
    public Integer orgLimit;
    public Integer agentLimit;
    public int orgRunningCount;
    public int agentRunningCount;
    public int orgQueuedCount;
    public int agentQueuedCount;
    public boolean canStartNow;
    public long estimatedWaitMinutes;

    public static StatusResponse of(ConcurrencyStatus s) {
        StatusResponse r = new StatusResponse();
        r.orgId = s.orgId();
        r.agentId = s.agentId();
        r.orgLimit = s.orgMax();
        r.agentLimit = s.agentMax();
        r.orgRunningCount = s.runningInOrg();
        r.agentRunningCount = s.runningOnAgent();
        r.orgQueuedCount = s.queuedInOrg();
        r.agentQueuedCount = s.queuedOnAgent();
        r.canStartNow = s.canStartNow();
        r.estimatedWaitMinutes = s.estimatedWait().toMinutes();
        return r;
    }
}
