// file: server/src/main/java/io/admitq/server/dto/SummaryResponse.java
package io.admitq.server.dto;

import java.util.Map;

/** JSON response for GET /queue/summary. */
public class SummaryResponse {
    public String orgId;
    public int totalQueued;
    public String oldestQueuedAt;
    public Map<String, Integer> byAgent;
    public double avgWaitMinutes;
    public int startedInWindow;
    public int running;
}
