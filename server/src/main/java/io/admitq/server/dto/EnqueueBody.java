// file: server/src/main/java/io/admitq/server/dto/EnqueueBody.java
package io.admitq.server.dto;

/**
 * JSON body for POST /queue.
 * Example:
 *   {
 *     "orgId": "org-1",
 *     "agentId": "agent-7",
 *     "scheduleId": "nightly-db",
 *     "priority": 10
 *   }
 * priority defaults to 0 when omitted.
 */
public class EnqueueBody {
    public String orgId;
    public String agentId;
    public String scheduleId;
    public int priority;
}
