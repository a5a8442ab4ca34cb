// file: server/src/main/java/io/admitq/server/dto/EntryView.java
package io.admitq.server.dto;

import io.admitq.core.QueueEntry;

/**
 * JSON view of a queue entry. Timestamps are ISO-8601 strings; position is
 * only present for queued entries.
 */
public class EntryView {
    public String id;
    public String orgId;
    public String agentId;
    public String scheduleId;
    public int priority;
    public String status;
    public String queuedAt;
    public String startedAt;
    public String createdAt;
    public Integer position;

    public static EntryView of(QueueEntry e, Integer position) {
        EntryView v = new EntryView();
        v.id = e.id();
        v.orgId = e.orgId();
        v.agentId = e.agentId();
        v.scheduleId = e.scheduleId();
        v.priority = e.priority();
        v.status = e.status().wireName();
        v.queuedAt = e.queuedAt().toString();
        v.startedAt = e.startedAt() == null ? null : e.startedAt().toString();
        v.createdAt = e.createdAt().toString();
        v.position = position;
        return v;
    }
}
