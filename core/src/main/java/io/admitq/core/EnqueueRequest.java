// file: core/src/main/java/io/admitq/core/EnqueueRequest.java
package io.admitq.core;

/**
 * Caller input for creating a queue entry.
 * Validation happens in {@link #validate()}, not in the constructor, so that
 * malformed requests surface as {@link ValidationException}.
 */
public record EnqueueRequest(String orgId, String agentId, String scheduleId, int priority) {

    public void validate() {
        requireId("orgId", orgId);
        requireId("agentId", agentId);
        requireId("scheduleId", scheduleId);
        if (priority < QueueEntry.MIN_PRIORITY || priority > QueueEntry.MAX_PRIORITY) {
            throw new ValidationException("priority must be in [" + QueueEntry.MIN_PRIORITY + ", "
                    + QueueEntry.MAX_PRIORITY + "], got " + priority);
        }
    }

    private static void requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be empty");
        }
    }
}
