// file: core/src/main/java/io/admitq/core/EntryNotFoundException.java
package io.admitq.core;

/** Operation on an entry that does not exist, was removed, or is out of scope. */
public class EntryNotFoundException extends QueueException {

    private final String entryId;

    public EntryNotFoundException(String entryId) {
        this(entryId, "queue entry not found: " + entryId);
    }

    public EntryNotFoundException(String entryId, String message) {
        super(message);
        this.entryId = entryId;
    }

    public String entryId() {
        return entryId;
    }
}
