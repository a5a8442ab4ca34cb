// file: core/src/main/java/io/admitq/core/InvalidStateException.java
package io.admitq.core;

/** A transition was attempted from a status that does not allow it. */
public class InvalidStateException extends QueueException {

    private final EntryStatus actual;

    public InvalidStateException(String entryId, EntryStatus actual, EntryStatus target) {
        super("cannot move entry " + entryId + " from " + actual.wireName() + " to " + target.wireName());
        this.actual = actual;
    }

    public EntryStatus actual() {
        return actual;
    }
}
