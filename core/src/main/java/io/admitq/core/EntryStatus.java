// file: src/main/java/io/admitq/core/EntryStatus.java
package io.admitq.core;

import java.util.Locale;

/**
 * Lifecycle state of a queue entry.
 * <p>
 * Transitions are forward-only:
 *  - QUEUED -> STARTED   (admission)
 *  - QUEUED -> CANCELED  (external cancel request)
 * <p>
 * Completion or failure of a started job is tracked outside this subsystem.
 */
public enum EntryStatus {
    QUEUED((byte) 0),
    STARTED((byte) 1),
    CANCELED((byte) 2);

    private final byte code;

    EntryStatus(byte code) {
        this.code = code;
    }

    /** Stable on-disk code. */
    public byte code() {
        return code;
    }

    /** Lower-case name used on the HTTP surface ("queued", "started", "canceled"). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != QUEUED;
    }

    public static EntryStatus fromCode(byte code) {
        for (EntryStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown status code: " + code);
    }
}
