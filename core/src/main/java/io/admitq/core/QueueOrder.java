// file: src/main/java/io/admitq/core/QueueOrder.java
package io.admitq.core;

import java.util.Comparator;

/**
 * Total order over queued entries of one organization.
 * <p>
 * Rank is decided by:
 *  1) priority, descending,
 *  2) queuedAt, ascending (fairness tie-break),
 *  3) id, ascending (keeps the order total when both of the above tie).
 * <p>
 * Every sorted index and every rank computation uses this comparator so
 * that list order, "oldest queued" and positions always agree.
 */
public final class QueueOrder {

    public static final Comparator<QueueEntry> COMPARATOR =
            Comparator.comparingInt(QueueEntry::priority).reversed()
                    .thenComparing(QueueEntry::queuedAt)
                    .thenComparing(QueueEntry::id);

    private QueueOrder() {
        // utility
    }

    /** True if {@code a} ranks strictly ahead of {@code b}. */
    public static boolean precedes(QueueEntry a, QueueEntry b) {
        return COMPARATOR.compare(a, b) < 0;
    }
}
