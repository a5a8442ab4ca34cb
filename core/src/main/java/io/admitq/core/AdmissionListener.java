// file: core/src/main/java/io/admitq/core/AdmissionListener.java
package io.admitq.core;

/**
 * Callback fired when an entry is promoted to STARTED.
 * <p>
 * Called while the admission locks for the entry's org and agent are still
 * held, so a listener that maintains running counts makes the new job visible
 * to the next admission attempt on the same scope.
 */
@FunctionalInterface
public interface AdmissionListener {

    void onAdmitted(QueueEntry entry);
}
