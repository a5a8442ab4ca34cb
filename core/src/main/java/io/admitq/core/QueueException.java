// file: core/src/main/java/io/admitq/core/QueueException.java
package io.admitq.core;

/**
 * Root of the queue subsystem's failures. Unchecked; callers decide whether to retry.
 */
public abstract class QueueException extends RuntimeException {

    protected QueueException(String message) {
        super(message);
    }

    protected QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
