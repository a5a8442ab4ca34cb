// file: core/src/main/java/io/admitq/core/ValidationException.java
package io.admitq.core;

/** Malformed enqueue request or configuration value. */
public class ValidationException extends QueueException {

    public ValidationException(String message) {
        super(message);
    }
}
