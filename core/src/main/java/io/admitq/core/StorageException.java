// file: core/src/main/java/io/admitq/core/StorageException.java
package io.admitq.core;

/** Backing-store failure (WAL append, snapshot write, recovery). Always surfaced. */
public class StorageException extends QueueException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
