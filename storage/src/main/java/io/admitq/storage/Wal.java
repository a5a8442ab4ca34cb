// file: src/main/java/io/admitq/storage/Wal.java
package io.admitq.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - Implementations are not thread-safe; the store serializes all calls.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes, typically from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /**
     * Rotate log segment if configured thresholds are hit.
     * Called by the store after each write.
     */
    void rotateIfNeeded();

    /**
     * Close the active segment and start a new, empty one.
     */
    void rotate();

    /**
     * Delete every segment except the active one.
     * Only safe once a snapshot covers all records in those segments.
     *
     * @return number of segments deleted
     */
    int deleteInactiveSegments();

    /**
     * Open a sequential reader over the WAL.
     * Reader walks segments oldest-first and stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the newest segment.
     */
    WalReader openReader();

    @Override
    void close();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at EOF, or
         *   - corruption/truncation is detected at the tail.
         */
        byte[] next();

        @Override
        void close();
    }
}
