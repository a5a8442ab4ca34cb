// file: src/main/java/io/admitq/storage/RecordCodec.java
package io.admitq.storage;

import io.admitq.core.EntryStatus;
import io.admitq.core.QueueEntry;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xAD17   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - lsn:      int64 log sequence number
 *     - op:       byte (1=ENQUEUE, 2=STARTED, 3=CANCELED, 4=REMOVED)
 *     - entryId:  int32 len + UTF-8 bytes
 *     - ENQUEUE only:  encoded entry (see encodeEntry)
 *     - STARTED only:  startedAt as int64 epochSecond + int32 nanos
 * <p>
 *   [ENTRY]
 *     - id, orgId, agentId, scheduleId: int32 len + UTF-8 bytes
 *     - priority:   int32
 *     - queuedAt:   instant
 *     - startedAt:  byte present flag, then instant if present
 *     - status:     byte (EntryStatus code)
 *     - createdAt:  instant
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xAD17;
    static final byte  VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    enum Op {
        ENQUEUE((byte) 1), STARTED((byte) 2), CANCELED((byte) 3), REMOVED((byte) 4);

        final byte code;

        Op(byte code) { this.code = code; }

        static Op fromCode(byte code) {
            for (Op op : values()) {
                if (op.code == code) return op;
            }
            throw new IllegalArgumentException("Unknown WAL op: " + code);
        }
    }

    /**
     * Immutable view of a decoded record.
     * entry is set only for ENQUEUE, at only for STARTED.
     */
    record LogRecord(long lsn, Op op, String entryId, QueueEntry entry, Instant at) {
        LogRecord {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(entryId, "entryId");
            if (op == Op.ENQUEUE && entry == null) throw new IllegalArgumentException("ENQUEUE needs entry");
            if (op == Op.STARTED && at == null) throw new IllegalArgumentException("STARTED needs timestamp");
        }

        static LogRecord enqueue(long lsn, QueueEntry entry) {
            return new LogRecord(lsn, Op.ENQUEUE, entry.id(), entry, null);
        }

        static LogRecord started(long lsn, String entryId, Instant at) {
            return new LogRecord(lsn, Op.STARTED, entryId, null, at);
        }

        static LogRecord canceled(long lsn, String entryId) {
            return new LogRecord(lsn, Op.CANCELED, entryId, null, null);
        }

        static LogRecord removed(long lsn, String entryId) {
            return new LogRecord(lsn, Op.REMOVED, entryId, null, null);
        }
    }

    private RecordCodec() {
        // utility
    }

    /** Encode a log record into header+payload bytes ready for append. */
    static byte[] encode(LogRecord rec) {
        byte[] payload = encodePayload(rec);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long lsn = b.getLong();
        Op op = Op.fromCode(b.get());
        String entryId = readString(b);
        return switch (op) {
            case ENQUEUE -> LogRecord.enqueue(lsn, readEntry(b));
            case STARTED -> LogRecord.started(lsn, entryId, readInstant(b));
            case CANCELED -> LogRecord.canceled(lsn, entryId);
            case REMOVED -> LogRecord.removed(lsn, entryId);
        };
    }

    /** Standalone entry encoding, shared with the snapshot format. */
    static byte[] encodeEntry(QueueEntry e) {
        ByteBuffer b = ByteBuffer.allocate(entrySize(e)).order(ByteOrder.LITTLE_ENDIAN);
        writeEntry(b, e);
        return b.array();
    }

    static QueueEntry decodeEntry(byte[] bytes) {
        return readEntry(ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN));
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // CRC32 fits in unsigned int; Java int is fine for compare
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(LogRecord rec) {
        byte[] id = utf8(rec.entryId());
        int size = 8 + 1 + 4 + id.length;
        if (rec.op() == Op.ENQUEUE) size += entrySize(rec.entry());
        if (rec.op() == Op.STARTED) size += INSTANT_BYTES;

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putLong(rec.lsn());
        b.put(rec.op().code);
        writeBytes(b, id);
        if (rec.op() == Op.ENQUEUE) writeEntry(b, rec.entry());
        if (rec.op() == Op.STARTED) writeInstant(b, rec.at());
        return b.array();
    }

    private static final int INSTANT_BYTES = 8 + 4;

    private static int entrySize(QueueEntry e) {
        int size = 0;
        size += 4 + utf8(e.id()).length;
        size += 4 + utf8(e.orgId()).length;
        size += 4 + utf8(e.agentId()).length;
        size += 4 + utf8(e.scheduleId()).length;
        size += 4;                                        // priority
        size += INSTANT_BYTES;                            // queuedAt
        size += 1 + (e.startedAt() == null ? 0 : INSTANT_BYTES);
        size += 1;                                        // status
        size += INSTANT_BYTES;                            // createdAt
        return size;
    }

    private static void writeEntry(ByteBuffer b, QueueEntry e) {
        writeBytes(b, utf8(e.id()));
        writeBytes(b, utf8(e.orgId()));
        writeBytes(b, utf8(e.agentId()));
        writeBytes(b, utf8(e.scheduleId()));
        b.putInt(e.priority());
        writeInstant(b, e.queuedAt());
        if (e.startedAt() == null) {
            b.put((byte) 0);
        } else {
            b.put((byte) 1);
            writeInstant(b, e.startedAt());
        }
        b.put(e.status().code());
        writeInstant(b, e.createdAt());
    }

    private static QueueEntry readEntry(ByteBuffer b) {
        String id = readString(b);
        String orgId = readString(b);
        String agentId = readString(b);
        String scheduleId = readString(b);
        int priority = b.getInt();
        Instant queuedAt = readInstant(b);
        Instant startedAt = b.get() != 0 ? readInstant(b) : null;
        EntryStatus status = EntryStatus.fromCode(b.get());
        Instant createdAt = readInstant(b);
        return new QueueEntry(id, orgId, agentId, scheduleId, priority, queuedAt, startedAt, status, createdAt);
    }

    private static void writeInstant(ByteBuffer b, Instant t) {
        b.putLong(t.getEpochSecond()).putInt(t.getNano());
    }

    private static Instant readInstant(ByteBuffer b) {
        long seconds = b.getLong();
        int nanos = b.getInt();
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length).put(data);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0) throw new IllegalStateException("negative string length in WAL record");
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}
