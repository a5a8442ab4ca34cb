// file: src/main/java/io/admitq/storage/FileWal.java
package io.admitq.storage;

import io.admitq.core.StorageException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;


/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StorageException("cannot create WAL dir " + dir, e); }
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new StorageException("WAL append failed", e);
        }
    }

    @Override
    public void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        rotate();
    }

    @Override
    public void rotate() {
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new StorageException("WAL rotation failed", e);
        }
    }

    @Override
    public int deleteInactiveSegments() {
        int deleted = 0;
        for (Path seg : listSegments()) {
            if (seg.equals(current)) continue;
            try {
                Files.deleteIfExists(seg);
                deleted++;
            } catch (IOException e) {
                throw new StorageException("cannot delete WAL segment " + seg, e);
            }
        }
        if (deleted > 0) {
            log.fine(() -> "deleted inactive WAL segments in " + dir);
        }
        return deleted;
    }

    @Override
    public WalReader openReader() { return new Reader(listSegments()); }

    @Override
    public void close() {
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        List<Path> segments = listSegments();
        current = segments.isEmpty() ? dir.resolve(segmentName(1)) : segments.get(segments.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new StorageException("cannot open WAL segment " + current, e);
        }
    }

    private List<Path> listSegments() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("cannot list WAL dir " + dir, e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(SUFFIX, ""));
    }

    /**
     * Sequential reader over all WAL segments, oldest first, used during recovery.
     * A torn record ends the scan; anything after it is ignored.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIdx = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            while (!stopped) {
                if (ch == null && !openNextSegment()) {
                    return null;
                }
                try {
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read == -1 || read == 0) { // end of this segment
                        closeSegment();
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) return stop(); // truncated header at tail
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return stop();
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) return stop(); // truncated payload
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) return stop(); // bad tail
                    pos += RecordCodec.HEADER_BYTES + (long) len;
                    return bytes;
                } catch (IOException e) {
                    throw new StorageException("WAL read failed", e);
                }
            }
            return null;
        }

        private boolean openNextSegment() {
            segmentIdx++;
            if (segmentIdx >= segments.size()) {
                stopped = true;
                return false;
            }
            try {
                ch = FileChannel.open(segments.get(segmentIdx), READ);
                pos = 0;
                return true;
            } catch (IOException e) {
                throw new StorageException("cannot open WAL segment " + segments.get(segmentIdx), e);
            }
        }

        private byte[] stop() {
            log.warning(() -> "WAL scan stopped at torn or corrupt record in "
                    + segments.get(segmentIdx) + " offset " + pos);
            stopped = true;
            closeSegment();
            return null;
        }

        private void closeSegment() {
            if (ch == null) return;
            try {
                ch.close();
            } catch (IOException e) {
                throw new StorageException("WAL close failed", e);
            } finally {
                ch = null;
            }
        }

        @Override public void close() { closeSegment(); }
    }
}
