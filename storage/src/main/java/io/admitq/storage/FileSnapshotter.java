// file: src/main/java/io/admitq/storage/FileSnapshotter.java
package io.admitq.storage;

import io.admitq.core.QueueEntry;
import io.admitq.core.StorageException;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int32 magic
 *   int64 lastLsn
 *   int32 count
 *   repeated 'count' times:
 *     - entry: int32 len + RecordCodec entry bytes
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<lsn>.bin.tmp" first,
 *   - then move to "snapshot-<lsn>.bin" using ATOMIC_MOVE,
 *   - then delete older snapshots.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final int MAGIC = 0x41514E50; // "AQNP"
    private static final String PREFIX = "snapshot-";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StorageException("cannot create snapshot dir " + dir, e); }
    }

    @Override
    public String writeSnapshot(long lastLsn, Collection<QueueEntry> entries) {
        String name = PREFIX + String.format("%020d", lastLsn) + ".bin";
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.writeInt(MAGIC);
            out.writeLong(lastLsn);
            out.writeInt(entries.size());
            for (QueueEntry e : entries) {
                byte[] bytes = RecordCodec.encodeEntry(e);
                out.writeInt(bytes.length);
                out.write(bytes);
            }
        } catch (IOException ex) { throw new StorageException("snapshot write failed", ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new StorageException("snapshot publish failed", e); }

        for (Path old : listSnapshots()) {
            if (!old.equals(dst)) {
                try { Files.deleteIfExists(old); }
                catch (IOException e) { throw new StorageException("cannot delete old snapshot " + old, e); }
            }
        }
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> snaps = listSnapshots();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);

        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            if (in.readInt() != MAGIC) {
                throw new StorageException("bad snapshot header in " + snap, null);
            }
            long lastLsn = in.readLong();
            int count = in.readInt();
            List<QueueEntry> entries = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                int len = in.readInt();
                entries.add(RecordCodec.decodeEntry(in.readNBytes(len)));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), lastLsn, entries);
        } catch (IOException e) { throw new StorageException("snapshot load failed: " + snap, e); }
    }

    private List<Path> listSnapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().startsWith(PREFIX))
                    .filter(p -> p.getFileName().toString().endsWith(".bin"))
                    .sorted()
                    .toList();
        } catch (IOException e) { throw new StorageException("cannot list snapshot dir " + dir, e); }
    }
}
