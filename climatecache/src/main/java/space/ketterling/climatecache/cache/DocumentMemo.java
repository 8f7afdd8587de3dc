package space.ketterling.climatecache.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the last parsed document per file, keyed by modification time
 * and size. Callers always receive a copy.
 */
final class DocumentMemo {

    private record Stamp(long modifiedMillis, long size) {
    }

    private record Entry(Stamp stamp, CacheDocument doc) {
    }

    private final Map<Path, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Returns a copy of the remembered document if the file is unchanged.
     */
    CacheDocument get(Path file) throws IOException {
        Path key = file.toAbsolutePath().normalize();
        Entry e = entries.get(key);
        if (e == null)
            return null;
        if (!Files.exists(key) || !e.stamp().equals(stamp(key))) {
            entries.remove(key);
            return null;
        }
        return e.doc().copy();
    }

    void put(Path file, CacheDocument doc) throws IOException {
        Path key = file.toAbsolutePath().normalize();
        entries.put(key, new Entry(stamp(key), doc.copy()));
    }

    void invalidate(Path file) {
        entries.remove(file.toAbsolutePath().normalize());
    }

    private static Stamp stamp(Path file) throws IOException {
        BasicFileAttributes a = Files.readAttributes(file, BasicFileAttributes.class);
        return new Stamp(a.lastModifiedTime().toMillis(), a.size());
    }
}
