package space.ketterling.climatecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatecache.measure.Measure;
import space.ketterling.climatecache.measure.MeasureRegistry;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-directory index of which years each cache file holds per measure.
 *
 * <p>
 * Stored as {@value #FILE_NAME} next to the cache documents. Entries are
 * upserted after every document write; the whole index is only rebuilt by
 * scanning the directory when the file is missing, unreadable or a rebuild
 * is forced.
 * </p>
 */
public final class CacheSummaryIndex {
    private static final Logger log = LoggerFactory.getLogger(CacheSummaryIndex.class);

    public static final String FILE_NAME = "cache_summary.json";
    public static final int SUMMARY_VERSION = 1;

    private static final Set<String> US_STATE_CODES = Set.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA",
            "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME", "MD",
            "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
            "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC",
            "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY", "DC");

    private final Path cacheDir;
    private final ObjectMapper om;
    private final CacheCodec codec;
    private final MeasureRegistry measures;
    private final Clock clock;

    private ObjectNode root;
    private FileStamp loadedStamp;

    public CacheSummaryIndex(Path cacheDir, ObjectMapper om, CacheCodec codec, MeasureRegistry measures) {
        this(cacheDir, om, codec, measures, Clock.systemUTC());
    }

    CacheSummaryIndex(Path cacheDir, ObjectMapper om, CacheCodec codec, MeasureRegistry measures, Clock clock) {
        this.cacheDir = cacheDir;
        this.om = om;
        this.codec = codec;
        this.measures = measures;
        this.clock = clock;
    }

    public Path file() {
        return cacheDir.resolve(FILE_NAME);
    }

    /**
     * Years the index records for a file and measure.
     *
     * @return empty when the index has no usable entry for the file; an empty
     *         set when the file is indexed but holds nothing for the measure
     */
    public synchronized Optional<SortedSet<Integer>> cachedYears(String fileName, Measure measure) {
        JsonNode entry = files().path(fileName);
        if (!entry.isObject() || !entry.path("measures").isObject())
            return Optional.empty();
        JsonNode m = entry.path("measures").path(measure.key());
        if (m.isMissingNode())
            return Optional.of(new TreeSet<>());
        if (!m.isObject())
            return Optional.empty();
        try {
            if (m.has("year_ranges"))
                return Optional.of(YearRanges.expand(m.get("year_ranges")));
            if (m.has("years"))
                return Optional.of(YearRanges.expand(m.get("years")));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed summary entry for {} / {}: {}", fileName, measure, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Replaces the entry for one file with what the document holds, then
     * saves the index.
     */
    public synchronized void upsert(String fileName, CacheDocument doc) throws IOException {
        files().set(fileName, entryFor(doc));
        save();
    }

    /**
     * Drops the entry for one file.
     */
    public synchronized void remove(String fileName) throws IOException {
        if (files().remove(fileName) != null)
            save();
    }

    /**
     * Rebuilds the index from every cache document in the directory,
     * skipping files that cannot be read.
     *
     * @return number of files indexed
     */
    public synchronized int rebuild() throws IOException {
        ObjectNode fresh = newRoot();
        ObjectNode files = (ObjectNode) fresh.get("files");
        int indexed = 0;
        for (Path p : cacheFiles()) {
            try {
                files.set(p.getFileName().toString(), entryFor(codec.read(p)));
                indexed++;
            } catch (Exception e) {
                log.warn("Skipping unreadable cache file during summary rebuild: {} ({})", p, e.getMessage());
            }
        }
        root = fresh;
        save();
        log.info("Rebuilt cache summary index with {} file(s) in {}", indexed, cacheDir);
        return indexed;
    }

    /**
     * Loads the index, rebuilding it when absent, corrupt or forced.
     */
    public synchronized void load(boolean forceRebuild) throws IOException {
        root = null;
        if (forceRebuild) {
            rebuild();
            return;
        }
        Path f = file();
        if (!Files.exists(f)) {
            rebuild();
            return;
        }
        try {
            JsonNode parsed = om.readTree(f.toFile());
            if (parsed == null || !parsed.isObject() || !parsed.path("files").isObject())
                throw new IOException("missing 'files' object");
            root = (ObjectNode) parsed;
            loadedStamp = FileStamp.of(f);
        } catch (IOException e) {
            log.warn("Cache summary index {} is unreadable, rebuilding ({})", f, e.getMessage());
            rebuild();
        }
    }

    /**
     * Best-effort country for a place name: "USA" for a US state suffix,
     * the raw suffix otherwise, empty without a comma.
     */
    public static String countryFor(String placeName) {
        if (placeName == null)
            return "";
        int comma = placeName.lastIndexOf(',');
        if (comma < 0)
            return "";
        String suffix = placeName.substring(comma + 1).trim();
        if (suffix.length() == 2 && US_STATE_CODES.contains(suffix.toUpperCase(Locale.ROOT)))
            return "USA";
        return suffix;
    }

    ObjectNode entryFor(CacheDocument doc) {
        ObjectNode entry = om.createObjectNode();
        String name = doc.place() == null ? "" : doc.place().name();
        entry.put("place_name", name);
        entry.put("country", countryFor(name));
        ObjectNode ms = entry.putObject("measures");
        for (Measure m : Measure.values()) {
            String var = measures.cacheVariable(m);
            if (!doc.data().containsKey(var))
                continue;
            ArrayNode ranges = ms.putObject(m.key()).putArray("year_ranges");
            for (String token : YearRanges.compress(doc.years(var)))
                ranges.add(token);
        }
        return entry;
    }

    private ObjectNode files() {
        if (root != null && changedOnDisk()) {
            log.debug("Cache summary index {} changed on disk, reloading", file());
            root = null;
        }
        if (root == null) {
            try {
                load(false);
            } catch (IOException e) {
                log.warn("Cache summary index unavailable for {} ({})", cacheDir, e.getMessage());
                root = newRoot();
            }
        }
        return (ObjectNode) root.get("files");
    }

    private ObjectNode newRoot() {
        ObjectNode r = om.createObjectNode();
        r.put("summary_version", SUMMARY_VERSION);
        r.put("updated_at", Instant.now(clock).toString());
        r.putObject("files");
        return r;
    }

    private void save() throws IOException {
        root.put("summary_version", SUMMARY_VERSION);
        root.put("updated_at", Instant.now(clock).toString());
        String json = om.copy().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(root);
        AtomicFiles.writeString(file(), json + "\n");
        loadedStamp = FileStamp.of(file());
    }

    /**
     * True when another writer replaced the index file since it was last
     * loaded or saved here.
     */
    private boolean changedOnDisk() {
        Path f = file();
        if (!Files.exists(f))
            return true;
        try {
            return !FileStamp.of(f).equals(loadedStamp);
        } catch (IOException e) {
            log.warn("Cannot stat cache summary index {} ({}); keeping loaded copy", f, e.getMessage());
            return false;
        }
    }

    private record FileStamp(FileTime modified, long size) {
        static FileStamp of(Path f) throws IOException {
            return new FileStamp(Files.getLastModifiedTime(f), Files.size(f));
        }
    }

    private List<Path> cacheFiles() throws IOException {
        if (!Files.isDirectory(cacheDir))
            return List.of();
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(cacheDir, "*.yaml")) {
            for (Path p : ds) {
                if (Files.isRegularFile(p) && !p.getFileName().toString().startsWith("."))
                    out.add(p);
            }
        }
        Collections.sort(out);
        return out;
    }
}
