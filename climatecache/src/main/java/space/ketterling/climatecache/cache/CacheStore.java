package space.ketterling.climatecache.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatecache.measure.Measure;
import space.ketterling.climatecache.measure.MeasureRegistry;
import space.ketterling.climatecache.model.Location;
import space.ketterling.climatecache.model.Observation;
import space.ketterling.climatecache.model.ObservationTable;
import space.ketterling.climatecache.model.VariableMetadata;
import space.ketterling.climatecache.model.YearRange;
import space.ketterling.climatecache.schema.MigrationException;
import space.ketterling.climatecache.schema.UnsupportedSchemaVersionException;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read/write access to per-place cache documents and their summary index.
 *
 * <p>
 * Writing a document and upserting its index entry happen under one
 * per-file lock, so concurrent writers of the same place never interleave.
 * </p>
 */
public final class CacheStore {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    public static final String TEMP_F_COLUMN = "temp_F";
    public static final String FILE_EXTENSION = ".yaml";

    private final Path cacheDir;
    private final CacheCodec codec;
    private final MeasureRegistry measures;
    private final ObjectMapper om;
    private final DocumentMemo memo;

    private final Map<Path, CacheSummaryIndex> indexes = new ConcurrentHashMap<>();
    private final Map<Path, Object> locks = new ConcurrentHashMap<>();

    /**
     * Creates a store rooted at a cache directory.
     *
     * @param memoize remember the last parsed document per file
     */
    public CacheStore(Path cacheDir, CacheCodec codec, MeasureRegistry measures, ObjectMapper om, boolean memoize) {
        this.cacheDir = cacheDir;
        this.codec = codec;
        this.measures = measures;
        this.om = om;
        this.memo = memoize ? new DocumentMemo() : null;
    }

    public Path cacheDir() {
        return cacheDir;
    }

    public MeasureRegistry measures() {
        return measures;
    }

    /**
     * Cache file for a place: spaces become underscores and commas are
     * dropped, so "Austin, TX" maps to {@code Austin_TX.yaml}.
     */
    public Path pathForPlace(String placeName) {
        return cacheDir.resolve(baseNameForPlace(placeName) + FILE_EXTENSION);
    }

    public static String baseNameForPlace(String placeName) {
        return placeName.replace(' ', '_').replace(",", "");
    }

    /**
     * Summary index of the directory holding {@code file}.
     */
    public CacheSummaryIndex index(Path file) {
        Path dir = file.toAbsolutePath().normalize().getParent();
        return indexes.computeIfAbsent(dir, d -> new CacheSummaryIndex(d, om, codec, measures));
    }

    public CacheSummaryIndex index() {
        return index(cacheDir.resolve(CacheSummaryIndex.FILE_NAME));
    }

    // ----------------------------
    // cached years
    // ----------------------------

    /**
     * Years with at least one cached value for the measure.
     *
     * <p>
     * Answers from the summary index when it has an entry, otherwise reads
     * the document and repairs the index. Never fails: unreadable files count
     * as holding nothing.
     * </p>
     */
    public SortedSet<Integer> getCachedYears(Path file, Measure measure) {
        if (!Files.exists(file))
            return new TreeSet<>();
        String fileName = file.getFileName().toString();
        try {
            Optional<SortedSet<Integer>> indexed = index(file).cachedYears(fileName, measure);
            if (indexed.isPresent())
                return indexed.get();
        } catch (RuntimeException e) {
            log.warn("Summary index lookup failed for {}: {}", file, e.getMessage());
        }

        try {
            CacheDocument doc = readDocument(file);
            SortedSet<Integer> years = new TreeSet<>(doc.years(measures.cacheVariable(measure)));
            repairIndex(file, doc);
            return years;
        } catch (Exception e) {
            log.warn("Error reading cached years from {}: {}", file, e.getMessage());
            return new TreeSet<>();
        }
    }

    private void repairIndex(Path file, CacheDocument doc) {
        try {
            index(file).upsert(file.getFileName().toString(), doc);
        } catch (IOException e) {
            log.warn("Could not update summary index for {}: {}", file, e.getMessage());
        }
    }

    // ----------------------------
    // reading rows
    // ----------------------------

    /**
     * Flattens one measure's values into rows.
     *
     * @param years optional inclusive filter, {@code null} for all years
     * @return empty table with the expected columns when the document holds
     *         nothing for the measure
     */
    public ObservationTable readRows(Path file, Measure measure, YearRange years) throws IOException {
        CacheDocument doc = readDocument(file);
        String column = measures.valueColumn(measure);
        List<String> columns = expectedColumns(measure);

        Optional<VariableSeries> series = doc.series(measures.cacheVariable(measure));
        if (series.isEmpty() || series.get().isEmpty())
            return ObservationTable.empty(columns);

        Place place = doc.place();
        String placeName = place.name();
        double gridLat = place.gridLat() == null ? Double.NaN : place.gridLat();
        double gridLon = place.gridLon() == null ? Double.NaN : place.gridLon();

        List<Observation> rows = new ArrayList<>();
        for (var e : series.get().values().entrySet()) {
            SeriesKey k = e.getKey();
            if (years != null && !years.contains(k.year()))
                continue;
            double v = e.getValue();
            Map<String, Double> values = new LinkedHashMap<>();
            values.put(column, v);
            if (measure == Measure.NOON_TEMPERATURE)
                values.put(TEMP_F_COLUMN, v * 9.0 / 5.0 + 32.0);
            rows.add(new Observation(k.toDateTime(), placeName, gridLat, gridLon, values));
        }
        return new ObservationTable(columns, rows);
    }

    private List<String> expectedColumns(Measure measure) {
        if (measure == Measure.NOON_TEMPERATURE)
            return List.of(measures.valueColumn(measure), TEMP_F_COLUMN);
        return List.of(measures.valueColumn(measure));
    }

    // ----------------------------
    // writing rows
    // ----------------------------

    /**
     * Writes a measure's rows into a place's document.
     *
     * <p>
     * With {@code append} the rows merge into the existing document: a key
     * already holding a value keeps it unless {@code overwriteExistingValues}
     * is set. Without {@code append} the document is replaced.
     * </p>
     *
     * @throws space.ketterling.climatecache.model.MissingColumnException when
     *         the table lacks the measure's value column
     */
    public void writeRows(Path file, Location location, Measure measure, ObservationTable table, boolean append,
            boolean overwriteExistingValues) throws IOException {
        String column = measures.valueColumn(measure);
        table.requireColumn(column, measure.key());
        String variable = measures.cacheVariable(measure);
        int precision = measures.precision(measure);

        synchronized (lockFor(file)) {
            CacheDocument existing = append ? loadForAppend(file) : null;

            Place place = new Place(location.name(), location.lat(), location.lon(), location.timezone(),
                    null, null);
            CacheDocument doc;
            if (existing != null) {
                Place old = existing.place();
                if (old != null && old.gridLat() != null && old.gridLon() != null)
                    place = place.withGridIfAbsent(old.gridLat(), old.gridLon());
                doc = existing;
                doc.setPlace(place);
            } else {
                doc = new CacheDocument(codec.schema().currentVersion(), place);
                for (var e : measures.variablesMetadata(measure).entrySet())
                    doc.putMetadata(e.getKey(), e.getValue());
            }

            VariableSeries series = doc.series(variable)
                    .filter(existingSeries -> !existingSeries.isEmpty())
                    .orElseGet(() -> new VariableSeries(measure.isHourly()));
            if (series.hourly() != measure.isHourly()) {
                throw new CacheFormatException("Cache variable '" + variable + "' in " + file
                        + " does not match the layout of measure '" + measure + "'");
            }
            int written = 0;
            int skipped = 0;
            for (Observation row : table.rows()) {
                Double v = row.value(column);
                if (v == null)
                    continue;
                if (!Double.isFinite(v)) {
                    skipped++;
                    continue;
                }
                if (doc.place().gridLat() == null && Double.isFinite(row.gridLat()) && Double.isFinite(row.gridLon()))
                    doc.setPlace(doc.place().withGridIfAbsent(row.gridLat(), row.gridLon()));
                SeriesKey key = measure.isHourly() ? SeriesKey.hourly(row.time()) : SeriesKey.daily(row.date());
                double rounded = round(v, precision);
                if (overwriteExistingValues || !append) {
                    series.put(key, rounded);
                    written++;
                } else if (series.putIfAbsent(key, rounded)) {
                    written++;
                }
            }
            doc.putSeries(variable, series);
            backfillMetadata(doc);

            codec.write(doc, file);
            if (memo != null)
                memo.put(file, doc);
            index(file).upsert(file.getFileName().toString(), doc);
            if (skipped > 0)
                log.warn("Skipped {} non-finite value(s) of {} for {}", skipped, measure, location.name());
            log.info("Saved {} value(s) of {} to {}", written, measure, file);
        }
    }

    /**
     * Loads the document an append merges into. A file that cannot be parsed
     * is replaced; schema and migration problems propagate so newer files are
     * never clobbered.
     */
    private CacheDocument loadForAppend(Path file) throws IOException {
        if (!Files.exists(file))
            return null;
        try {
            return readDocument(file);
        } catch (UnsupportedSchemaVersionException | MigrationException e) {
            throw e;
        } catch (CacheFormatException | IOException e) {
            log.warn("Error loading existing cache {} for append: {}. Overwriting.", file, e.getMessage());
            return null;
        }
    }

    private void backfillMetadata(CacheDocument doc) {
        for (String var : doc.data().keySet()) {
            if (doc.hasMetadata(var))
                continue;
            Optional<Measure> m = measures.measureForCacheVariable(var);
            if (m.isPresent()) {
                VariableMetadata meta = measures.metadata(m.get());
                doc.putMetadata(var, meta);
            } else {
                log.warn("No metadata defaults for cache variable '{}'", var);
            }
        }
    }

    // ----------------------------
    // maintenance
    // ----------------------------

    /**
     * Upgrades every cache document in the directory and rebuilds the index.
     *
     * @return number of files that were migrated
     */
    public int migrateAll() throws IOException {
        int migrated = 0;
        for (Path p : cacheFiles()) {
            synchronized (lockFor(p)) {
                try {
                    if (codec.migrateFile(p)) {
                        migrated++;
                        if (memo != null)
                            memo.invalidate(p);
                    }
                } catch (UnsupportedSchemaVersionException | MigrationException | CacheFormatException e) {
                    log.warn("Could not migrate {}: {}", p, e.getMessage());
                }
            }
        }
        index().rebuild();
        return migrated;
    }

    /**
     * Reads a document, reusing the memoized copy while the file is
     * unchanged.
     */
    public CacheDocument readDocument(Path file) throws IOException {
        if (memo != null) {
            CacheDocument hit = memo.get(file);
            if (hit != null)
                return hit;
        }
        CacheDocument doc = codec.read(file);
        if (memo != null)
            memo.put(file, doc);
        return doc;
    }

    private List<Path> cacheFiles() throws IOException {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(cacheDir))
            return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(cacheDir, "*" + FILE_EXTENSION)) {
            for (Path p : ds) {
                if (Files.isRegularFile(p) && !p.getFileName().toString().startsWith("."))
                    out.add(p);
            }
        }
        out.sort(null);
        return out;
    }

    private Object lockFor(Path file) {
        return locks.computeIfAbsent(file.toAbsolutePath().normalize(), k -> new Object());
    }

    static double round(double v, int precision) {
        if (Double.isNaN(v) || Double.isInfinite(v))
            return v;
        return BigDecimal.valueOf(v).setScale(precision, RoundingMode.HALF_EVEN).doubleValue();
    }
}
