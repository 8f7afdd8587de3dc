package space.ketterling.climatecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatecache.model.VariableMetadata;
import space.ketterling.climatecache.schema.SchemaRegistry;
import space.ketterling.climatecache.schema.UnsupportedSchemaVersionException;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads and writes one place's cache document.
 *
 * <p>
 * Reading detects the schema version, rejects documents that are newer
 * than supported or unversioned, and upgrades older ones (persisting the
 * upgrade). Writing is deterministic: fixed key order, ascending years and
 * months, and each month's days on a single flow-style line.
 * </p>
 */
public final class CacheCodec {
    private static final Logger log = LoggerFactory.getLogger(CacheCodec.class);

    private static final Pattern NUMBER_LIKE = Pattern.compile("[-+]?(\\.?[0-9][0-9_.]*([eE][-+]?[0-9]+)?|\\.inf|\\.nan)",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> RESERVED = Set.of("true", "false", "yes", "no", "on", "off", "null", "~", "y",
            "n");

    private final SchemaRegistry schema;
    private final CacheMigration migration;
    private final YAMLMapper yaml = new YAMLMapper();

    public CacheCodec(SchemaRegistry schema, CacheMigration migration) {
        this.schema = schema;
        this.migration = migration;
    }

    public SchemaRegistry schema() {
        return schema;
    }

    /**
     * Reads a document, migrating and rewriting it first when it uses an
     * older schema.
     *
     * @throws UnsupportedSchemaVersionException for newer or unversioned files
     * @throws space.ketterling.climatecache.schema.MigrationException when an
     *         upgrade is impossible; the file is left untouched
     */
    public CacheDocument read(Path file) throws IOException {
        JsonNode root = readTree(file);
        int version = detectVersion(root, file);
        if (version == schema.currentVersion())
            return toDocument(root, file.toString());

        CacheDocument migrated = migration.migrate(root, version, file.toString());
        write(migrated, file);
        log.info("Migrated cache file to schema v{}: {}", schema.currentVersion(), file);
        return migrated;
    }

    /**
     * Upgrades a file in place.
     *
     * @return true when a migration happened, false when already current
     */
    public boolean migrateFile(Path file) throws IOException {
        JsonNode root = readTree(file);
        int version = detectVersion(root, file);
        if (version == schema.currentVersion()) {
            toDocument(root, file.toString());
            return false;
        }
        write(migration.migrate(root, version, file.toString()), file);
        log.info("Migrated cache file to schema v{}: {}", schema.currentVersion(), file);
        return true;
    }

    /**
     * Returns the declared schema version.
     */
    int detectVersion(JsonNode root, Path file) {
        if (root == null || !root.isObject())
            throw new CacheFormatException("Cache file '" + file + "' is not a mapping document");
        JsonNode v = root.get("schema_version");
        if (v == null || v.isNull()) {
            throw new UnsupportedSchemaVersionException(
                    "Cannot read " + file + ": unversioned cache documents are no longer supported");
        }
        int version;
        if (v.isIntegralNumber()) {
            version = v.asInt();
        } else {
            try {
                version = Integer.parseInt(v.asText().trim());
            } catch (NumberFormatException e) {
                throw new UnsupportedSchemaVersionException("Invalid schema_version value: '" + v.asText() + "'", e);
            }
        }
        if (version > schema.currentVersion()) {
            throw new UnsupportedSchemaVersionException("Cache file '" + file + "' uses newer schema_version "
                    + version + "; max supported is " + schema.currentVersion() + ".");
        }
        return version;
    }

    /**
     * Converts a current-version tree into a document.
     */
    CacheDocument toDocument(JsonNode root, String source) {
        String dataKey = schema.dataKey();
        String varsKey = schema.variablesKey();
        if (!root.has(dataKey) || !root.has(varsKey)) {
            throw new CacheFormatException("Cache file '" + source + "' must contain '" + varsKey + "' and '"
                    + dataKey + "' sections");
        }
        JsonNode vars = root.get(varsKey);
        JsonNode data = root.get(dataKey);
        if (!(vars.isNull() || vars.isObject()) || !(data.isNull() || data.isObject()))
            throw new CacheFormatException("Cache file '" + source + "' has malformed variables or data");

        Place place = Place.fromNode(root.get("place"));
        if (place == null)
            throw new CacheFormatException("Cache file '" + source + "' has no place block");

        CacheDocument doc = new CacheDocument(schema.currentVersion(), place);
        for (Iterator<Map.Entry<String, JsonNode>> it = vars.fields(); it.hasNext();) {
            var e = it.next();
            doc.putMetadata(e.getKey(), VariableMetadata.fromNode(e.getValue()));
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = data.fields(); it.hasNext();) {
            var e = it.next();
            doc.putSeries(e.getKey(), ValueMaps.toSeries(e.getValue(), source + ":" + e.getKey()));
        }
        return doc;
    }

    private JsonNode readTree(Path file) throws IOException {
        return yaml.readTree(file.toFile());
    }

    // ----------------------------
    // writing
    // ----------------------------

    /**
     * Writes a document atomically.
     */
    public void write(CacheDocument doc, Path file) throws IOException {
        AtomicFiles.writeString(file, render(doc));
    }

    /**
     * Renders the on-disk text of a document.
     */
    public String render(CacheDocument doc) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("schema_version: ").append(schema.currentVersion()).append('\n');

        Place p = doc.place();
        sb.append("place:\n");
        sb.append("  name: ").append(scalar(p.name())).append('\n');
        sb.append("  lat: ").append(number(p.lat())).append('\n');
        sb.append("  lon: ").append(number(p.lon())).append('\n');
        sb.append("  timezone: ").append(scalar(p.timezone())).append('\n');
        sb.append("  grid_lat: ").append(number(p.gridLat())).append('\n');
        sb.append("  grid_lon: ").append(number(p.gridLon())).append('\n');

        sb.append(schema.variablesKey()).append(':');
        if (doc.variables().isEmpty())
            sb.append(" {}");
        sb.append('\n');
        for (var e : doc.variables().entrySet()) {
            VariableMetadata m = e.getValue();
            sb.append("  ").append(scalar(e.getKey())).append(':');
            if (m.units() == null && m.sourceVariable() == null && m.sourceDataset() == null
                    && m.temporalDefinition() == null && m.precision() == null) {
                sb.append(" {}\n");
                continue;
            }
            sb.append('\n');
            field(sb, "units", m.units());
            field(sb, "source_variable", m.sourceVariable());
            field(sb, "source_dataset", m.sourceDataset());
            field(sb, "temporal_definition", m.temporalDefinition());
            if (m.precision() != null)
                sb.append("    precision: ").append(m.precision()).append('\n');
        }

        sb.append(schema.dataKey()).append(':');
        if (doc.data().isEmpty())
            sb.append(" {}");
        sb.append('\n');
        for (var e : doc.data().entrySet()) {
            VariableSeries series = e.getValue();
            sb.append("  ").append(scalar(e.getKey())).append(':');
            if (series.isEmpty()) {
                sb.append(" {}\n");
                continue;
            }
            sb.append('\n');
            for (var year : series.byYearAndMonth().entrySet()) {
                sb.append("    ").append(year.getKey()).append(":\n");
                for (var month : year.getValue().entrySet()) {
                    sb.append("      ").append(month.getKey()).append(": ");
                    appendMonth(sb, month.getValue(), series.hourly());
                    sb.append('\n');
                }
            }
        }
        return sb.toString();
    }

    private static void appendMonth(StringBuilder sb, NavigableMap<SeriesKey, Double> entries, boolean hourly) {
        sb.append('{');
        int lastDay = -1;
        boolean firstDay = true;
        boolean firstHour = true;
        for (var e : entries.entrySet()) {
            SeriesKey k = e.getKey();
            if (!hourly) {
                if (!firstDay)
                    sb.append(", ");
                sb.append(k.day()).append(": ").append(number(e.getValue()));
                firstDay = false;
                continue;
            }
            if (k.day() != lastDay) {
                if (!firstDay)
                    sb.append("}, ");
                sb.append(k.day()).append(": {");
                lastDay = k.day();
                firstDay = false;
                firstHour = true;
            }
            if (!firstHour)
                sb.append(", ");
            sb.append(k.hour()).append(": ").append(number(e.getValue()));
            firstHour = false;
        }
        if (hourly && !firstDay)
            sb.append('}');
        sb.append('}');
    }

    private static void field(StringBuilder sb, String name, String value) {
        if (value != null)
            sb.append("    ").append(name).append(": ").append(scalar(value)).append('\n');
    }

    /**
     * Plain decimal text for a value; never scientific notation. Missing and
     * non-finite values are written as {@code null}.
     */
    static String number(Double v) {
        if (v == null || !Double.isFinite(v))
            return "null";
        String s = new BigDecimal(Double.toString(v)).stripTrailingZeros().toPlainString();
        if (s.equals("-0"))
            s = "0";
        return s.indexOf('.') < 0 ? s + ".0" : s;
    }

    /**
     * Plain scalar when YAML would read it back as the same string, double
     * quoted otherwise.
     */
    static String scalar(String s) {
        if (s == null)
            return "null";
        if (!needsQuotes(s))
            return s;
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20)
                        sb.append(String.format("\\x%02x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }

    private static boolean needsQuotes(String s) {
        if (s.isEmpty() || !s.strip().equals(s))
            return true;
        if (RESERVED.contains(s.toLowerCase(Locale.ROOT)) || NUMBER_LIKE.matcher(s).matches())
            return true;
        if ("-?:,[]{}#&*!|>'\"%@`".indexOf(s.charAt(0)) >= 0)
            return true;
        if (s.contains(": ") || s.contains(" #") || s.endsWith(":"))
            return true;
        for (char c : s.toCharArray()) {
            if (c < 0x20 || c == 0x7f)
                return true;
        }
        return false;
    }
}
