package space.ketterling.climatecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatecache.measure.Measure;
import space.ketterling.climatecache.measure.MeasureRegistry;
import space.ketterling.climatecache.schema.FieldMapping;
import space.ketterling.climatecache.schema.MigrationException;
import space.ketterling.climatecache.schema.SchemaDefinition;
import space.ketterling.climatecache.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Upgrades a parsed legacy document to the current schema in one hop.
 *
 * <p>
 * The result holds only the schema version, the place block, one metadata
 * entry and the primary variable's values. Nothing is written here; the
 * codec decides when to persist.
 * </p>
 */
public final class CacheMigration {
    private static final Logger log = LoggerFactory.getLogger(CacheMigration.class);

    /** Root keys older releases stored noon temperatures under. */
    static final List<String> FALLBACK_LEGACY_KEYS = List.of("noon_temps", "temperatures", "noon_temperatures");

    private final SchemaRegistry schema;
    private final MeasureRegistry measures;

    public CacheMigration(SchemaRegistry schema, MeasureRegistry measures) {
        this.schema = schema;
        this.measures = measures;
    }

    /**
     * Builds the current-version document for a legacy tree.
     *
     * @param root        parsed legacy document
     * @param fromVersion schema version the document declares, below current
     * @param source      file name used in error messages
     * @throws MigrationException when required content is missing
     */
    public CacheDocument migrate(JsonNode root, int fromVersion, String source) {
        SchemaDefinition def = schema.definition(fromVersion).orElseThrow(() -> new MigrationException(
                "Cannot migrate " + source + ": unsupported schema_version " + fromVersion));

        validateRequired(root, def, source);

        JsonNode legacy = locateLegacyValues(root, fromVersion, def);
        JsonNode placeNode = root.get("place");
        if (legacy == null || legacy.isEmpty() || placeNode == null || !placeNode.isObject()) {
            throw new MigrationException(
                    "Cannot migrate " + source + ": missing legacy temperature data or place metadata");
        }

        VariableSeries series;
        try {
            series = ValueMaps.toSeries(legacy, source);
        } catch (CacheFormatException e) {
            throw new MigrationException("Cannot migrate " + source + ": " + e.getMessage(), e);
        }
        if (series.hourly())
            throw new MigrationException("Cannot migrate " + source + ": legacy values must be daily");

        String primary = schema.primaryVariable();
        CacheDocument doc = new CacheDocument(schema.currentVersion(), Place.fromNode(placeNode));
        doc.putMetadata(primary, measures.metadata(Measure.NOON_TEMPERATURE));
        doc.putSeries(primary, series);
        log.debug("Migrated {} from schema v{} to v{} ({} values)", source, fromVersion,
                schema.currentVersion(), series.size());
        return doc;
    }

    /**
     * Checks the required paths and any-of groups the source version declares.
     */
    void validateRequired(JsonNode root, SchemaDefinition def, String source) {
        for (String path : def.requiredPaths()) {
            if (!ValueMaps.hasPath(root, path))
                throw new MigrationException("Cannot migrate " + source + ": missing required path '" + path + "'");
        }
        for (List<String> group : def.requiredAnyOf()) {
            boolean found = false;
            for (String candidate : group) {
                if (ValueMaps.hasPath(root, candidate)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                throw new MigrationException("Cannot migrate " + source
                        + ": missing required key path group; expected one of [" + String.join(", ", group) + "]");
            }
        }
    }

    /**
     * Finds the legacy value map: the current schema's mapping for this
     * version first, then the source version's forward mapping, then the
     * legacy keys the source version lists, then the fixed fallbacks.
     */
    JsonNode locateLegacyValues(JsonNode root, int fromVersion, SchemaDefinition def) {
        String target = schema.dataKey() + "." + schema.primaryVariable();

        List<FieldMapping> mappings = new ArrayList<>();
        schema.current().mappingFrom(fromVersion, target).ifPresent(mappings::add);
        def.forwardMapping(target).ifPresent(mappings::add);
        for (FieldMapping m : mappings) {
            Optional<JsonNode> hit = firstMapping(root, m.orderedPaths());
            if (hit.isPresent())
                return hit.get();
        }

        List<String> keys = new ArrayList<>(def.legacyDataPaths());
        for (String k : FALLBACK_LEGACY_KEYS) {
            if (!keys.contains(k))
                keys.add(k);
        }
        return firstMapping(root, keys).orElse(null);
    }

    private static Optional<JsonNode> firstMapping(JsonNode root, List<String> paths) {
        for (String p : paths) {
            JsonNode v = ValueMaps.getByPath(root, p);
            if (v != null && v.isObject() && !v.isEmpty())
                return Optional.of(v);
        }
        return Optional.empty();
    }
}
