package space.ketterling.climatecache.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatecache.model.VariableMetadata;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Immutable view of the versioned cache schema table.
 *
 * <p>
 * Built once at startup from a declarative YAML document and passed to the
 * components that need it. Any malformed entry fails construction.
 * </p>
 */
public final class SchemaRegistry {
    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    /** Classpath resource holding the built-in registry. */
    public static final String DEFAULT_RESOURCE = "schema.yaml";

    private final String source;
    private final int currentVersion;
    private final SortedMap<Integer, SchemaDefinition> versions;

    private SchemaRegistry(String source, int currentVersion, SortedMap<Integer, SchemaDefinition> versions) {
        this.source = source;
        this.currentVersion = currentVersion;
        this.versions = Collections.unmodifiableSortedMap(versions);
    }

    /**
     * Loads the built-in registry from the classpath.
     */
    public static SchemaRegistry load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads a registry from a file path, falling back to a classpath resource
     * of the same name.
     */
    public static SchemaRegistry load(String location) {
        Path p = Path.of(location);
        if (Files.isRegularFile(p)) {
            try (InputStream in = Files.newInputStream(p)) {
                return load(in, p.toString());
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read cache schema registry: " + p, e);
            }
        }
        try (InputStream in = SchemaRegistry.class.getClassLoader().getResourceAsStream(location)) {
            if (in == null)
                throw new IllegalStateException("Cache schema registry not found: " + location);
            return load(in, location);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read cache schema registry: " + location, e);
        }
    }

    /**
     * Parses and validates a registry document.
     */
    public static SchemaRegistry load(InputStream in, String source) throws IOException {
        JsonNode root = new YAMLMapper().readTree(in);
        return fromTree(root, source);
    }

    /**
     * Validates an already parsed registry tree.
     */
    public static SchemaRegistry fromTree(JsonNode root, String source) {
        if (root == null || !root.isObject())
            throw new IllegalStateException("Invalid cache schema registry: " + source);

        JsonNode currentNode = root.get("current_version");
        JsonNode versionsNode = root.get("versions");
        if (currentNode == null || currentNode.isNull() || versionsNode == null || !versionsNode.isObject()
                || versionsNode.isEmpty()) {
            throw new IllegalStateException("Invalid cache schema registry: " + source);
        }
        int current = parseVersion(currentNode.asText(), source);

        Map<Integer, JsonNode> raw = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = versionsNode.fields(); it.hasNext();) {
            var e = it.next();
            raw.put(parseVersion(e.getKey(), source), e.getValue());
        }
        if (!raw.containsKey(current)) {
            throw new IllegalStateException(
                    "Cache schema version " + current + " not found in registry: " + source);
        }

        SortedMap<Integer, SchemaDefinition> defs = new TreeMap<>();
        for (var e : raw.entrySet()) {
            defs.put(e.getKey(), parseDefinition(e.getKey(), e.getValue(), e.getKey() == current));
        }
        log.debug("Loaded cache schema registry {} current={} versions={}", source, current, defs.keySet());
        return new SchemaRegistry(source, current, defs);
    }

    public String source() {
        return source;
    }

    public int currentVersion() {
        return currentVersion;
    }

    public SchemaDefinition current() {
        return versions.get(currentVersion);
    }

    public Optional<SchemaDefinition> definition(int version) {
        return Optional.ofNullable(versions.get(version));
    }

    public SortedMap<Integer, SchemaDefinition> versions() {
        return versions;
    }

    public String dataKey() {
        return current().dataKey();
    }

    public String variablesKey() {
        return current().variablesKey();
    }

    public String primaryVariable() {
        return current().primaryVariable();
    }

    /**
     * Metadata template the current schema declares for its variables.
     */
    public Map<String, VariableMetadata> variablesTemplate() {
        return current().variables();
    }

    // ----------------------------
    // parsing
    // ----------------------------

    private static int parseVersion(String raw, String source) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid schema version '" + raw + "' in registry: " + source);
        }
    }

    private static SchemaDefinition parseDefinition(int version, JsonNode def, boolean isCurrent) {
        if (def == null || !def.isObject())
            throw new IllegalStateException("Schema version " + version + " definition must be a mapping");

        List<String> required = new ArrayList<>();
        for (String field : List.of("required", "required_paths")) {
            JsonNode v = def.get(field);
            if (v != null && !v.isNull())
                required.addAll(stringList(v, "Schema version " + version + " field '" + field
                        + "' must be a non-empty string list"));
        }

        JsonNode anyOf = def.has("required_any_of") ? def.get("required_any_of") : def.get("required_any_of_paths");
        List<List<String>> anyOfGroups = new ArrayList<>();
        if (anyOf != null && !anyOf.isNull()) {
            if (!anyOf.isArray())
                throw new IllegalStateException(
                        "Schema version " + version + " field 'required_any_of' must be a list of path groups");
            for (JsonNode group : anyOf) {
                List<String> g = stringList(group, "Schema version " + version
                        + " field 'required_any_of' must contain non-empty string lists");
                if (g.isEmpty())
                    throw new IllegalStateException("Schema version " + version
                            + " field 'required_any_of' must contain non-empty string lists");
                anyOfGroups.add(g);
            }
        }

        String dataKey = optionalText(def, "data_key", version);
        String variablesKey = optionalText(def, "variables_key", version);
        String primary = optionalText(def, "primary_variable", version);
        if (isCurrent) {
            if (dataKey == null)
                throw new IllegalStateException("Current schema version " + version + " must define 'data_key'");
            if (variablesKey == null)
                throw new IllegalStateException(
                        "Current schema version " + version + " must define 'variables_key'");
            if (primary == null)
                throw new IllegalStateException(
                        "Current schema version " + version + " must define 'primary_variable'");
        }

        List<String> legacy = new ArrayList<>();
        for (String field : List.of("primary_data_path", "temperature_key")) {
            String v = optionalText(def, field, version);
            if (v != null && !legacy.contains(v))
                legacy.add(v);
        }
        for (String field : List.of("legacy_data_paths", "legacy_temperature_keys")) {
            JsonNode v = def.get(field);
            if (v == null || v.isNull())
                continue;
            for (String key : stringList(v, "Schema version " + version + " field '" + field
                    + "' must be a string list")) {
                if (!legacy.contains(key))
                    legacy.add(key);
            }
        }

        Map<String, FieldMapping> toNext = Map.of();
        JsonNode next = def.get("migration_to_next");
        if (next != null && !next.isNull())
            toNext = fieldMappings(requireObject(next, version, "migration_to_next").get("field_mappings"),
                    version, "migration_to_next");

        Map<Integer, Map<String, FieldMapping>> fromPrevious = new LinkedHashMap<>();
        JsonNode migration = def.get("migration");
        if (migration != null && !migration.isNull()) {
            requireObject(migration, version, "migration");
            JsonNode from = migration.get("from_version");
            if (from == null || from.isNull())
                throw new IllegalStateException(
                        "Schema version " + version + " field 'migration' must declare 'from_version'");
            fromPrevious.put(parseVersion(from.asText(), "version " + version),
                    fieldMappings(migration.get("field_mappings"), version, "migration"));
        }
        JsonNode previous = def.get("migration_from_previous");
        if (previous != null && !previous.isNull()) {
            requireObject(previous, version, "migration_from_previous");
            for (Iterator<Map.Entry<String, JsonNode>> it = previous.fields(); it.hasNext();) {
                var e = it.next();
                int from = parseVersion(e.getKey(), "version " + version);
                JsonNode block = requireObject(e.getValue(), version, "migration_from_previous." + e.getKey());
                fromPrevious.putIfAbsent(from, fieldMappings(block.get("field_mappings"), version,
                        "migration_from_previous." + e.getKey()));
            }
        }

        Map<String, VariableMetadata> variables = new LinkedHashMap<>();
        JsonNode vars = def.get("variables");
        if (vars != null && !vars.isNull()) {
            requireObject(vars, version, "variables");
            for (Iterator<Map.Entry<String, JsonNode>> it = vars.fields(); it.hasNext();) {
                var e = it.next();
                variables.put(e.getKey(), VariableMetadata.fromNode(requireObject(e.getValue(), version,
                        "variables." + e.getKey())));
            }
        }

        return new SchemaDefinition(
                version,
                dataKey,
                variablesKey,
                primary,
                required,
                anyOfGroups,
                legacy,
                toNext,
                fromPrevious,
                stringMap(def.get("measure_cache_vars"), version, "measure_cache_vars"),
                stringMap(def.get("measure_value_columns"), version, "measure_value_columns"),
                variables);
    }

    private static Map<String, FieldMapping> fieldMappings(JsonNode node, int version, String field) {
        if (node == null || node.isNull())
            return Map.of();
        requireObject(node, version, field + ".field_mappings");
        Map<String, FieldMapping> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
            var e = it.next();
            JsonNode m = e.getValue();
            String where = "Schema version " + version + " mapping '" + field + "." + e.getKey() + "'";
            if (m.isTextual() && !m.asText().isBlank()) {
                out.put(e.getKey(), FieldMapping.of(m.asText()));
                continue;
            }
            if (!m.isObject())
                throw new IllegalStateException(where + " must be a path or a mapping");
            JsonNode sp = m.get("source_path");
            String sourcePath = null;
            if (sp != null && !sp.isNull()) {
                if (!sp.isTextual() || sp.asText().isBlank())
                    throw new IllegalStateException(where + " has an invalid 'source_path'");
                sourcePath = sp.asText();
            }
            List<String> candidates = List.of();
            JsonNode sc = m.get("source_candidates");
            if (sc != null && !sc.isNull())
                candidates = stringList(sc, where + " field 'source_candidates' must be a string list");
            if (sourcePath == null && candidates.isEmpty())
                throw new IllegalStateException(where + " must declare 'source_path' or 'source_candidates'");
            out.put(e.getKey(), new FieldMapping(sourcePath, candidates));
        }
        return out;
    }

    private static Map<String, String> stringMap(JsonNode node, int version, String field) {
        if (node == null || node.isNull())
            return null;
        String msg = "Schema version " + version + " field '" + field
                + "' must be a non-empty mapping of strings";
        if (!node.isObject() || node.isEmpty())
            throw new IllegalStateException(msg);
        Map<String, String> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
            var e = it.next();
            if (e.getKey().isBlank() || !e.getValue().isTextual() || e.getValue().asText().isBlank())
                throw new IllegalStateException(msg);
            out.put(e.getKey(), e.getValue().asText());
        }
        return out;
    }

    private static List<String> stringList(JsonNode node, String message) {
        if (node == null || !node.isArray())
            throw new IllegalStateException(message);
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isEmpty())
                throw new IllegalStateException(message);
            out.add(item.asText());
        }
        return out;
    }

    private static String optionalText(JsonNode def, String field, int version) {
        JsonNode v = def.get(field);
        if (v == null || v.isNull())
            return null;
        if (!v.isTextual() || v.asText().isBlank())
            throw new IllegalStateException(
                    "Schema version " + version + " field '" + field + "' must be a non-empty string");
        return v.asText();
    }

    private static JsonNode requireObject(JsonNode node, int version, String field) {
        if (node == null || !node.isObject())
            throw new IllegalStateException("Schema version " + version + " field '" + field
                    + "' must be a mapping");
        return node;
    }
}
