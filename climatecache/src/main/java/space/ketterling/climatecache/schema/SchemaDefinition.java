package space.ketterling.climatecache.schema;

import space.ketterling.climatecache.model.VariableMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared layout of one cache schema version.
 *
 * <p>
 * {@code dataKey}, {@code variablesKey} and {@code primaryVariable} are only
 * guaranteed for the current version; legacy versions usually leave them
 * null and describe where their values live instead.
 * </p>
 */
public record SchemaDefinition(
        int version,
        String dataKey,
        String variablesKey,
        String primaryVariable,
        List<String> requiredPaths,
        List<List<String>> requiredAnyOf,
        List<String> legacyDataPaths,
        Map<String, FieldMapping> migrationToNext,
        Map<Integer, Map<String, FieldMapping>> migrationFromPrevious,
        Map<String, String> measureCacheVars,
        Map<String, String> measureValueColumns,
        Map<String, VariableMetadata> variables) {

    public SchemaDefinition {
        requiredPaths = List.copyOf(requiredPaths);
        requiredAnyOf = requiredAnyOf.stream().map(List::copyOf).toList();
        legacyDataPaths = List.copyOf(legacyDataPaths);
        migrationToNext = ordered(migrationToNext);
        migrationFromPrevious = ordered(migrationFromPrevious);
        measureCacheVars = measureCacheVars == null ? null : ordered(measureCacheVars);
        measureValueColumns = measureValueColumns == null ? null : ordered(measureValueColumns);
        variables = ordered(variables);
    }

    // keeps declaration order, which ends up as write order in documents
    private static <K, V> Map<K, V> ordered(Map<K, V> in) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }

    /**
     * Mapping declared on this (newer) version for a document coming from
     * {@code sourceVersion}.
     */
    public Optional<FieldMapping> mappingFrom(int sourceVersion, String targetPath) {
        Map<String, FieldMapping> mappings = migrationFromPrevious.get(sourceVersion);
        if (mappings == null)
            return Optional.empty();
        return Optional.ofNullable(mappings.get(targetPath));
    }

    /**
     * Mapping this (older) version declares towards the next version.
     */
    public Optional<FieldMapping> forwardMapping(String targetPath) {
        return Optional.ofNullable(migrationToNext.get(targetPath));
    }

    public boolean overridesMeasureCacheVars() {
        return measureCacheVars != null;
    }

    public boolean overridesMeasureValueColumns() {
        return measureValueColumns != null;
    }
}
