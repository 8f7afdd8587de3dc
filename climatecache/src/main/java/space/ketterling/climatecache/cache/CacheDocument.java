package space.ketterling.climatecache.cache;

import space.ketterling.climatecache.model.VariableMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One place's cache document: schema version, place block, per-variable
 * metadata and values. Variables keep the order they were first added in.
 */
public final class CacheDocument {
    private final int schemaVersion;
    private Place place;
    private final LinkedHashMap<String, VariableMetadata> variables = new LinkedHashMap<>();
    private final LinkedHashMap<String, VariableSeries> data = new LinkedHashMap<>();

    public CacheDocument(int schemaVersion, Place place) {
        this.schemaVersion = schemaVersion;
        this.place = place;
    }

    public int schemaVersion() {
        return schemaVersion;
    }

    public Place place() {
        return place;
    }

    public void setPlace(Place place) {
        this.place = place;
    }

    public Map<String, VariableMetadata> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public Map<String, VariableSeries> data() {
        return Collections.unmodifiableMap(data);
    }

    public void putMetadata(String variable, VariableMetadata meta) {
        variables.put(variable, meta);
    }

    public boolean hasMetadata(String variable) {
        return variables.containsKey(variable);
    }

    public Optional<VariableSeries> series(String variable) {
        return Optional.ofNullable(data.get(variable));
    }

    public void putSeries(String variable, VariableSeries series) {
        data.put(variable, series);
    }

    /**
     * Years holding at least one value for the variable.
     */
    public Set<Integer> years(String variable) {
        VariableSeries s = data.get(variable);
        return s == null ? Set.of() : s.years();
    }

    /**
     * Deep copy, so cached instances can be handed out safely.
     */
    public CacheDocument copy() {
        CacheDocument c = new CacheDocument(schemaVersion, place);
        c.variables.putAll(variables);
        for (var e : data.entrySet())
            c.data.put(e.getKey(), e.getValue().copy());
        return c;
    }
}
