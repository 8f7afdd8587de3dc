package space.ketterling.climatecache.measure;

import space.ketterling.climatecache.model.VariableMetadata;
import space.ketterling.climatecache.schema.SchemaDefinition;
import space.ketterling.climatecache.schema.SchemaRegistry;

import java.util.*;

/**
 * Maps each {@link Measure} to the cache variable it is stored under, the
 * table column that carries its values and the metadata written for it.
 *
 * <p>
 * The current schema may override the variable and column names, but an
 * override must name every measure and must keep noon temperature on the
 * schema's primary variable.
 * </p>
 */
public final class MeasureRegistry {
    private static final String DATASET = "reanalysis-era5-single-levels";

    private final SchemaRegistry schema;
    private final Map<Measure, String> cacheVariables;
    private final Map<Measure, String> valueColumns;
    private final Map<Measure, VariableMetadata> defaults;

    public MeasureRegistry(SchemaRegistry schema) {
        this.schema = schema;
        this.defaults = builtInMetadata();

        SchemaDefinition current = schema.current();
        Map<Measure, String> vars = builtInCacheVariables(schema.primaryVariable());
        if (current.overridesMeasureCacheVars()) {
            vars = override(current.measureCacheVars(), "measure_cache_vars");
            if (!schema.primaryVariable().equals(vars.get(Measure.NOON_TEMPERATURE))) {
                throw new IllegalStateException(
                        "Current schema field 'measure_cache_vars.noon_temperature' must match 'primary_variable'");
            }
        }
        Map<Measure, String> cols = builtInValueColumns();
        if (current.overridesMeasureValueColumns())
            cols = override(current.measureValueColumns(), "measure_value_columns");

        Set<String> seen = new HashSet<>();
        for (String v : vars.values()) {
            if (!seen.add(v))
                throw new IllegalStateException("Cache variable '" + v + "' is mapped to more than one measure");
        }
        this.cacheVariables = Collections.unmodifiableMap(vars);
        this.valueColumns = Collections.unmodifiableMap(cols);
    }

    public SchemaRegistry schema() {
        return schema;
    }

    public String cacheVariable(Measure measure) {
        return cacheVariables.get(measure);
    }

    /**
     * @throws UnsupportedMeasureException for an unknown key
     */
    public String cacheVariable(String measure) {
        return cacheVariable(Measure.fromKey(measure));
    }

    public String valueColumn(Measure measure) {
        return valueColumns.get(measure);
    }

    /**
     * @throws UnsupportedMeasureException for an unknown key
     */
    public String valueColumn(String measure) {
        return valueColumn(Measure.fromKey(measure));
    }

    /**
     * Reverse lookup from a stored variable to its measure.
     */
    public Optional<Measure> measureForCacheVariable(String cacheVariable) {
        for (var e : cacheVariables.entrySet()) {
            if (e.getValue().equals(cacheVariable))
                return Optional.of(e.getKey());
        }
        return Optional.empty();
    }

    /**
     * Metadata written for a variable: the schema template entry when the
     * current schema declares one, otherwise the built-in default.
     */
    public VariableMetadata metadata(Measure measure) {
        VariableMetadata templ = schema.variablesTemplate().get(cacheVariable(measure));
        return templ != null ? templ : defaults.get(measure);
    }

    /**
     * Decimal places values of this measure are rounded to on write.
     */
    public int precision(Measure measure) {
        Integer p = metadata(measure).precision();
        if (p != null)
            return p;
        return defaults.get(measure).precision();
    }

    /**
     * Variables metadata block for a fresh document holding {@code measure}:
     * the schema template followed by the measure's entry when missing.
     */
    public Map<String, VariableMetadata> variablesMetadata(Measure measure) {
        Map<String, VariableMetadata> out = new LinkedHashMap<>(schema.variablesTemplate());
        out.putIfAbsent(cacheVariable(measure), metadata(measure));
        return out;
    }

    // ----------------------------
    // built-ins
    // ----------------------------

    private static Map<Measure, String> builtInCacheVariables(String primaryVariable) {
        Map<Measure, String> m = new EnumMap<>(Measure.class);
        m.put(Measure.NOON_TEMPERATURE, primaryVariable);
        m.put(Measure.DAILY_PRECIPITATION, "daily_precip_mm");
        m.put(Measure.HOURLY_PRECIPITATION, "hourly_precip_mm");
        m.put(Measure.DAILY_SOLAR_RADIATION_ENERGY, "daily_solar_energy_MJ_m2");
        return m;
    }

    private static Map<Measure, String> builtInValueColumns() {
        Map<Measure, String> m = new EnumMap<>(Measure.class);
        m.put(Measure.NOON_TEMPERATURE, "temp_C");
        m.put(Measure.DAILY_PRECIPITATION, "precip_mm");
        m.put(Measure.HOURLY_PRECIPITATION, "precip_mm");
        m.put(Measure.DAILY_SOLAR_RADIATION_ENERGY, "solar_energy_MJ_m2");
        return m;
    }

    private static Map<Measure, VariableMetadata> builtInMetadata() {
        Map<Measure, VariableMetadata> m = new EnumMap<>(Measure.class);
        m.put(Measure.NOON_TEMPERATURE,
                new VariableMetadata("C", "2m_temperature", DATASET, "daily_local_noon", 2));
        m.put(Measure.DAILY_PRECIPITATION,
                new VariableMetadata("mm", "total_precipitation", DATASET, "daily_total_local", 2));
        m.put(Measure.HOURLY_PRECIPITATION,
                new VariableMetadata("mm", "total_precipitation", DATASET, "hourly_utc", 3));
        m.put(Measure.DAILY_SOLAR_RADIATION_ENERGY,
                new VariableMetadata("MJ/m2", "surface_solar_radiation_downwards", DATASET,
                        "daily_total_local", 2));
        return m;
    }

    private static Map<Measure, String> override(Map<String, String> configured, String field) {
        Map<Measure, String> out = new EnumMap<>(Measure.class);
        for (var e : configured.entrySet()) {
            Measure m;
            try {
                m = Measure.fromKey(e.getKey());
            } catch (UnsupportedMeasureException ex) {
                throw new IllegalStateException(
                        "Current schema field '" + field + "' names an unknown measure: " + e.getKey(), ex);
            }
            out.put(m, e.getValue());
        }
        List<String> missing = new ArrayList<>();
        for (Measure m : Measure.values()) {
            if (!out.containsKey(m))
                missing.add(m.key());
        }
        if (!missing.isEmpty()) {
            Collections.sort(missing);
            throw new IllegalStateException("Current schema field '" + field
                    + "' is missing required measures: " + String.join(", ", missing));
        }
        return out;
    }
}
