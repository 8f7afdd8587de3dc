package space.ketterling.climatecache.config;

import space.ketterling.climatecache.measure.Measure;
import space.ketterling.climatecache.retrieval.FetchOptions;
import space.ketterling.climatecache.retrieval.FetchOptions.Chunking;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Runtime settings for the cache and the retrieval coordinator.
 *
 * <p>
 * Values come from environment variables, then JVM system properties, then
 * {@code application.properties} on the classpath.
 * </p>
 */
public record AppConfig(
        // Cache
        Path dataCacheDir,
        String schemaRegistry,
        boolean documentMemo,

        // Retrieval
        double wetHourThresholdMm,
        boolean overwriteExistingCacheValues,
        int monthFetchDaySpanThreshold,
        Map<Measure, Chunking> fetchModes) {

    public AppConfig {
        Objects.requireNonNull(dataCacheDir, "dataCacheDir");
        if (wetHourThresholdMm < 0 || Double.isNaN(wetHourThresholdMm))
            throw new IllegalStateException("wetHourThresholdMm must be >= 0, got " + wetHourThresholdMm);
        if (monthFetchDaySpanThreshold < 0)
            throw new IllegalStateException(
                    "monthFetchDaySpanThreshold must be >= 0, got " + monthFetchDaySpanThreshold);
        Map<Measure, Chunking> modes = new EnumMap<>(defaultFetchModes());
        if (fetchModes != null)
            modes.putAll(fetchModes);
        fetchModes = Collections.unmodifiableMap(modes);
    }

    /**
     * Defaults for everything except the cache directory.
     */
    public static AppConfig defaults(Path dataCacheDir) {
        return new AppConfig(dataCacheDir, "schema.yaml", true, 1.0, false,
                FetchOptions.DEFAULT_MONTH_DAY_SPAN_THRESHOLD, Map.of());
    }

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read application.properties", e);
        }

        Path dir = Path.of(requireNonBlank(envOr(p, "DATA_CACHE_DIR", "cache.dataDir", "data_cache"),
                "cache.dataDir"));
        String schema = requireNonBlank(envOr(p, "SCHEMA_REGISTRY", "cache.schemaRegistry", "schema.yaml"),
                "cache.schemaRegistry");
        boolean memo = Boolean.parseBoolean(envOr(p, "CACHE_DOCUMENT_MEMO", "cache.documentMemo", "true"));

        double wet = parseDouble(envOr(p, "WET_HOUR_THRESHOLD_MM", "retrieval.wetHourThresholdMm", "1.0"),
                "retrieval.wetHourThresholdMm");
        boolean overwrite = Boolean.parseBoolean(
                envOr(p, "OVERWRITE_CACHE_VALUES", "retrieval.overwriteExistingCacheValues", "false"));
        int span = parseInt(envOr(p, "MONTH_FETCH_DAY_SPAN", "retrieval.monthFetchDaySpanThreshold",
                String.valueOf(FetchOptions.DEFAULT_MONTH_DAY_SPAN_THRESHOLD)),
                "retrieval.monthFetchDaySpanThreshold");

        Map<Measure, Chunking> modes = new EnumMap<>(Measure.class);
        for (Measure m : Measure.values()) {
            String envKey = "FETCH_MODE_" + m.key().toUpperCase(Locale.ROOT);
            String propKey = "retrieval.fetchMode." + m.key();
            String def = defaultFetchModes().get(m).name().toLowerCase(Locale.ROOT);
            try {
                modes.put(m, Chunking.parse(envOr(p, envKey, propKey, def)));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid config value for " + propKey + ": " + e.getMessage(), e);
            }
        }

        return new AppConfig(dir, schema, memo, wet, overwrite, span, modes);
    }

    /**
     * Fetch options passed to the fetcher for a measure.
     */
    public FetchOptions fetchOptions(Measure measure) {
        return new FetchOptions(fetchModes.get(measure), monthFetchDaySpanThreshold);
    }

    /**
     * Copy with a different overwrite flag.
     */
    public AppConfig withOverwriteExistingCacheValues(boolean overwrite) {
        return new AppConfig(dataCacheDir, schemaRegistry, documentMemo, wetHourThresholdMm, overwrite,
                monthFetchDaySpanThreshold, fetchModes);
    }

    // ----------------------------
    // helpers
    // ----------------------------

    private static Map<Measure, Chunking> defaultFetchModes() {
        Map<Measure, Chunking> m = new EnumMap<>(Measure.class);
        for (Measure measure : Measure.values())
            m.put(measure, Chunking.MONTHLY);
        m.put(Measure.NOON_TEMPERATURE, Chunking.AUTO);
        return m;
    }

    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    private static String requireNonBlank(String v, String key) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value '" + key + "' (env var, -Dprop, or application.properties).");
        }
        return v.trim();
    }

    private static double parseDouble(String v, String key) {
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + key + ": '" + v + "'", e);
        }
    }

    private static int parseInt(String v, String key) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": '" + v + "'", e);
        }
    }
}
