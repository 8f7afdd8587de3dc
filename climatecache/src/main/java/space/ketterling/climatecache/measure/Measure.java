package space.ketterling.climatecache.measure;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logical, user-facing climate quantities.
 */
public enum Measure {
    NOON_TEMPERATURE("noon_temperature"),
    DAILY_PRECIPITATION("daily_precipitation"),
    HOURLY_PRECIPITATION("hourly_precipitation"),
    DAILY_SOLAR_RADIATION_ENERGY("daily_solar_radiation_energy");

    private final String key;

    Measure(String key) {
        this.key = key;
    }

    /**
     * Name used in configuration, the summary index and error messages.
     */
    public String key() {
        return key;
    }

    /**
     * True when values are stored per hour instead of per day.
     */
    public boolean isHourly() {
        return this == HOURLY_PRECIPITATION;
    }

    /**
     * Measures whose cached years must all be present before this one counts
     * as cached. Daily precipitation also needs its hourly companion because
     * the wet-hour aggregates are derived from it.
     */
    public Set<Measure> requiredMeasures() {
        if (this == DAILY_PRECIPITATION)
            return EnumSet.of(DAILY_PRECIPITATION, HOURLY_PRECIPITATION);
        return EnumSet.of(this);
    }

    /**
     * Resolves a measure by key.
     *
     * @throws UnsupportedMeasureException listing the allowed keys
     */
    public static Measure fromKey(String key) {
        if (key != null) {
            String k = key.trim();
            for (Measure m : values()) {
                if (m.key.equals(k))
                    return m;
            }
        }
        throw new UnsupportedMeasureException("Unsupported measure '" + key + "'. Allowed: " + allowedKeys());
    }

    /**
     * Comma-separated, sorted list of every supported key.
     */
    public static String allowedKeys() {
        return Arrays.stream(values()).map(Measure::key).sorted().collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return key;
    }
}
