package space.ketterling.climatecache.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of an {@link ObservationTable}.
 *
 * <p>
 * {@code time} is midnight of the local date for daily measures and the UTC
 * hour for hourly measures. {@code values} maps value-column name to value.
 * </p>
 */
public record Observation(
        LocalDateTime time,
        String placeName,
        double gridLat,
        double gridLon,
        Map<String, Double> values) {

    public Observation {
        Objects.requireNonNull(time, "time");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Creates a daily row holding a single value column.
     */
    public static Observation daily(LocalDate date, String placeName, double gridLat, double gridLon,
            String column, double value) {
        return new Observation(date.atStartOfDay(), placeName, gridLat, gridLon, Map.of(column, value));
    }

    /**
     * Creates an hourly row; {@code utcHour} is interpreted as UTC.
     */
    public static Observation hourly(LocalDateTime utcHour, String placeName, double gridLat, double gridLon,
            String column, double value) {
        return new Observation(utcHour, placeName, gridLat, gridLon, Map.of(column, value));
    }

    public LocalDate date() {
        return time.toLocalDate();
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    /**
     * Returns the value for a column, or {@code null} when absent.
     */
    public Double value(String column) {
        return values.get(column);
    }

    /**
     * Returns a copy of this row with extra columns merged in.
     */
    public Observation withValues(Map<String, Double> extra) {
        Map<String, Double> merged = new LinkedHashMap<>(values);
        merged.putAll(extra);
        return new Observation(time, placeName, gridLat, gridLon, merged);
    }
}
