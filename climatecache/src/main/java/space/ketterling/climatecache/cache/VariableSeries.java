package space.ketterling.climatecache.cache;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Values of one cache variable, keyed Year→Month→Day[→Hour].
 *
 * <p>
 * A series is either daily or hourly; mixing the two is rejected. Keys are
 * always integers and kept in ascending order.
 * </p>
 */
public final class VariableSeries {
    private final boolean hourly;
    private final NavigableMap<SeriesKey, Double> values = new TreeMap<>();

    public VariableSeries(boolean hourly) {
        this.hourly = hourly;
    }

    public boolean hourly() {
        return hourly;
    }

    /**
     * Stores a value, replacing any previous one.
     */
    public void put(SeriesKey key, double value) {
        checkKind(key);
        values.put(key, value);
    }

    /**
     * Stores a value only when nothing is cached at the key yet.
     *
     * @return true when the value was written
     */
    public boolean putIfAbsent(SeriesKey key, double value) {
        checkKind(key);
        return values.putIfAbsent(key, value) == null;
    }

    public Double get(SeriesKey key) {
        return values.get(key);
    }

    public boolean contains(SeriesKey key) {
        return values.containsKey(key);
    }

    public NavigableMap<SeriesKey, Double> values() {
        return Collections.unmodifiableNavigableMap(values);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public SortedSet<Integer> years() {
        SortedSet<Integer> out = new TreeSet<>();
        for (SeriesKey k : values.keySet())
            out.add(k.year());
        return out;
    }

    public VariableSeries copy() {
        VariableSeries c = new VariableSeries(hourly);
        c.values.putAll(values);
        return c;
    }

    /**
     * Groups values for writing: year → month → entries of that month.
     */
    NavigableMap<Integer, NavigableMap<Integer, NavigableMap<SeriesKey, Double>>> byYearAndMonth() {
        NavigableMap<Integer, NavigableMap<Integer, NavigableMap<SeriesKey, Double>>> out = new TreeMap<>();
        for (Map.Entry<SeriesKey, Double> e : values.entrySet()) {
            SeriesKey k = e.getKey();
            out.computeIfAbsent(k.year(), y -> new TreeMap<>())
                    .computeIfAbsent(k.month(), m -> new TreeMap<>())
                    .put(k, e.getValue());
        }
        return out;
    }

    private void checkKind(SeriesKey key) {
        if (key.hasHour() != hourly) {
            throw new IllegalArgumentException((hourly ? "Hourly" : "Daily") + " series cannot hold key " + key);
        }
    }

    @Override
    public String toString() {
        return "VariableSeries{hourly=" + hourly + ", values=" + values.size() + "}";
    }
}
