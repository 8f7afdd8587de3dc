package space.ketterling.climatecache.retrieval;

import space.ketterling.climatecache.model.Observation;
import space.ketterling.climatecache.model.ObservationTable;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily statistics derived from hourly precipitation, grouped by the
 * place's local calendar date.
 */
final class WetHourAggregates {
    static final String WET_HOURS = "wet_hours_per_day";
    static final String MAX_HOURLY = "max_hourly_precip_mm";
    static final String TOTAL = "total_precip_mm";
    static final String OBSERVED_HOURS = "observed_hours";

    static final List<String> COLUMNS = List.of(WET_HOURS, MAX_HOURLY, TOTAL, OBSERVED_HOURS);

    private static final Map<String, Double> ZERO = zero();

    private WetHourAggregates() {
    }

    /**
     * Groups hourly rows (UTC hours) by local date in {@code zone}.
     *
     * @param column value column of the hourly rows
     */
    static Map<LocalDate, Map<String, Double>> byLocalDate(ObservationTable hourly, String column, ZoneId zone,
            double thresholdMm) {
        Map<LocalDate, Stats> acc = new HashMap<>();
        for (Observation o : hourly.rows()) {
            Double v = o.value(column);
            if (v == null || v.isNaN())
                continue;
            LocalDate local = o.time().atOffset(ZoneOffset.UTC).atZoneSameInstant(zone).toLocalDate();
            acc.computeIfAbsent(local, d -> new Stats()).add(v, thresholdMm);
        }
        Map<LocalDate, Map<String, Double>> out = new HashMap<>();
        for (var e : acc.entrySet())
            out.put(e.getKey(), e.getValue().toValues());
        return out;
    }

    /**
     * Left-joins aggregates onto daily rows by (place, date). Rows without a
     * match get zeros.
     *
     * @param byPlace aggregates per place name, then local date
     */
    static ObservationTable join(ObservationTable daily, Map<String, Map<LocalDate, Map<String, Double>>> byPlace) {
        List<Observation> rows = new ArrayList<>(daily.size());
        for (Observation o : daily.rows()) {
            Map<String, Double> agg = byPlace.getOrDefault(o.placeName(), Map.of()).getOrDefault(o.date(), ZERO);
            rows.add(o.withValues(agg));
        }
        List<String> cols = new ArrayList<>(daily.columns());
        for (String c : COLUMNS) {
            if (!cols.contains(c))
                cols.add(c);
        }
        return new ObservationTable(cols, rows);
    }

    private static Map<String, Double> zero() {
        Map<String, Double> m = new LinkedHashMap<>();
        for (String c : COLUMNS)
            m.put(c, 0.0);
        return m;
    }

    private static final class Stats {
        private int wet;
        private int observed;
        private double max = Double.NEGATIVE_INFINITY;
        private double total;

        void add(double v, double threshold) {
            observed++;
            total += v;
            if (v > max)
                max = v;
            if (v >= threshold)
                wet++;
        }

        Map<String, Double> toValues() {
            Map<String, Double> m = new LinkedHashMap<>();
            m.put(WET_HOURS, (double) wet);
            m.put(MAX_HOURLY, observed == 0 ? 0.0 : max);
            m.put(TOTAL, total);
            m.put(OBSERVED_HOURS, (double) observed);
            return m;
        }
    }
}
