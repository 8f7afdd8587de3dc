package space.ketterling.climatecache.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Turns a parsed Year→Month→Day[→Hour] mapping into a {@link VariableSeries}
 * with integer keys, whatever form the keys had on disk.
 */
final class ValueMaps {

    private ValueMaps() {
    }

    static VariableSeries toSeries(JsonNode yearMap, String where) {
        if (yearMap == null || yearMap.isNull())
            return new VariableSeries(false);
        if (!yearMap.isObject())
            throw new CacheFormatException(where + " must be a year mapping");

        Boolean hourly = null;
        VariableSeries series = null;
        for (Iterator<Map.Entry<String, JsonNode>> ys = yearMap.fields(); ys.hasNext();) {
            var y = ys.next();
            int year = key(y.getKey(), where);
            if (y.getValue() == null || y.getValue().isNull())
                continue;
            requireObject(y.getValue(), where + "." + year);
            for (Iterator<Map.Entry<String, JsonNode>> ms = y.getValue().fields(); ms.hasNext();) {
                var m = ms.next();
                int month = key(m.getKey(), where + "." + year);
                if (m.getValue() == null || m.getValue().isNull())
                    continue;
                requireObject(m.getValue(), where + "." + year + "." + month);
                for (Iterator<Map.Entry<String, JsonNode>> ds = m.getValue().fields(); ds.hasNext();) {
                    var d = ds.next();
                    int day = key(d.getKey(), where + "." + year + "." + month);
                    JsonNode v = d.getValue();
                    if (v == null || v.isNull())
                        continue;
                    boolean nested = v.isObject();
                    if (hourly == null) {
                        hourly = nested;
                        series = new VariableSeries(nested);
                    } else if (hourly != nested) {
                        throw new CacheFormatException(where + " mixes daily and hourly values");
                    }
                    if (!nested) {
                        series.put(new SeriesKey(year, month, day, SeriesKey.NO_HOUR), number(v, where));
                        continue;
                    }
                    for (Iterator<Map.Entry<String, JsonNode>> hs = v.fields(); hs.hasNext();) {
                        var h = hs.next();
                        if (h.getValue() == null || h.getValue().isNull())
                            continue;
                        int hour = key(h.getKey(), where + "." + year + "." + month + "." + day);
                        series.put(new SeriesKey(year, month, day, hour), number(h.getValue(), where));
                    }
                }
            }
        }
        return series == null ? new VariableSeries(false) : series;
    }

    /**
     * Dot-separated lookup; null when any step is missing or not a mapping.
     */
    static JsonNode getByPath(JsonNode root, String path) {
        JsonNode node = root;
        for (String part : path.split("\\.")) {
            if (node == null || !node.isObject() || !node.has(part))
                return null;
            node = node.get(part);
        }
        return node;
    }

    static boolean hasPath(JsonNode root, String path) {
        return getByPath(root, path) != null;
    }

    private static int key(String raw, String where) {
        String k = raw.trim();
        try {
            return Integer.parseInt(k);
        } catch (NumberFormatException e) {
            try {
                double d = Double.parseDouble(k);
                if (d == Math.rint(d))
                    return (int) d;
            } catch (NumberFormatException ignored) {
                // reported below
            }
            throw new CacheFormatException("Non-integer key '" + raw + "' in " + where);
        }
    }

    private static double number(JsonNode v, String where) {
        if (v.isNumber())
            return v.asDouble();
        try {
            return Double.parseDouble(v.asText().trim());
        } catch (NumberFormatException e) {
            throw new CacheFormatException("Non-numeric value '" + v.asText() + "' in " + where);
        }
    }

    private static void requireObject(JsonNode node, String where) {
        if (!node.isObject())
            throw new CacheFormatException(where + " must be a mapping");
    }
}
