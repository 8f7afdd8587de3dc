package space.ketterling.climatecache.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compact year-range tokens used by the summary index: "2020" for a single
 * year, "2020-2022" for an inclusive run.
 */
public final class YearRanges {

    private YearRanges() {
    }

    /**
     * Collapses years into sorted, de-duplicated range tokens.
     */
    public static List<String> compress(Collection<Integer> years) {
        List<String> out = new ArrayList<>();
        if (years == null || years.isEmpty())
            return out;
        Integer start = null;
        Integer prev = null;
        for (int y : new TreeSet<>(years)) {
            if (start == null) {
                start = y;
            } else if (y != prev + 1) {
                out.add(token(start, prev));
                start = y;
            }
            prev = y;
        }
        out.add(token(start, prev));
        return out;
    }

    /**
     * Expands tokens back into years. Plain integers are accepted too, which
     * is how older index files listed years.
     *
     * @throws IllegalArgumentException on a token that is not a year or range
     */
    public static SortedSet<Integer> expand(Collection<?> tokens) {
        SortedSet<Integer> out = new TreeSet<>();
        if (tokens == null)
            return out;
        for (Object t : tokens)
            addToken(out, t);
        return out;
    }

    /**
     * Expands a JSON array of tokens or integers.
     */
    public static SortedSet<Integer> expand(JsonNode tokens) {
        SortedSet<Integer> out = new TreeSet<>();
        if (tokens == null || !tokens.isArray())
            return out;
        for (JsonNode t : tokens)
            addToken(out, t.isIntegralNumber() ? (Object) t.asInt() : t.asText());
        return out;
    }

    /**
     * Human-readable form, for example "1990-1995, 2000".
     */
    public static String condense(Collection<Integer> years) {
        return String.join(", ", compress(years));
    }

    private static void addToken(SortedSet<Integer> out, Object t) {
        if (t instanceof Number n) {
            out.add(n.intValue());
            return;
        }
        String s = String.valueOf(t).trim();
        int dash = s.indexOf('-', 1);
        try {
            if (dash < 0) {
                out.add(Integer.parseInt(s));
                return;
            }
            int a = Integer.parseInt(s.substring(0, dash).trim());
            int b = Integer.parseInt(s.substring(dash + 1).trim());
            if (b < a)
                throw new IllegalArgumentException("Invalid year range token '" + s + "'");
            for (int y = a; y <= b; y++)
                out.add(y);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid year range token '" + s + "'", e);
        }
    }

    private static String token(int start, int end) {
        return start == end ? Integer.toString(start) : start + "-" + end;
    }
}
