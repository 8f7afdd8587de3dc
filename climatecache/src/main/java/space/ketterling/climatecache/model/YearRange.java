package space.ketterling.climatecache.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Inclusive range of calendar years.
 */
public record YearRange(int start, int end) {

    public YearRange {
        if (start > end)
            throw new IllegalArgumentException("Year range start " + start + " is after end " + end);
    }

    public static YearRange of(int start, int end) {
        return new YearRange(start, end);
    }

    public static YearRange single(int year) {
        return new YearRange(year, year);
    }

    public boolean contains(int year) {
        return year >= start && year <= end;
    }

    /**
     * Returns every year in the range, ascending.
     */
    public Set<Integer> years() {
        Set<Integer> out = new LinkedHashSet<>();
        for (int y = start; y <= end; y++)
            out.add(y);
        return out;
    }
}
