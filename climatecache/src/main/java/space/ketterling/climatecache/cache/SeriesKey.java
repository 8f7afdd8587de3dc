package space.ketterling.climatecache.cache;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Position of one value inside a cache variable: year, month, day and, for
 * hourly variables, hour ({@link #NO_HOUR} otherwise).
 */
public record SeriesKey(int year, int month, int day, int hour) implements Comparable<SeriesKey> {
    public static final int NO_HOUR = -1;

    private static final Comparator<SeriesKey> ORDER = Comparator.comparingInt(SeriesKey::year)
            .thenComparingInt(SeriesKey::month)
            .thenComparingInt(SeriesKey::day)
            .thenComparingInt(SeriesKey::hour);

    public static SeriesKey daily(LocalDate date) {
        return new SeriesKey(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), NO_HOUR);
    }

    public static SeriesKey hourly(LocalDateTime time) {
        return new SeriesKey(time.getYear(), time.getMonthValue(), time.getDayOfMonth(), time.getHour());
    }

    public boolean hasHour() {
        return hour != NO_HOUR;
    }

    public LocalDateTime toDateTime() {
        return LocalDateTime.of(year, month, day, hasHour() ? hour : 0, 0);
    }

    @Override
    public int compareTo(SeriesKey o) {
        return ORDER.compare(this, o);
    }
}
