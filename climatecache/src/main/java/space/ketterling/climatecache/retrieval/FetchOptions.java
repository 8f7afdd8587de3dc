package space.ketterling.climatecache.retrieval;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * How a {@link Fetcher} should split a request into source calls.
 *
 * @param chunking            requested split
 * @param monthDaySpanThreshold largest span, in days, that {@link Chunking#AUTO}
 *                            still fetches month by month
 */
public record FetchOptions(Chunking chunking, int monthDaySpanThreshold) {

    public static final int DEFAULT_MONTH_DAY_SPAN_THRESHOLD = 62;

    public enum Chunking {
        MONTHLY,
        YEARLY,
        AUTO;

        /**
         * Parses "monthly", "yearly" or "auto", ignoring case.
         *
         * @throws IllegalArgumentException for anything else
         */
        public static Chunking parse(String s) {
            if (s == null || s.isBlank())
                throw new IllegalArgumentException("Fetch mode must not be blank");
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Unsupported fetch mode '" + s + "'. Allowed: auto, monthly, yearly", e);
            }
        }
    }

    public FetchOptions {
        if (chunking == null)
            chunking = Chunking.AUTO;
        if (monthDaySpanThreshold < 0)
            throw new IllegalArgumentException("monthDaySpanThreshold must be >= 0");
    }

    public static FetchOptions of(Chunking chunking) {
        return new FetchOptions(chunking, DEFAULT_MONTH_DAY_SPAN_THRESHOLD);
    }

    /**
     * The concrete split for a date span: AUTO becomes MONTHLY when the span
     * (both ends inclusive) is at most the threshold, YEARLY otherwise.
     */
    public Chunking resolve(LocalDate start, LocalDate end) {
        if (chunking != Chunking.AUTO)
            return chunking;
        long days = ChronoUnit.DAYS.between(start, end) + 1;
        return days <= monthDaySpanThreshold ? Chunking.MONTHLY : Chunking.YEARLY;
    }
}
