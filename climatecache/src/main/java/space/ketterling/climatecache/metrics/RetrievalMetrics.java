package space.ketterling.climatecache.metrics;

import space.ketterling.climatecache.measure.Measure;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts what retrieval runs did per measure: years served from the cache,
 * years fetched, failed fetches and places that failed outright.
 */
public final class RetrievalMetrics {
    private final Map<Measure, Counters> counters = new ConcurrentHashMap<>();

    public void recordCachedYears(Measure measure, int years) {
        if (years > 0)
            counters(measure).yearsFromCache.addAndGet(years);
    }

    public void recordFetchedYear(Measure measure) {
        counters(measure).yearsFetched.incrementAndGet();
    }

    public void recordFetchFailure(Measure measure) {
        counters(measure).fetchFailures.incrementAndGet();
    }

    public void recordFailedPlace(Measure measure) {
        counters(measure).failedPlaces.incrementAndGet();
    }

    /**
     * Returns a snapshot of the counters by measure; measures never seen are
     * omitted.
     */
    public Map<Measure, MeasureSnapshot> snapshot() {
        Map<Measure, MeasureSnapshot> out = new EnumMap<>(Measure.class);
        for (var e : counters.entrySet())
            out.put(e.getKey(), e.getValue().snapshot());
        return out;
    }

    public void reset() {
        counters.clear();
    }

    /**
     * Counter values for one measure at snapshot time.
     */
    public record MeasureSnapshot(long yearsFromCache, long yearsFetched, long fetchFailures, long failedPlaces) {

        /**
         * Share of requested years answered from the cache, 0-100.
         */
        public double cacheHitPct() {
            long total = yearsFromCache + yearsFetched;
            return total == 0 ? 0.0 : (yearsFromCache * 100.0) / total;
        }
    }

    private Counters counters(Measure measure) {
        return counters.computeIfAbsent(measure, k -> new Counters());
    }

    private static final class Counters {
        private final AtomicLong yearsFromCache = new AtomicLong();
        private final AtomicLong yearsFetched = new AtomicLong();
        private final AtomicLong fetchFailures = new AtomicLong();
        private final AtomicLong failedPlaces = new AtomicLong();

        private MeasureSnapshot snapshot() {
            return new MeasureSnapshot(yearsFromCache.get(), yearsFetched.get(), fetchFailures.get(),
                    failedPlaces.get());
        }
    }
}
