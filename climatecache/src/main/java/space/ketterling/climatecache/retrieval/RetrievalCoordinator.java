package space.ketterling.climatecache.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.climatecache.cache.CacheStore;
import space.ketterling.climatecache.cache.YearRanges;
import space.ketterling.climatecache.config.AppConfig;
import space.ketterling.climatecache.measure.Measure;
import space.ketterling.climatecache.metrics.RetrievalMetrics;
import space.ketterling.climatecache.model.Location;
import space.ketterling.climatecache.model.Observation;
import space.ketterling.climatecache.model.ObservationTable;
import space.ketterling.climatecache.model.YearRange;
import space.ketterling.climatecache.retrieval.ProgressObserver.Stage;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Serves requests for (places, years, measure) from the cache, fetching
 * only the years that are not cached yet and writing them back.
 *
 * <p>
 * Places and years are processed one at a time in request order. A place
 * that fails is logged and skipped; rows already gathered for it are kept.
 * </p>
 */
public final class RetrievalCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RetrievalCoordinator.class);

    private final AppConfig cfg;
    private final CacheStore store;
    private final Fetcher fetcher;
    private final ProgressObserver progress;
    private final RetrievalMetrics metrics;

    public RetrievalCoordinator(AppConfig cfg, CacheStore store, Fetcher fetcher, List<ProgressObserver> observers,
            RetrievalMetrics metrics) {
        this.cfg = cfg;
        this.store = store;
        this.fetcher = fetcher;
        this.progress = new ProgressDispatcher(observers);
        this.metrics = metrics;
    }

    public RetrievalCoordinator(AppConfig cfg, CacheStore store, Fetcher fetcher) {
        this(cfg, store, fetcher, List.of(), new RetrievalMetrics());
    }

    public RetrievalMetrics metrics() {
        return metrics;
    }

    /**
     * Returns one table with the measure's rows for every place and year in
     * the inclusive range. Daily precipitation rows also carry the wet-hour
     * aggregates.
     */
    public ObservationTable retrieve(List<Location> places, int startYear, int endYear, Measure measure) {
        YearRange range = YearRange.of(startYear, endYear);

        List<PlaceStatus> statuses = new ArrayList<>();
        List<String> needingFetch = new ArrayList<>();
        for (Location loc : places) {
            PlaceStatus s = status(loc, range, measure);
            statuses.add(s);
            if (!s.missing().isEmpty())
                needingFetch.add(loc.name());
        }
        RetrievalPlan plan = new RetrievalPlan(needingFetch, places.size());
        log.info("Retrieval plan for {} {}:\n{}", measure, range, plan.summary());
        progress.onRetrievalPlan(plan);

        List<ObservationTable> parts = new ArrayList<>();
        int placeNum = 0;
        for (PlaceStatus s : statuses) {
            if (!s.missing().isEmpty())
                placeNum++;
            MDC.put("place", s.location().name());
            try {
                retrievePlace(s, range, measure, placeNum, needingFetch.size(), parts);
            } catch (Exception e) {
                metrics.recordFailedPlace(measure);
                log.warn("Retrieval failed for {} ({}); continuing with remaining places", s.location().name(),
                        measure, e);
            } finally {
                MDC.remove("place");
            }
        }

        ObservationTable result = ObservationTable.empty();
        for (ObservationTable t : parts)
            result = result.concat(t);

        if (measure == Measure.DAILY_PRECIPITATION)
            result = withWetHourAggregates(result, places, range);
        return result;
    }

    /**
     * Cached and missing years for one place. A year counts as cached only
     * when every measure the request depends on holds it.
     */
    PlaceStatus status(Location loc, YearRange range, Measure measure) {
        Path file = store.pathForPlace(loc.name());
        Map<Measure, SortedSet<Integer>> cached = new EnumMap<>(Measure.class);
        SortedSet<Integer> covered = null;
        for (Measure m : measure.requiredMeasures()) {
            SortedSet<Integer> years = store.getCachedYears(file, m);
            cached.put(m, years);
            if (covered == null)
                covered = new TreeSet<>(years);
            else
                covered.retainAll(years);
        }
        covered.retainAll(range.years());

        SortedSet<Integer> missing = new TreeSet<>(range.years());
        if (!cfg.overwriteExistingCacheValues())
            missing.removeAll(covered);
        else
            covered.clear();
        return new PlaceStatus(loc, file, cached, covered, missing);
    }

    private void retrievePlace(PlaceStatus s, YearRange range, Measure measure, int placeNum, int totalPlaces,
            List<ObservationTable> parts) throws Exception {
        String name = s.location().name();

        if (!s.covered().isEmpty()) {
            progress.onStage(name, measure, Stage.CACHE_LOAD);
            log.info("Loading {} from cache for {} (years: {})", name, measure, YearRanges.condense(s.covered()));
            Set<Integer> covered = s.covered();
            parts.add(store.readRows(s.file(), measure, range).filter(o -> covered.contains(o.time().getYear())));
            metrics.recordCachedYears(measure, covered.size());
        }

        if (s.missing().isEmpty())
            return;

        List<Integer> missing = new ArrayList<>(s.missing());
        log.info("Fetching {} for {} year(s): {}", name, missing.size(), YearRanges.condense(missing));
        progress.onPlaceStart(name, placeNum, totalPlaces, missing.size());
        progress.onStage(name, measure, Stage.FETCH);

        for (int i = 0; i < missing.size(); i++) {
            int year = missing.get(i);
            progress.onYearStart(name, year, i + 1, missing.size());
            log.debug("Retrieving {} {} for {}", measure, year, name);

            ObservationTable rows = null;
            for (Measure m : fetchOrder(measure)) {
                if (!cfg.overwriteExistingCacheValues() && s.cached().get(m).contains(year))
                    continue;
                ObservationTable fetched = fetchYear(s.location(), m, year);
                store.writeRows(s.file(), s.location(), m, fetched, true, cfg.overwriteExistingCacheValues());
                if (m == measure)
                    rows = fetched;
            }
            if (rows == null) {
                // only companions were fetched; the requested values were already cached
                rows = store.readRows(s.file(), measure, YearRange.single(year));
                metrics.recordCachedYears(measure, 1);
            } else {
                if (measure == Measure.NOON_TEMPERATURE)
                    rows = withFahrenheit(rows, store.measures().valueColumn(measure));
                metrics.recordFetchedYear(measure);
            }
            parts.add(rows);

            progress.onYearComplete(name, year, i + 1, missing.size());
        }
        progress.onPlaceComplete(name);
    }

    private ObservationTable fetchYear(Location loc, Measure m, int year) throws Exception {
        try {
            ObservationTable t = fetcher.fetch(loc, m, year, year, cfg.fetchOptions(m));
            return t == null ? ObservationTable.empty(List.of(store.measures().valueColumn(m))) : t;
        } catch (Exception e) {
            metrics.recordFetchFailure(m);
            throw e;
        }
    }

    /**
     * The requested measure first, then its companions.
     */
    private static List<Measure> fetchOrder(Measure measure) {
        List<Measure> order = new ArrayList<>();
        order.add(measure);
        for (Measure m : measure.requiredMeasures()) {
            if (m != measure)
                order.add(m);
        }
        return order;
    }

    private static ObservationTable withFahrenheit(ObservationTable rows, String celsiusColumn) {
        if (rows.hasColumn(CacheStore.TEMP_F_COLUMN))
            return rows;
        List<Observation> out = new ArrayList<>(rows.size());
        for (Observation o : rows.rows()) {
            Double c = o.value(celsiusColumn);
            out.add(c == null ? o : o.withValues(Map.of(CacheStore.TEMP_F_COLUMN, c * 9.0 / 5.0 + 32.0)));
        }
        List<String> cols = new ArrayList<>(rows.columns());
        cols.add(CacheStore.TEMP_F_COLUMN);
        return new ObservationTable(cols, out);
    }

    /**
     * Adds wet-hour statistics from each place's cached hourly values. A
     * place whose hourly values cannot be read gets zeros.
     */
    private ObservationTable withWetHourAggregates(ObservationTable daily, List<Location> places, YearRange range) {
        String column = store.measures().valueColumn(Measure.HOURLY_PRECIPITATION);
        // local dates near Jan 1 / Dec 31 can fall in the neighbouring UTC year
        YearRange padded = YearRange.of(range.start() - 1, range.end() + 1);

        Map<String, Map<LocalDate, Map<String, Double>>> byPlace = new HashMap<>();
        for (Location loc : places) {
            MDC.put("place", loc.name());
            try {
                Path file = store.pathForPlace(loc.name());
                ObservationTable hourly = store.readRows(file, Measure.HOURLY_PRECIPITATION, padded);
                byPlace.put(loc.name(), WetHourAggregates.byLocalDate(hourly, column, ZoneId.of(loc.timezone()),
                        cfg.wetHourThresholdMm()));
            } catch (Exception e) {
                log.warn("No hourly precipitation for {}; wet-hour columns default to zero ({})", loc.name(),
                        e.getMessage());
            } finally {
                MDC.remove("place");
            }
        }
        return WetHourAggregates.join(daily, byPlace);
    }

    record PlaceStatus(
            Location location,
            Path file,
            Map<Measure, SortedSet<Integer>> cached,
            SortedSet<Integer> covered,
            SortedSet<Integer> missing) {
    }
}
