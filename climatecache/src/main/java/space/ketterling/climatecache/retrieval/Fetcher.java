package space.ketterling.climatecache.retrieval;

import space.ketterling.climatecache.measure.Measure;
import space.ketterling.climatecache.model.Location;
import space.ketterling.climatecache.model.ObservationTable;

/**
 * Source of observations the cache is filled from.
 *
 * <p>
 * Returned rows carry the measure's value column, one row per day (per UTC
 * hour for hourly measures) with the place name and grid coordinates set.
 * Implementations own their own timeouts and retries.
 * </p>
 */
@FunctionalInterface
public interface Fetcher {

    /**
     * Fetches every observation for the inclusive year span.
     */
    ObservationTable fetch(Location location, Measure measure, int startYear, int endYear, FetchOptions options)
            throws Exception;
}
