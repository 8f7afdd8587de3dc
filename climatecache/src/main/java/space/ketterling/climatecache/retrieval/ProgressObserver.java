package space.ketterling.climatecache.retrieval;

import space.ketterling.climatecache.measure.Measure;

/**
 * Receives retrieval progress. Every callback defaults to a no-op.
 */
public interface ProgressObserver {

    enum Stage {
        CACHE_LOAD,
        FETCH
    }

    default void onRetrievalPlan(RetrievalPlan plan) {
    }

    /**
     * @param placeNum    1-based position among places that need fetching
     * @param totalPlaces number of places that need fetching
     * @param totalYears  years to fetch for this place
     */
    default void onPlaceStart(String placeName, int placeNum, int totalPlaces, int totalYears) {
    }

    default void onYearStart(String placeName, int year, int yearNum, int totalYears) {
    }

    default void onYearComplete(String placeName, int year, int yearNum, int totalYears) {
    }

    default void onPlaceComplete(String placeName) {
    }

    default void onStage(String placeName, Measure measure, Stage stage) {
    }
}
