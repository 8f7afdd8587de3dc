package space.ketterling.climatecache.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatecache.measure.Measure;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans progress events out to observers. An observer that throws is logged
 * and skipped; retrieval carries on.
 */
final class ProgressDispatcher implements ProgressObserver {
    private static final Logger log = LoggerFactory.getLogger(ProgressDispatcher.class);

    private final List<ProgressObserver> observers;

    ProgressDispatcher(List<ProgressObserver> observers) {
        this.observers = List.copyOf(observers);
    }

    @Override
    public void onRetrievalPlan(RetrievalPlan plan) {
        each("onRetrievalPlan", o -> o.onRetrievalPlan(plan));
    }

    @Override
    public void onPlaceStart(String placeName, int placeNum, int totalPlaces, int totalYears) {
        each("onPlaceStart", o -> o.onPlaceStart(placeName, placeNum, totalPlaces, totalYears));
    }

    @Override
    public void onYearStart(String placeName, int year, int yearNum, int totalYears) {
        each("onYearStart", o -> o.onYearStart(placeName, year, yearNum, totalYears));
    }

    @Override
    public void onYearComplete(String placeName, int year, int yearNum, int totalYears) {
        each("onYearComplete", o -> o.onYearComplete(placeName, year, yearNum, totalYears));
    }

    @Override
    public void onPlaceComplete(String placeName) {
        each("onPlaceComplete", o -> o.onPlaceComplete(placeName));
    }

    @Override
    public void onStage(String placeName, Measure measure, Stage stage) {
        each("onStage", o -> o.onStage(placeName, measure, stage));
    }

    private void each(String event, Consumer<ProgressObserver> call) {
        for (ProgressObserver o : observers) {
            try {
                call.accept(o);
            } catch (RuntimeException e) {
                log.warn("Progress observer {} failed in {}", o.getClass().getName(), event, e);
            }
        }
    }
}
