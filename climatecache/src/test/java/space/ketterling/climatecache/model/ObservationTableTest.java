package space.ketterling.climatecache.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObservationTableTest {

    private static Observation row(String date, String column, double v) {
        return Observation.daily(LocalDate.parse(date), "P", 1.0, 2.0, column, v);
    }

    @Test
    void requireColumnNamesColumnAndMeasure() {
        ObservationTable t = ObservationTable.of(List.of(row("2020-01-01", "temp_C", 1.0)));
        t.requireColumn("temp_C", "noon_temperature");

        MissingColumnException e = assertThrows(MissingColumnException.class,
                () -> t.requireColumn("precip_mm", "daily_precipitation"));
        assertEquals("Missing required column 'precip_mm' for measure 'daily_precipitation'", e.getMessage());
    }

    @Test
    void declaredColumnCountsEvenWhenEmpty() {
        assertTrue(ObservationTable.empty(List.of("precip_mm")).hasColumn("precip_mm"));
        assertFalse(ObservationTable.empty().hasColumn("precip_mm"));
    }

    @Test
    void concatUnionsColumnsAndKeepsOrder() {
        ObservationTable a = ObservationTable.of(List.of(row("2020-01-01", "temp_C", 1.0)));
        ObservationTable b = ObservationTable.of(List.of(row("2020-01-02", "precip_mm", 2.0)));

        ObservationTable both = a.concat(b);
        assertEquals(List.of("temp_C", "precip_mm"), both.columns());
        assertEquals(2, both.size());
        assertEquals(LocalDate.of(2020, 1, 2), both.rows().get(1).date());
    }

    @Test
    void filterKeepsColumns() {
        ObservationTable t = ObservationTable.of(List.of(row("2020-01-01", "temp_C", 1.0),
                row("2021-01-01", "temp_C", 2.0)));
        ObservationTable only2021 = t.filter(o -> o.time().getYear() == 2021);
        assertEquals(1, only2021.size());
        assertEquals(List.of("temp_C"), only2021.columns());
    }

    @Test
    void reversedYearRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> YearRange.of(2021, 2020));
        assertEquals(List.of(2019, 2020), List.copyOf(YearRange.of(2019, 2020).years()));
    }
}
