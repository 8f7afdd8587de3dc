package space.ketterling.climatecache.retrieval;

import org.junit.jupiter.api.Test;
import space.ketterling.climatecache.retrieval.FetchOptions.Chunking;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FetchOptionsTest {

    @Test
    void parsesModesIgnoringCase() {
        assertEquals(Chunking.AUTO, Chunking.parse("auto"));
        assertEquals(Chunking.MONTHLY, Chunking.parse(" Monthly "));
        assertEquals(Chunking.YEARLY, Chunking.parse("YEARLY"));
    }

    @Test
    void rejectsUnknownMode() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Chunking.parse("weekly"));
        assertTrue(e.getMessage().contains("Unsupported fetch mode"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Chunking.parse(" "));
    }

    @Test
    void autoPicksMonthlyForShortSpans() {
        FetchOptions auto = FetchOptions.of(Chunking.AUTO);
        // 62 days inclusive
        assertEquals(Chunking.MONTHLY, auto.resolve(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 2)));
        assertEquals(Chunking.YEARLY, auto.resolve(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 3)));
        assertEquals(Chunking.YEARLY, auto.resolve(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)));
    }

    @Test
    void explicitModesAreNotResolved() {
        FetchOptions monthly = FetchOptions.of(Chunking.MONTHLY);
        assertEquals(Chunking.MONTHLY, monthly.resolve(LocalDate.of(2020, 1, 1), LocalDate.of(2024, 12, 31)));
        FetchOptions yearly = new FetchOptions(Chunking.YEARLY, 400);
        assertEquals(Chunking.YEARLY, yearly.resolve(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)));
    }

    @Test
    void missingModeMeansAuto() {
        assertEquals(Chunking.AUTO, new FetchOptions(null, 10).chunking());
        assertThrows(IllegalArgumentException.class, () -> new FetchOptions(Chunking.AUTO, -1));
    }
}
