package space.ketterling.climatecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import space.ketterling.climatecache.TestCaches;
import space.ketterling.climatecache.measure.Measure;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class CacheSummaryIndexTest {

    @TempDir
    Path dir;

    private final ObjectMapper om = new ObjectMapper();
    private final CacheCodec codec = TestCaches.codec();
    private final Clock clock = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private CacheSummaryIndex index() {
        return new CacheSummaryIndex(dir, om, codec, TestCaches.MEASURES, clock);
    }

    private static CacheDocument doc(String name, String variable, int... years) {
        CacheDocument d = new CacheDocument(2, new Place(name, 1.0, 2.0, "UTC", null, null));
        VariableSeries s = new VariableSeries(false);
        for (int y : years)
            s.put(SeriesKey.daily(LocalDate.of(y, 6, 1)), 1.0);
        d.putSeries(variable, s);
        return d;
    }

    @Test
    void countryFromPlaceSuffix() {
        assertEquals("USA", CacheSummaryIndex.countryFor("Austin, TX"));
        assertEquals("USA", CacheSummaryIndex.countryFor("Washington, DC"));
        assertEquals("France", CacheSummaryIndex.countryFor("Paris, France"));
        assertEquals("UK", CacheSummaryIndex.countryFor("Leeds, UK"));
        assertEquals("", CacheSummaryIndex.countryFor("Testville"));
    }

    @Test
    void upsertWritesCompactRanges() throws Exception {
        CacheSummaryIndex idx = index();
        idx.upsert("Austin_TX.yaml", doc("Austin, TX", "noon_temp_C", 2020, 2021, 2022, 2024));

        JsonNode root = om.readTree(dir.resolve(CacheSummaryIndex.FILE_NAME).toFile());
        assertEquals(1, root.get("summary_version").asInt());
        assertEquals("2025-06-01T12:00:00Z", root.get("updated_at").asText());
        JsonNode entry = root.get("files").get("Austin_TX.yaml");
        assertEquals("Austin, TX", entry.get("place_name").asText());
        assertEquals("USA", entry.get("country").asText());
        JsonNode ranges = entry.get("measures").get("noon_temperature").get("year_ranges");
        assertEquals(List.of("2020-2022", "2024"), om.convertValue(ranges, List.class));
        assertFalse(entry.get("measures").has("daily_precipitation"));

        assertEquals(Optional.of(new TreeSet<>(Set.of(2020, 2021, 2022, 2024))),
                index().cachedYears("Austin_TX.yaml", Measure.NOON_TEMPERATURE));
    }

    @Test
    void indexedFileWithoutMeasureHasNoYears() throws Exception {
        CacheSummaryIndex idx = index();
        idx.upsert("A.yaml", doc("A", "noon_temp_C", 2020));

        Optional<SortedSet<Integer>> years = idx.cachedYears("A.yaml", Measure.DAILY_PRECIPITATION);
        assertTrue(years.isPresent());
        assertTrue(years.get().isEmpty());
        assertTrue(idx.cachedYears("B.yaml", Measure.NOON_TEMPERATURE).isEmpty());
    }

    @Test
    void missingIndexIsRebuiltFromDocumentsSkippingBadFiles() throws Exception {
        codec.write(doc("A", "noon_temp_C", 2001, 2002), dir.resolve("A.yaml"));
        codec.write(doc("B", "daily_precip_mm", 1999), dir.resolve("B.yaml"));
        Files.writeString(dir.resolve("Broken.yaml"), "schema_version: [\n");
        TestCaches.copyFixture("newer_v3.yaml", dir.resolve("Future.yaml"));

        CacheSummaryIndex idx = index();
        assertEquals(Optional.of(new TreeSet<>(Set.of(2001, 2002))),
                idx.cachedYears("A.yaml", Measure.NOON_TEMPERATURE));
        assertEquals(Optional.of(new TreeSet<>(Set.of(1999))),
                idx.cachedYears("B.yaml", Measure.DAILY_PRECIPITATION));
        assertTrue(idx.cachedYears("Broken.yaml", Measure.NOON_TEMPERATURE).isEmpty());
        assertTrue(idx.cachedYears("Future.yaml", Measure.NOON_TEMPERATURE).isEmpty());
        assertTrue(Files.exists(idx.file()));
    }

    @Test
    void existingIndexIsTrustedWithoutScanning() throws Exception {
        CacheSummaryIndex first = index();
        first.upsert("A.yaml", doc("A", "noon_temp_C", 2001));
        // a document the index does not know about
        codec.write(doc("C", "noon_temp_C", 1980), dir.resolve("C.yaml"));

        CacheSummaryIndex second = index();
        assertTrue(second.cachedYears("C.yaml", Measure.NOON_TEMPERATURE).isEmpty());

        second.load(true);
        assertEquals(Optional.of(new TreeSet<>(Set.of(1980))),
                second.cachedYears("C.yaml", Measure.NOON_TEMPERATURE));
    }

    @Test
    void indexesSharingADirectorySeeEachOthersEntries() throws Exception {
        CacheSummaryIndex first = index();
        CacheSummaryIndex second = index();
        second.upsert("B.yaml", doc("B", "noon_temp_C", 1999));
        first.upsert("A.yaml", doc("A", "noon_temp_C", 2001));

        assertEquals(Optional.of(new TreeSet<>(Set.of(2001))),
                second.cachedYears("A.yaml", Measure.NOON_TEMPERATURE));

        second.upsert("C.yaml", doc("C", "noon_temp_C", 1980));

        JsonNode files = om.readTree(dir.resolve(CacheSummaryIndex.FILE_NAME).toFile()).get("files");
        assertTrue(files.has("A.yaml"));
        assertTrue(files.has("B.yaml"));
        assertTrue(files.has("C.yaml"));
        assertEquals(Optional.of(new TreeSet<>(Set.of(1980))),
                first.cachedYears("C.yaml", Measure.NOON_TEMPERATURE));
    }

    @Test
    void corruptIndexIsRebuilt() throws Exception {
        codec.write(doc("A", "noon_temp_C", 2010), dir.resolve("A.yaml"));
        Files.writeString(dir.resolve(CacheSummaryIndex.FILE_NAME), "{not json");

        assertEquals(Optional.of(new TreeSet<>(Set.of(2010))),
                index().cachedYears("A.yaml", Measure.NOON_TEMPERATURE));
    }

    @Test
    void readsOlderYearListEntries() throws Exception {
        Files.writeString(dir.resolve(CacheSummaryIndex.FILE_NAME), """
                {"summary_version": 1, "updated_at": "2024-01-01T00:00:00Z",
                 "files": {"A.yaml": {"place_name": "A", "country": "",
                   "measures": {"noon_temperature": {"years": [2018, 2019, 2021]}}}}}
                """);

        assertEquals(Optional.of(new TreeSet<>(Set.of(2018, 2019, 2021))),
                index().cachedYears("A.yaml", Measure.NOON_TEMPERATURE));
    }
}
