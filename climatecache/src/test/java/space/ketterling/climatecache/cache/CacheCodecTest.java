package space.ketterling.climatecache.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import space.ketterling.climatecache.TestCaches;
import space.ketterling.climatecache.measure.Measure;
import space.ketterling.climatecache.schema.MigrationException;
import space.ketterling.climatecache.schema.UnsupportedSchemaVersionException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CacheCodecTest {

    @TempDir
    Path dir;

    private final CacheCodec codec = TestCaches.codec();

    private static CacheDocument sampleDocument() {
        CacheDocument doc = new CacheDocument(2,
                new Place("Testville", 40.0, -105.0, "America/Denver", 40.0, -105.0));
        doc.putMetadata("noon_temp_C", TestCaches.MEASURES.metadata(Measure.NOON_TEMPERATURE));
        VariableSeries s = new VariableSeries(false);
        s.put(SeriesKey.daily(LocalDate.of(2020, 1, 2)), 13.0);
        s.put(SeriesKey.daily(LocalDate.of(2020, 1, 1)), 12.5);
        s.put(SeriesKey.daily(LocalDate.of(2019, 12, 31)), -0.25);
        doc.putSeries("noon_temp_C", s);
        return doc;
    }

    @Test
    void rendersDeterministicLayout() {
        String expected = """
                schema_version: 2
                place:
                  name: Testville
                  lat: 40.0
                  lon: -105.0
                  timezone: America/Denver
                  grid_lat: 40.0
                  grid_lon: -105.0
                variables:
                  noon_temp_C:
                    units: C
                    source_variable: 2m_temperature
                    source_dataset: reanalysis-era5-single-levels
                    temporal_definition: daily_local_noon
                    precision: 2
                data:
                  noon_temp_C:
                    2019:
                      12: {31: -0.25}
                    2020:
                      1: {1: 12.5, 2: 13.0}
                """;
        assertEquals(expected, codec.render(sampleDocument()));
    }

    @Test
    void rendersHourlyDaysAsNestedFlowMaps() {
        CacheDocument doc = new CacheDocument(2, new Place("Testville", 40.0, -105.0, "UTC", null, null));
        VariableSeries s = new VariableSeries(true);
        s.put(SeriesKey.hourly(LocalDateTime.of(2024, 3, 1, 0, 0)), 0.1);
        s.put(SeriesKey.hourly(LocalDateTime.of(2024, 3, 1, 1, 0)), 0.0);
        s.put(SeriesKey.hourly(LocalDateTime.of(2024, 3, 2, 23, 0)), 1.25);
        doc.putSeries("hourly_precip_mm", s);

        String text = codec.render(doc);
        assertTrue(text.contains("      3: {1: {0: 0.1, 1: 0.0}, 2: {23: 1.25}}\n"), text);
        assertTrue(text.contains("variables: {}\n"), text);
        assertTrue(text.contains("  grid_lat: null\n"), text);
    }

    @Test
    void writtenDocumentReadsBack() throws Exception {
        Path f = dir.resolve("Testville.yaml");
        codec.write(sampleDocument(), f);

        CacheDocument back = codec.read(f);
        assertEquals("Testville", back.place().name());
        assertEquals(40.0, back.place().gridLat());
        assertEquals(Set.of(2019, 2020), back.years("noon_temp_C"));
        assertEquals(12.5, back.series("noon_temp_C").orElseThrow().get(SeriesKey.daily(LocalDate.of(2020, 1, 1))));
        assertEquals(2, back.variables().get("noon_temp_C").precision());
        assertEquals(codec.render(sampleDocument()), Files.readString(f));
    }

    @Test
    void quotesStringsYamlWouldRetype() {
        assertEquals("Austin, TX", CacheCodec.scalar("Austin, TX"));
        assertEquals("\"yes\"", CacheCodec.scalar("yes"));
        assertEquals("\"2020\"", CacheCodec.scalar("2020"));
        assertEquals("\"a: b\"", CacheCodec.scalar("a: b"));
        assertEquals("\"-x\"", CacheCodec.scalar("-x"));
        assertEquals("\" padded\"", CacheCodec.scalar(" padded"));
    }

    @Test
    void numbersNeverUseExponents() {
        assertEquals("0.0001", CacheCodec.number(1e-4));
        assertEquals("12345678.0", CacheCodec.number(12345678.0));
        assertEquals("0.0", CacheCodec.number(-0.0));
    }

    @Test
    void nonFiniteNumbersAreWrittenAsNull() {
        assertEquals("null", CacheCodec.number(Double.NaN));
        assertEquals("null", CacheCodec.number(Double.POSITIVE_INFINITY));
        assertEquals("null", CacheCodec.number(Double.NEGATIVE_INFINITY));
    }

    @Test
    void placeWithNonFiniteCoordinatesStaysReadable() throws Exception {
        CacheDocument doc = new CacheDocument(2, new Place("Drift", Double.NaN, 2.0, "UTC", Double.NaN, null));
        Path f = dir.resolve("Drift.yaml");
        codec.write(doc, f);

        Place back = codec.read(f).place();
        assertEquals("Drift", back.name());
        assertNull(back.lat());
        assertEquals(2.0, back.lon());
        assertNull(back.gridLat());
    }

    @Test
    void placeNameWithSpecialCharactersSurvivesRoundTrip() throws Exception {
        CacheDocument doc = new CacheDocument(2, new Place("No: 1 #town", 1.0, 2.0, "UTC", null, null));
        Path f = dir.resolve("odd.yaml");
        codec.write(doc, f);
        assertEquals("No: 1 #town", codec.read(f).place().name());
    }

    @Test
    void newerSchemaIsRejectedAndFileUntouched() throws Exception {
        Path f = TestCaches.copyFixture("newer_v3.yaml", dir.resolve("Future_City.yaml"));
        byte[] before = Files.readAllBytes(f);

        UnsupportedSchemaVersionException e = assertThrows(UnsupportedSchemaVersionException.class,
                () -> codec.read(f));
        assertTrue(e.getMessage().contains("newer schema_version 3"), e.getMessage());
        assertArrayEquals(before, Files.readAllBytes(f));
    }

    @Test
    void unversionedDocumentIsRejectedAndFileUntouched() throws Exception {
        Path f = TestCaches.copyFixture("unversioned.yaml", dir.resolve("Nowhere.yaml"));
        byte[] before = Files.readAllBytes(f);

        assertThrows(UnsupportedSchemaVersionException.class, () -> codec.read(f));
        assertThrows(UnsupportedSchemaVersionException.class, () -> codec.migrateFile(f));
        assertArrayEquals(before, Files.readAllBytes(f));
    }

    @Test
    void nonNumericVersionIsRejected() throws Exception {
        Path f = dir.resolve("bad.yaml");
        Files.writeString(f, "schema_version: two\nplace: {name: X}\nvariables: {}\ndata: {}\n");
        UnsupportedSchemaVersionException e = assertThrows(UnsupportedSchemaVersionException.class,
                () -> codec.read(f));
        assertTrue(e.getMessage().contains("Invalid schema_version value"), e.getMessage());
    }

    @Test
    void legacyDocumentIsMigratedAndPersisted() throws Exception {
        Path f = TestCaches.copyFixture("legacy_v1.yaml", dir.resolve("Old_Town.yaml"));

        CacheDocument doc = codec.read(f);

        assertEquals(2, doc.schemaVersion());
        assertEquals(Set.of("noon_temp_C"), doc.variables().keySet());
        assertEquals(Set.of("noon_temp_C"), doc.data().keySet());
        assertEquals(Set.of(2019, 2020), doc.years("noon_temp_C"));
        assertEquals(6.25, doc.series("noon_temp_C").orElseThrow().get(SeriesKey.daily(LocalDate.of(2019, 1, 2))));
        assertEquals("daily_local_noon", doc.variables().get("noon_temp_C").temporalDefinition());

        String persisted = Files.readString(f);
        assertTrue(persisted.startsWith("schema_version: 2\n"), persisted);
        assertFalse(persisted.contains("noon_temps"), persisted);
        assertFalse(codec.migrateFile(f));
    }

    @Test
    void legacyCandidatePathIsFollowed() throws Exception {
        Path f = TestCaches.copyFixture("legacy_v1_temperatures.yaml", dir.resolve("Old_Town.yaml"));

        assertTrue(codec.migrateFile(f));
        CacheDocument doc = codec.read(f);
        assertEquals(30.0, doc.series("noon_temp_C").orElseThrow().get(SeriesKey.daily(LocalDate.of(2018, 7, 4))));
    }

    @Test
    void failedMigrationLeavesFileUntouched() throws Exception {
        Path f = TestCaches.copyFixture("legacy_v1_no_data.yaml", dir.resolve("Old_Town.yaml"));
        byte[] before = Files.readAllBytes(f);

        MigrationException e = assertThrows(MigrationException.class, () -> codec.read(f));
        assertTrue(e.getMessage().contains("noon_temps"), e.getMessage());
        assertArrayEquals(before, Files.readAllBytes(f));
    }

    @Test
    void currentDocumentWithoutDataSectionIsMalformed() throws Exception {
        Path f = dir.resolve("broken.yaml");
        Files.writeString(f, "schema_version: 2\nplace: {name: X}\nvariables: {}\n");
        assertThrows(CacheFormatException.class, () -> codec.read(f));
    }

    @Test
    void mixedKeysAreNormalized() throws Exception {
        Path f = TestCaches.copyFixture("mixed_keys_v2.yaml", dir.resolve("Testville.yaml"));

        CacheDocument doc = codec.read(f);
        assertEquals(Set.of(2020, 2021), doc.years("noon_temp_C"));
        codec.write(doc, f);

        String text = Files.readString(f);
        assertTrue(text.contains("    2020:\n      1: {1: 12.5, 2: 13.0}\n    2021:\n      3: {5: 11.0}\n"), text);
        assertFalse(text.contains("\"2021\""), text);
    }
}
