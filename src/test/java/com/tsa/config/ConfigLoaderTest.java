package com.tsa.config;

import com.tsa.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load analysis definition from classpath")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = ConfigLoader.load("classpath:analysis-test.yaml");

        assertEquals("test-analysis", config.name());
        assertEquals(2, config.collections().size());
        assertEquals(3, config.conditionCount());

        CollectionConfig ylojarvi = config.getCollection("Ylojarvi");
        assertNotNull(ylojarvi);
        assertFalse(ylojarvi.mergeSlices());
        assertEquals(Set.of("s1122", "s1"), ylojarvi.stationIds());
        assertEquals(2, ylojarvi.conditions().size());
        assertEquals(3, ylojarvi.conditions().get(1).row());
        assertEquals("Ylöjärvi", ylojarvi.conditions().get(0).site());
        assertEquals(List.of("Row 2: missing condition, skipping entry"), ylojarvi.invalidEntries());
    }

    @Test
    @DisplayName("Date-only bounds should cover whole days in the collection zone")
    void shouldExpandDates() {
        CollectionConfig ylojarvi = ConfigLoader.load("classpath:analysis-test.yaml").getCollection("Ylojarvi");

        assertEquals(Instant.parse("2017-12-31T22:00:00Z"), ylojarvi.window().from());
        assertEquals(Instant.parse("2018-01-31T21:59:59Z"), ylojarvi.window().until());
    }

    @Test
    @DisplayName("Date-times should use the zone unless they carry an offset")
    void shouldParseDateTimes() {
        CollectionConfig tampere = ConfigLoader.load("classpath:analysis-test.yaml").getCollection("Tampere");

        // default zone is UTC
        assertEquals(Instant.parse("2018-02-01T06:00:00Z"), tampere.window().from());
        assertEquals(Instant.parse("2018-02-01T16:00:00Z"), tampere.window().until());
        assertTrue(tampere.mergeSlices());
        assertTrue(tampere.stationIds().isEmpty());
    }

    @Test
    @DisplayName("Should accept collections at the root and default titles")
    void shouldParseRootLevel() {
        String yaml = """
                name: plain
                collections:
                  - time-from: "2018-01-01"
                    time-until: "2018-01-01"
                    conditions:
                      - just text
                      - {site: a, master-alias: b, condition: "s1#x > 1"}
                """;

        AnalysisConfig config = ConfigLoader.parse(yaml);

        CollectionConfig collection = config.collections().get(0);
        assertEquals("collection-1", collection.title());
        assertEquals(Instant.parse("2018-01-01T23:59:59Z"), collection.window().until());
        assertEquals(List.of("Row 1: entry is not a mapping"), collection.invalidEntries());
        assertEquals(2, collection.conditions().get(0).row());
    }

    @Test
    @DisplayName("Should report every missing field of an entry")
    void shouldListMissingFields() {
        String yaml = """
                collections:
                  - title: t
                    time-from: "2018-01-01"
                    time-until: "2018-01-02"
                    conditions:
                      - {site: " ", condition: ""}
                """;

        CollectionConfig collection = ConfigLoader.parse(yaml).collections().get(0);

        assertTrue(collection.conditions().isEmpty());
        assertEquals(List.of("Row 1: missing site, master-alias, condition, skipping entry"),
                collection.invalidEntries());
    }

    @Test
    @DisplayName("Numeric station ids should map to station identifiers")
    void shouldNormalizeStationIds() {
        String yaml = """
                collections:
                  - title: t
                    time-from: "2018-01-01"
                    time-until: "2018-01-02"
                    station-ids: [1122, S1123, "bad id"]
                """;

        CollectionConfig collection = ConfigLoader.parse(yaml).collections().get(0);

        assertEquals(Set.of("s1122", "s1123"), collection.stationIds());
        assertEquals(1, collection.invalidEntries().size());
        assertTrue(collection.invalidEntries().get(0).startsWith("Station id 'bad id' is not valid"));
    }

    @ParameterizedTest
    @DisplayName("Should reject invalid definitions")
    @ValueSource(strings = {
            "",
            "- a list",
            "name: empty",
            "collections: {title: x}",
            "collections: [{title: x, time-from: \"2018-01-01\"}]",
            "collections: [{title: x, time-from: \"2018-01-02\", time-until: \"2018-01-01\"}]",
            "collections: [{title: x, time-from: yesterday, time-until: \"2018-01-01\"}]",
            "collections: [{title: x, zone: Mars/Olympus, time-from: \"2018-01-01\", time-until: \"2018-01-01\"}]",
            "collections: [{title: x, time-from: \"2018-01-01\", time-until: \"2018-01-01\"}, "
                    + "{title: x, time-from: \"2018-01-01\", time-until: \"2018-01-01\"}]"
    })
    void shouldRejectInvalid(String yaml) {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse(yaml));
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:no-such-file.yaml"));
    }
}
