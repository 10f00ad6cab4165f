package com.tsa.collection;

import com.tsa.config.AnalysisConfig;
import com.tsa.config.CollectionConfig;
import com.tsa.config.ConditionDefinition;
import com.tsa.config.ConfigLoader;
import com.tsa.error.ErrorKind;
import com.tsa.interval.AnalysisWindow;
import com.tsa.interval.InMemoryIntervalSource;
import com.tsa.interval.Interval;
import com.tsa.result.ConditionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AnalysisRunner.
 */
class AnalysisRunnerTest {

    private static final Instant FROM = Instant.parse("2018-01-01T00:00:00Z");
    private static final Instant MIDDLE = Instant.parse("2018-01-01T12:00:00Z");
    private static final Instant UNTIL = Instant.parse("2018-01-02T00:00:00Z");

    private AnalysisRunner runner;
    private AnalysisConfig config;

    @BeforeEach
    void setUp() {
        InMemoryIntervalSource source = new InMemoryIntervalSource()
                .put("s1#kitka >= 0.3", List.of(new Interval(FROM, MIDDLE, true), new Interval(MIDDLE, UNTIL, false)));
        runner = new AnalysisRunner(source);

        CollectionConfig ylojarvi = new CollectionConfig("Ylojarvi", new AnalysisWindow(FROM, UNTIL), true,
                Set.of("s1"),
                List.of(new ConditionDefinition("ylojarvi", "d1", "s1#kitka >= 0.3", 1),
                        new ConditionDefinition("ylojarvi", "d2", "not d1 or s7#lumi > 0", 3)),
                List.of("Row 2: missing condition, skipping entry"));
        CollectionConfig tampere = new CollectionConfig("Tampere", new AnalysisWindow(FROM, UNTIL), false,
                Set.of(),
                List.of(new ConditionDefinition("tampere", "d1", "d2", 1)),
                List.of());
        config = new AnalysisConfig("test", List.of(ylojarvi, tampere));
    }

    @Test
    @DisplayName("Should analyze every collection independently")
    void shouldRunAnalysis() {
        List<ConditionCollection> collections = runner.run(config, false);

        assertEquals(2, collections.size());
        ConditionCollection ylojarvi = collections.get(0);
        ConditionResult d2 = ylojarvi.getResult("ylojarvi_d2").orElseThrow();
        assertEquals(0.5, d2.getPercentageValid(), 1e-9);
        assertEquals(0.5, d2.getPercentageNoData(), 1e-9);

        // references never cross collections
        ConditionCollection tampere = collections.get(1);
        assertTrue(tampere.getResults().isEmpty());
        assertTrue(tampere.getCondition("tampere_d1").orElseThrow().getErrors()
                .contains(ErrorKind.UNRESOLVED_REFERENCE));
    }

    @Test
    @DisplayName("Should carry skipped entries and unknown stations into the error report")
    void shouldReportConfigurationProblems() {
        ConditionCollection ylojarvi = runner.build(config.collections().get(0));

        assertTrue(ylojarvi.getErrors().contains(ErrorKind.INVALID_ENTRY));
        assertTrue(ylojarvi.getCondition("ylojarvi_d2").orElseThrow().getErrors()
                .contains(ErrorKind.UNKNOWN_STATION));
        assertEquals(2, ylojarvi.getEvaluationOrder().size());
    }

    @Test
    @DisplayName("Numeric station ids from the definition should not stop the run")
    void shouldRunWithNumericStationIds() {
        AnalysisConfig numeric = ConfigLoader.parse("""
                collections:
                  - title: Ylojarvi
                    time-from: "2018-01-01"
                    time-until: "2018-01-01"
                    station-ids: [1122]
                    conditions:
                      - {site: ylojarvi, master-alias: d1, condition: "s1122#kitka >= 0.3"}
                      - {site: ylojarvi, master-alias: d2, condition: "s1#kitka >= 0.3"}
                """);

        List<ConditionCollection> collections = runner.run(numeric, false);

        ConditionCollection ylojarvi = collections.get(0);
        assertTrue(ylojarvi.getCondition("ylojarvi_d1").orElseThrow().getErrors().isEmpty());
        assertTrue(ylojarvi.getCondition("ylojarvi_d2").orElseThrow().getErrors()
                .contains(ErrorKind.UNKNOWN_STATION));
        assertTrue(ylojarvi.getResult("ylojarvi_d1").isPresent());
        assertTrue(ylojarvi.getResult("ylojarvi_d2").orElseThrow().hasData());
    }

    @Test
    @DisplayName("Dry validation should not fetch any data")
    void shouldDryValidate() {
        AnalysisRunner failing = new AnalysisRunner((block, window) -> {
            throw new IllegalStateException("No data expected");
        });

        List<ConditionCollection> collections = failing.run(config, true);

        assertTrue(collections.get(0).getResults().isEmpty());
        assertTrue(collections.get(0).getCondition("ylojarvi_d1").orElseThrow().isValid());
    }
}
