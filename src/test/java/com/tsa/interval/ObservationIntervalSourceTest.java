package com.tsa.interval;

import com.tsa.condition.Block;
import com.tsa.condition.PredicateParser;
import com.tsa.exception.IntervalSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ObservationIntervalSource.
 */
class ObservationIntervalSourceTest {

    private static final Instant BASE = Instant.parse("2018-01-01T00:00:00Z");

    private AnalysisWindow window;
    private Block friction;

    @BeforeEach
    void setUp() {
        window = new AnalysisWindow(t(0), t(8));
        friction = Block.primary("d1", 0, PredicateParser.parse("s1#kitka >= 0.3"), "s1#kitka >= 0.3");
    }

    private static Instant t(int hours) {
        return BASE.plus(Duration.ofHours(hours));
    }

    private static StationObservation obs(String station, int hour, Map<String, Double> values) {
        return new StationObservation(station, t(hour), values);
    }

    @Test
    @DisplayName("Each observation is valid until the next one of its station")
    void shouldDeriveIntervals() {
        ObservationIntervalSource source = new ObservationIntervalSource(List.of(
                obs("s1", 5, Map.of("kitka", 0.4)),
                obs("s1", 0, Map.of("kitka", 0.5)),
                obs("s2", 1, Map.of("kitka", 0.0)),
                obs("s1", 2, Map.of("kitka", 0.1)),
                obs("s1", 3, Map.of("lampotila", -2.0))
        ));

        List<Interval> intervals = source.fetch(friction, window);

        // the reading-less observation at 3 ends the false span and leaves a gap until 5
        assertEquals(List.of(
                new Interval(t(0), t(2), true),
                new Interval(t(2), t(3), false),
                new Interval(t(5), t(8), true)
        ), intervals);
    }

    @Test
    @DisplayName("Consecutive equal values are merged")
    void shouldMergeEqualValues() {
        ObservationIntervalSource source = new ObservationIntervalSource(List.of(
                obs("s1", 0, Map.of("kitka", 0.5)),
                obs("s1", 1, Map.of("kitka", 0.6)),
                obs("s1", 2, Map.of("kitka", 0.1))
        ));

        assertEquals(List.of(
                new Interval(t(0), t(2), true),
                new Interval(t(2), t(8), false)
        ), source.fetch(friction, window));
    }

    @Test
    @DisplayName("Maximum validity caps each observation")
    void shouldCapValidity() {
        ObservationIntervalSource source = new ObservationIntervalSource(List.of(
                obs("s1", 0, Map.of("kitka", 0.5)),
                obs("s1", 4, Map.of("kitka", 0.1))
        ), Duration.ofHours(1));

        assertEquals(List.of(
                new Interval(t(0), t(1), true),
                new Interval(t(4), t(5), false)
        ), source.fetch(friction, window));
    }

    @Test
    @DisplayName("Station and sensor names are normalized")
    void shouldNormalizeNames() {
        ObservationIntervalSource source = new ObservationIntervalSource(List.of(
                obs("S1", 6, Map.of("KITKA", 0.9))
        ));

        assertEquals(List.of(new Interval(t(6), t(8), true)), source.fetch(friction, window));
    }

    @Test
    @DisplayName("Observations outside the window are ignored")
    void shouldIgnoreOutsideWindow() {
        ObservationIntervalSource source = new ObservationIntervalSource(List.of(
                obs("s1", -1, Map.of("kitka", 0.9)),
                obs("s1", 9, Map.of("kitka", 0.9))
        ));

        assertTrue(source.fetch(friction, window).isEmpty());
    }

    @Test
    @DisplayName("Secondary blocks cannot be answered from observations")
    void shouldRejectSecondaryBlock() {
        ObservationIntervalSource source = new ObservationIntervalSource(List.of());
        Block reference = Block.secondary("d1", 1, "d2", "d2");

        assertThrows(IntervalSourceException.class, () -> source.fetch(reference, window));
    }
}
