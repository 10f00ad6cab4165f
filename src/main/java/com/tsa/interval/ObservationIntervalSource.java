package com.tsa.interval;

import com.tsa.condition.Block;
import com.tsa.condition.IdentifierNormalizer;
import com.tsa.condition.Predicate;
import com.tsa.exception.IntervalSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives block intervals from station observations supplied by the caller.
 * <p>
 * An observation is valid from its time until the next observation of the same
 * station (the last one until the window end), optionally capped by a maximum
 * validity. The predicate is evaluated on the block's sensor reading; a missing
 * reading leaves a gap. Consecutive spans with the same value are merged.
 */
public class ObservationIntervalSource implements IntervalSource {

    private static final Logger log = LoggerFactory.getLogger(ObservationIntervalSource.class);

    private final Map<String, List<StationObservation>> byStation = new HashMap<>();
    private final Duration maxValidity;

    public ObservationIntervalSource(List<StationObservation> observations) {
        this(observations, null);
    }

    /**
     * @param observations Observations of any stations, in any order
     * @param maxValidity  Longest time one observation stays valid, or null for no limit
     */
    public ObservationIntervalSource(List<StationObservation> observations, Duration maxValidity) {
        this.maxValidity = maxValidity;
        for (StationObservation observation : observations) {
            Map<String, Double> values = new HashMap<>();
            observation.values().forEach((sensor, value) -> values.put(IdentifierNormalizer.normalize(sensor), value));
            String station = IdentifierNormalizer.normalize(observation.station());
            byStation.computeIfAbsent(station, k -> new ArrayList<>())
                    .add(new StationObservation(station, observation.time(), values));
        }
        byStation.values().forEach(list -> list.sort(Comparator.comparing(StationObservation::time)));
    }

    @Override
    public List<Interval> fetch(Block block, AnalysisWindow window) {
        Predicate predicate = block.getPredicate();
        if (predicate == null) {
            throw new IntervalSourceException("Observations cannot answer secondary block " + block.getAlias());
        }

        List<StationObservation> observations = byStation.getOrDefault(predicate.station(), List.of()).stream()
                .filter(o -> !o.time().isBefore(window.from()) && o.time().isBefore(window.until()))
                .toList();

        List<Interval> intervals = new ArrayList<>();
        for (int i = 0; i < observations.size(); i++) {
            StationObservation observation = observations.get(i);
            Double reading = observation.values().get(predicate.sensor());
            if (reading == null) {
                continue;
            }
            Instant start = observation.time();
            Instant end = i + 1 < observations.size() ? observations.get(i + 1).time() : window.until();
            if (maxValidity != null && start.plus(maxValidity).isBefore(end)) {
                end = start.plus(maxValidity);
            }
            if (start.isBefore(end)) {
                appendMerged(intervals, new Interval(start, end, predicate.test(reading)));
            }
        }
        log.debug("{} observations of station {} gave {} intervals for {}",
                observations.size(), predicate.station(), intervals.size(), block.getAlias());
        return intervals;
    }

    private static void appendMerged(List<Interval> intervals, Interval next) {
        if (!intervals.isEmpty()) {
            Interval last = intervals.get(intervals.size() - 1);
            if (last.value() == next.value() && last.until().equals(next.from())) {
                intervals.set(intervals.size() - 1, new Interval(last.from(), next.until(), last.value()));
                return;
            }
        }
        intervals.add(next);
    }
}
