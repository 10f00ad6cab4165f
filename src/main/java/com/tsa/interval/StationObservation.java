package com.tsa.interval;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One observation of a station: sensor readings taken at the same time.
 *
 * @param station Station identifier
 * @param time    Observation time
 * @param values  Reading per sensor identifier; sensors without a reading are absent
 */
public record StationObservation(String station, Instant time, Map<String, Double> values) {

    public StationObservation {
        Objects.requireNonNull(station, "station");
        Objects.requireNonNull(time, "time");
        values = values == null ? Map.of() : Map.copyOf(values);
    }
}
