package com.tsa.result;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Validity summary of one condition over its analysis window.
 * <p>
 * Durations satisfy {@code valid + invalid + noData == totalSpan}.
 */
public class ConditionResult {

    private final Instant dataFrom;
    private final Instant dataUntil;
    private final Duration totalSpan;
    private final Duration validDuration;
    private final Duration invalidDuration;
    private final Duration noDataDuration;
    private final double percentageValid;
    private final double percentageInvalid;
    private final double percentageNoData;

    ConditionResult(Instant dataFrom, Instant dataUntil, Duration totalSpan,
                    Duration validDuration, Duration invalidDuration, Duration noDataDuration,
                    double percentageValid, double percentageInvalid, double percentageNoData) {
        this.dataFrom = dataFrom;
        this.dataUntil = dataUntil;
        this.totalSpan = totalSpan;
        this.validDuration = validDuration;
        this.invalidDuration = invalidDuration;
        this.noDataDuration = noDataDuration;
        this.percentageValid = percentageValid;
        this.percentageInvalid = percentageInvalid;
        this.percentageNoData = percentageNoData;
    }

    /**
     * Start of the observed data, empty if there was none.
     */
    public Optional<Instant> getDataFrom() {
        return Optional.ofNullable(dataFrom);
    }

    public Optional<Instant> getDataUntil() {
        return Optional.ofNullable(dataUntil);
    }

    public boolean hasData() {
        return dataFrom != null;
    }

    public Duration getTotalSpan() {
        return totalSpan;
    }

    public Duration getValidDuration() {
        return validDuration;
    }

    public Duration getInvalidDuration() {
        return invalidDuration;
    }

    public Duration getNoDataDuration() {
        return noDataDuration;
    }

    public double getPercentageValid() {
        return percentageValid;
    }

    public double getPercentageInvalid() {
        return percentageInvalid;
    }

    public double getPercentageNoData() {
        return percentageNoData;
    }

    @Override
    public String toString() {
        return String.format("ConditionResult{span=%s, valid=%.1f%%, invalid=%.1f%%, noData=%.1f%%}",
                totalSpan, percentageValid * 100, percentageInvalid * 100, percentageNoData * 100);
    }
}
