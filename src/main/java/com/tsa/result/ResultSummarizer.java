package com.tsa.result;

import com.tsa.expression.TriState;
import com.tsa.interval.AnalysisWindow;
import com.tsa.interval.ValidityPartition;

import java.time.Duration;
import java.time.Instant;

/**
 * Turns a {@link ValidityPartition} into durations and shares of its span.
 */
public final class ResultSummarizer {

    private ResultSummarizer() {
    }

    /**
     * Summarize a partition.
     * <p>
     * The span runs from the first to the last slice boundary, or covers the
     * whole window when there is no data. Time inside the span without a
     * known master value counts as no data. A zero span is all no data.
     *
     * @param partition Partition of one condition
     * @param window    Window the partition was planned for
     * @return Summary
     */
    public static ConditionResult summarize(ValidityPartition partition, AnalysisWindow window) {
        Instant dataFrom = partition.getDataFrom().orElse(null);
        Instant dataUntil = partition.getDataUntil().orElse(null);
        Duration totalSpan = dataFrom == null ? window.length() : Duration.between(dataFrom, dataUntil);

        Duration valid = partition.durationOf(TriState.TRUE);
        Duration invalid = partition.durationOf(TriState.FALSE);
        Duration noData = totalSpan.minus(valid).minus(invalid);

        if (totalSpan.isZero()) {
            return new ConditionResult(dataFrom, dataUntil, totalSpan, valid, invalid, noData, 0.0, 0.0, 1.0);
        }
        double span = totalSpan.toNanos();
        return new ConditionResult(dataFrom, dataUntil, totalSpan, valid, invalid, noData,
                valid.toNanos() / span, invalid.toNanos() / span, noData.toNanos() / span);
    }
}
