package com.tsa.interval;

import com.tsa.expression.TriState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Time-ordered, non-overlapping slices of one condition with per-block and master values.
 * Time not covered by any slice had no data for any block.
 */
public class ValidityPartition {

    private final List<String> aliases;
    private final List<PartitionSlice> slices;

    public ValidityPartition(List<String> aliases, List<PartitionSlice> slices) {
        this.aliases = List.copyOf(aliases);
        this.slices = List.copyOf(slices);
    }

    public static ValidityPartition empty(List<String> aliases) {
        return new ValidityPartition(aliases, List.of());
    }

    public List<String> getAliases() {
        return aliases;
    }

    public List<PartitionSlice> getSlices() {
        return slices;
    }

    public boolean isEmpty() {
        return slices.isEmpty();
    }

    /**
     * Earliest time covered by data, empty if the partition is empty.
     */
    public Optional<Instant> getDataFrom() {
        return slices.isEmpty() ? Optional.empty() : Optional.of(slices.get(0).from());
    }

    /**
     * Latest time covered by data, empty if the partition is empty.
     */
    public Optional<Instant> getDataUntil() {
        return slices.isEmpty() ? Optional.empty() : Optional.of(slices.get(slices.size() - 1).until());
    }

    /**
     * Total duration of slices whose master value is the given one.
     */
    public Duration durationOf(TriState master) {
        Duration total = Duration.ZERO;
        for (PartitionSlice slice : slices) {
            if (slice.master() == master) {
                total = total.plus(slice.duration());
            }
        }
        return total;
    }

    /**
     * Master values as intervals: known slices become intervals, unknown slices become gaps.
     * Contiguous slices with the same value are joined.
     */
    public List<Interval> toIntervals() {
        List<Interval> intervals = new ArrayList<>();
        for (PartitionSlice slice : slices) {
            if (!slice.master().isKnown()) {
                continue;
            }
            boolean value = slice.master() == TriState.TRUE;
            if (!intervals.isEmpty()) {
                Interval last = intervals.get(intervals.size() - 1);
                if (last.value() == value && last.until().equals(slice.from())) {
                    intervals.set(intervals.size() - 1, new Interval(last.from(), slice.until(), value));
                    continue;
                }
            }
            intervals.add(new Interval(slice.from(), slice.until(), value));
        }
        return intervals;
    }

    @Override
    public String toString() {
        return "ValidityPartition" + aliases + " with " + slices.size() + " slices";
    }
}
