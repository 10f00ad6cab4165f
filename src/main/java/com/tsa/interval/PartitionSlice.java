package com.tsa.interval;

import com.tsa.expression.TriState;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One slice of a {@link ValidityPartition}: no block changes value inside it.
 *
 * @param from     Start, inclusive
 * @param until    End, exclusive
 * @param perBlock Value of each block alias during the slice
 * @param master   Value of the condition's alias expression during the slice
 */
public record PartitionSlice(Instant from, Instant until, Map<String, TriState> perBlock, TriState master) {

    public PartitionSlice {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(until, "until");
        Objects.requireNonNull(master, "master");
        if (!until.isAfter(from)) {
            throw new IllegalArgumentException("Slice end " + until + " must be after start " + from);
        }
        perBlock = Collections.unmodifiableMap(new TreeMap<>(perBlock));
    }

    public Duration duration() {
        return Duration.between(from, until);
    }

    /**
     * Whether the other slice starts where this one ends and carries the same values.
     */
    boolean continuesWith(PartitionSlice next) {
        return until.equals(next.from) && master == next.master && perBlock.equals(next.perBlock);
    }

    PartitionSlice extendTo(Instant newUntil) {
        return new PartitionSlice(from, newUntil, perBlock, master);
    }
}
