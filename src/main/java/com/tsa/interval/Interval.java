package com.tsa.interval;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Span {@code [from, until)} during which a block is known to be true or false.
 *
 * @param from  Start, inclusive
 * @param until End, exclusive
 * @param value Known truth value
 */
public record Interval(Instant from, Instant until, boolean value) {

    public Interval {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(until, "until");
        if (until.isBefore(from)) {
            throw new IllegalArgumentException("Interval end " + until + " is before start " + from);
        }
    }

    public Duration duration() {
        return Duration.between(from, until);
    }

    public boolean isEmpty() {
        return from.equals(until);
    }

    @Override
    public String toString() {
        return "[" + from + ", " + until + ")=" + value;
    }
}
