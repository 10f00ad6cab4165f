package com.tsa.interval;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Time range {@code [from, until)} shared by all conditions of a collection.
 *
 * @param from  Start, inclusive
 * @param until End, exclusive
 */
public record AnalysisWindow(Instant from, Instant until) {

    /**
     * Last second of a day, used as the end of date-only windows.
     */
    public static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    public AnalysisWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(until, "until");
        if (from.isAfter(until)) {
            throw new IllegalArgumentException("Window start " + from + " is after end " + until);
        }
    }

    /**
     * Window between two dates: from 00:00:00 on the first date to 23:59:59 on the last.
     */
    public static AnalysisWindow ofDates(LocalDate fromDate, LocalDate untilDate, ZoneId zone) {
        Instant from = fromDate.atStartOfDay(zone).toInstant();
        Instant until = untilDate.atTime(END_OF_DAY).atZone(zone).toInstant();
        return new AnalysisWindow(from, until);
    }

    public Duration length() {
        return Duration.between(from, until);
    }

    public boolean isDegenerate() {
        return from.equals(until);
    }

    /**
     * Part of the interval inside this window, or null if they do not overlap.
     */
    public Interval clip(Interval interval) {
        Instant start = interval.from().isBefore(from) ? from : interval.from();
        Instant end = interval.until().isAfter(until) ? until : interval.until();
        if (!start.isBefore(end)) {
            return null;
        }
        return new Interval(start, end, interval.value());
    }
}
