package com.tsa.interval;

import com.tsa.exception.IntervalSourceException;
import com.tsa.expression.LogicExpression;
import com.tsa.expression.LogicExpressionParser;
import com.tsa.expression.TriState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the elementary partition of a condition's blocks and evaluates the
 * alias expression on each slice.
 * <p>
 * Every interval start and end of every block is a boundary; between two
 * consecutive boundaries no block changes value. A block contributes
 * {@link TriState#UNKNOWN} to a slice none of its intervals covers. Slices
 * where every block is unknown are left out.
 */
public class IntervalPlanner {

    private static final Logger log = LoggerFactory.getLogger(IntervalPlanner.class);

    private final boolean mergeSlices;

    public IntervalPlanner() {
        this(true);
    }

    /**
     * @param mergeSlices Join contiguous slices with identical values
     */
    public IntervalPlanner(boolean mergeSlices) {
        this.mergeSlices = mergeSlices;
    }

    /**
     * Plan one condition.
     *
     * @param aliasExpression Canonical expression over block aliases
     * @param blockIntervals  Known intervals per block alias
     * @param window          Analysis window; intervals are clipped to it
     * @return Partition of the window
     * @throws IntervalSourceException if the intervals of one block overlap
     * @throws com.tsa.exception.ConfigurationException if the alias expression is malformed
     */
    public ValidityPartition plan(String aliasExpression, Map<String, List<Interval>> blockIntervals,
                                  AnalysisWindow window) {
        LogicExpression expression = LogicExpressionParser.parse(aliasExpression);

        Map<String, List<Interval>> prepared = new TreeMap<>();
        for (String alias : expression.aliases()) {
            prepared.put(alias, List.of());
        }
        for (Map.Entry<String, List<Interval>> entry : blockIntervals.entrySet()) {
            prepared.put(entry.getKey(), prepare(entry.getKey(), entry.getValue(), window));
        }
        List<String> aliases = new ArrayList<>(prepared.keySet());

        List<PartitionSlice> slices = prepared.size() == 1
                ? singleBlock(aliases.get(0), prepared.get(aliases.get(0)), expression)
                : elementary(prepared, expression);

        if (mergeSlices) {
            slices = merge(slices);
        }
        log.debug("Planned '{}' into {} slices", aliasExpression, slices.size());
        return new ValidityPartition(aliases, slices);
    }

    private static List<Interval> prepare(String alias, List<Interval> intervals, AnalysisWindow window) {
        List<Interval> clipped = new ArrayList<>();
        for (Interval interval : intervals) {
            Interval inWindow = window.clip(interval);
            if (inWindow != null && !inWindow.isEmpty()) {
                clipped.add(inWindow);
            }
        }
        clipped.sort(Comparator.comparing(Interval::from));
        for (int i = 1; i < clipped.size(); i++) {
            Interval previous = clipped.get(i - 1);
            Interval current = clipped.get(i);
            if (current.from().isBefore(previous.until())) {
                throw new IntervalSourceException("Overlapping intervals for block " + alias
                        + ": " + previous + " and " + current);
            }
        }
        return clipped;
    }

    private static List<PartitionSlice> singleBlock(String alias, List<Interval> intervals,
                                                    LogicExpression expression) {
        List<PartitionSlice> slices = new ArrayList<>();
        for (Interval interval : intervals) {
            Map<String, TriState> perBlock = Map.of(alias, TriState.of(interval.value()));
            slices.add(new PartitionSlice(interval.from(), interval.until(), perBlock, expression.evaluate(perBlock)));
        }
        return slices;
    }

    private static List<PartitionSlice> elementary(Map<String, List<Interval>> prepared, LogicExpression expression) {
        TreeSet<Instant> boundaries = new TreeSet<>();
        for (List<Interval> intervals : prepared.values()) {
            for (Interval interval : intervals) {
                boundaries.add(interval.from());
                boundaries.add(interval.until());
            }
        }

        Map<String, Integer> cursors = new HashMap<>();
        prepared.keySet().forEach(alias -> cursors.put(alias, 0));

        List<PartitionSlice> slices = new ArrayList<>();
        Iterator<Instant> iterator = boundaries.iterator();
        if (!iterator.hasNext()) {
            return slices;
        }
        Instant start = iterator.next();
        while (iterator.hasNext()) {
            Instant end = iterator.next();
            Map<String, TriState> perBlock = new TreeMap<>();
            boolean anyKnown = false;
            for (Map.Entry<String, List<Interval>> entry : prepared.entrySet()) {
                TriState value = valueAt(entry.getValue(), cursors, entry.getKey(), start);
                perBlock.put(entry.getKey(), value);
                anyKnown |= value.isKnown();
            }
            if (anyKnown) {
                slices.add(new PartitionSlice(start, end, perBlock, expression.evaluate(perBlock)));
            }
            start = end;
        }
        return slices;
    }

    /**
     * Value of a block for the slice starting at {@code start}. Cursors only move forward.
     */
    private static TriState valueAt(List<Interval> intervals, Map<String, Integer> cursors, String alias,
                                    Instant start) {
        int cursor = cursors.get(alias);
        while (cursor < intervals.size() && !intervals.get(cursor).until().isAfter(start)) {
            cursor++;
        }
        cursors.put(alias, cursor);
        if (cursor < intervals.size() && !intervals.get(cursor).from().isAfter(start)) {
            return TriState.of(intervals.get(cursor).value());
        }
        return TriState.UNKNOWN;
    }

    private static List<PartitionSlice> merge(List<PartitionSlice> slices) {
        List<PartitionSlice> merged = new ArrayList<>();
        for (PartitionSlice slice : slices) {
            if (!merged.isEmpty() && merged.get(merged.size() - 1).continuesWith(slice)) {
                PartitionSlice last = merged.remove(merged.size() - 1);
                merged.add(last.extendTo(slice.until()));
            } else {
                merged.add(slice);
            }
        }
        return merged;
    }
}
