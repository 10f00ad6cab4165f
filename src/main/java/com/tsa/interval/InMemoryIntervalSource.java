package com.tsa.interval;

import com.tsa.condition.Block;
import com.tsa.condition.PredicateParser;
import com.tsa.exception.TsaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interval source backed by a map.
 * <p>
 * Keys are either predicate texts ({@code s1122#kitka3_luku >= 0.3}), matched
 * by normalized predicate so formatting does not matter, or block aliases.
 * An alias entry wins over a predicate entry.
 */
public class InMemoryIntervalSource implements IntervalSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIntervalSource.class);

    private final Map<String, List<Interval>> byAlias = new HashMap<>();
    private final Map<String, List<Interval>> byPredicate = new HashMap<>();

    /**
     * Register intervals under a predicate text or a block alias.
     */
    public InMemoryIntervalSource put(String key, List<Interval> intervals) {
        List<Interval> copy = List.copyOf(intervals);
        if (key.indexOf('#') >= 0) {
            try {
                byPredicate.put(PredicateParser.parse(key).key(), copy);
                return this;
            } catch (TsaException e) {
                log.warn("Key '{}' is not a valid predicate, registering it as alias: {}", key, e.getMessage());
            }
        }
        byAlias.put(key, copy);
        return this;
    }

    @Override
    public List<Interval> fetch(Block block, AnalysisWindow window) {
        List<Interval> intervals = byAlias.get(block.getAlias());
        if (intervals == null && block.getPredicate() != null) {
            intervals = byPredicate.get(block.getPredicate().key());
        }
        if (intervals == null) {
            log.debug("No intervals for {}", block);
            return List.of();
        }
        List<Interval> inWindow = new ArrayList<>();
        for (Interval interval : intervals) {
            Interval clipped = window.clip(interval);
            if (clipped != null) {
                inWindow.add(clipped);
            }
        }
        return inWindow;
    }

    public int size() {
        return byAlias.size() + byPredicate.size();
    }
}
