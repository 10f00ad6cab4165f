package com.tsa.interval;

import com.tsa.condition.Block;

import java.util.List;

/**
 * Supplies validity intervals of primary blocks.
 * <p>
 * Returned intervals are disjoint and time-ordered; any time they do not cover
 * is unknown. Implementations signal retrieval problems with
 * {@link com.tsa.exception.IntervalSourceException}.
 */
public interface IntervalSource {

    /**
     * Fetch the validity intervals of a block.
     *
     * @param block  Primary block
     * @param window Analysis window
     * @return Disjoint intervals; empty if there is no data
     */
    List<Interval> fetch(Block block, AnalysisWindow window);
}
