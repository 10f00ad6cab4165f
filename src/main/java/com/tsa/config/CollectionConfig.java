package com.tsa.config;

import com.tsa.interval.AnalysisWindow;

import java.util.List;
import java.util.Set;

/**
 * Configuration of one condition collection.
 *
 * @param title          Collection title, unique within the analysis
 * @param window         Analysis window shared by all conditions
 * @param mergeSlices    Join contiguous partition slices with identical values
 * @param stationIds     Stations known to exist; empty to skip station checks
 * @param conditions     Complete condition entries
 * @param invalidEntries Problems with entries that were skipped
 */
public record CollectionConfig(
        String title,
        AnalysisWindow window,
        boolean mergeSlices,
        Set<String> stationIds,
        List<ConditionDefinition> conditions,
        List<String> invalidEntries
) {
    public CollectionConfig {
        stationIds = Set.copyOf(stationIds);
        conditions = List.copyOf(conditions);
        invalidEntries = List.copyOf(invalidEntries);
    }
}
