package com.tsa.config;

import java.util.List;

/**
 * Root of an analysis definition.
 *
 * @param name        Analysis name
 * @param collections Condition collections, analyzed independently
 */
public record AnalysisConfig(String name, List<CollectionConfig> collections) {

    public AnalysisConfig {
        collections = List.copyOf(collections);
    }

    /**
     * Get collection config by title, or null.
     */
    public CollectionConfig getCollection(String title) {
        return collections.stream()
                .filter(c -> c.title().equals(title))
                .findFirst()
                .orElse(null);
    }

    public int conditionCount() {
        return collections.stream().mapToInt(c -> c.conditions().size()).sum();
    }
}
