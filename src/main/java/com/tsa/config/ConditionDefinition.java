package com.tsa.config;

/**
 * One condition entry of a collection.
 *
 * @param site        Site / location name
 * @param masterAlias Master alias
 * @param condition   Condition expression
 * @param row         Position of the entry in its collection, starting at 1
 */
public record ConditionDefinition(String site, String masterAlias, String condition, int row) {
}
