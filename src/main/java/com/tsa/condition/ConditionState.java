package com.tsa.condition;

/**
 * Lifecycle of a {@link Condition}: {@code UNPARSED -> PARSING -> VALID | INVALID}.
 */
public enum ConditionState {
    UNPARSED,
    PARSING,
    VALID,
    INVALID;

    public boolean isTerminal() {
        return this == VALID || this == INVALID;
    }
}
