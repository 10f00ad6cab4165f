package com.tsa.expression;

/**
 * Three-valued truth value. {@link #UNKNOWN} means no data covered the time slice.
 * <p>
 * Truth tables follow SQL {@code NULL} semantics:
 * {@code AND} is false if any operand is false, else unknown if any is unknown;
 * {@code OR} is the dual; {@code NOT UNKNOWN} is unknown.
 */
public enum TriState {
    TRUE,
    FALSE,
    UNKNOWN;

    public static TriState of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Map a nullable boolean, null being unknown.
     */
    public static TriState ofNullable(Boolean value) {
        return value == null ? UNKNOWN : of(value);
    }

    public TriState and(TriState other) {
        if (this == FALSE || other == FALSE) {
            return FALSE;
        }
        if (this == UNKNOWN || other == UNKNOWN) {
            return UNKNOWN;
        }
        return TRUE;
    }

    public TriState or(TriState other) {
        if (this == TRUE || other == TRUE) {
            return TRUE;
        }
        if (this == UNKNOWN || other == UNKNOWN) {
            return UNKNOWN;
        }
        return FALSE;
    }

    public TriState not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Boolean value, or null if unknown.
     */
    public Boolean toBoolean() {
        return switch (this) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case UNKNOWN -> null;
        };
    }
}
