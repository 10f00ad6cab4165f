package com.tsa.condition;

/**
 * Comparison operators allowed in a predicate.
 */
public enum Operator {
    EQUALS("="),
    NOT_EQUALS("!="),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_OR_EQUALS(">="),
    LESS_THAN_OR_EQUALS("<="),
    IN("in");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Operator as it must appear in a predicate, surrounded by single spaces.
     */
    public String delimited() {
        return " " + symbol + " ";
    }

    /**
     * Whether the value must be a floating point number.
     */
    public boolean requiresNumericValue() {
        return this != IN;
    }

    /**
     * Apply the comparison to a numeric sensor value.
     * For {@link #IN} the value list is given separately, see {@link Predicate#test(double)}.
     */
    public boolean compare(double actual, double threshold) {
        return switch (this) {
            case EQUALS -> actual == threshold;
            case NOT_EQUALS -> actual != threshold;
            case GREATER_THAN -> actual > threshold;
            case LESS_THAN -> actual < threshold;
            case GREATER_THAN_OR_EQUALS -> actual >= threshold;
            case LESS_THAN_OR_EQUALS -> actual <= threshold;
            case IN -> throw new IllegalStateException("IN is not a binary numeric comparison");
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
