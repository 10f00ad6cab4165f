package com.tsa.error;

/**
 * Categories of problems collected while compiling and analyzing conditions.
 */
public enum ErrorKind {
    // Structural, detected while parsing a condition
    INVALID_IDENTIFIER(Level.ERROR),
    MALFORMED_PREDICATE(Level.ERROR),
    GRAMMAR_ERROR(Level.ERROR),
    NO_BLOCKS_PRODUCED(Level.ERROR),

    // Collection scope
    UNRESOLVED_REFERENCE(Level.ERROR),
    DUPLICATE_CONDITION(Level.ERROR),
    INVALID_ENTRY(Level.ERROR),
    UNKNOWN_STATION(Level.WARNING),

    // Evaluation
    INTERVAL_SOURCE_FAILURE(Level.ERROR),
    DEGENERATE_WINDOW(Level.WARNING);

    /**
     * Severity of an error kind.
     */
    public enum Level {
        WARNING,
        ERROR
    }

    private final Level defaultLevel;

    ErrorKind(Level defaultLevel) {
        this.defaultLevel = defaultLevel;
    }

    public Level defaultLevel() {
        return defaultLevel;
    }

    /**
     * Camel-case display name, e.g. {@code MalformedPredicate}.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
