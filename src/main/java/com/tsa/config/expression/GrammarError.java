package com.tsa.config.expression;

/**
 * A violation found by {@link GrammarValidator}.
 *
 * @param message Description of the problem
 * @param token   Offending token, or null for expression-wide problems
 */
public record GrammarError(String message, Token token) {

    public static GrammarError global(String message) {
        return new GrammarError(message, null);
    }

    @Override
    public String toString() {
        return message;
    }
}
