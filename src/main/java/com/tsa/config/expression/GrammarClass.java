package com.tsa.config.expression;

/**
 * Coarse token classes used by the adjacency rules of {@link GrammarValidator}.
 */
public enum GrammarClass {
    OPEN_PAREN,
    CLOSE_PAREN,
    AND_OR,
    NOT,
    BLOCK_LIKE
}
