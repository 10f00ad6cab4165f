package com.tsa.config.expression;

/**
 * Token types of a condition expression.
 */
public enum TokenType {
    // Delimiters
    OPEN_PAREN(GrammarClass.OPEN_PAREN),
    CLOSE_PAREN(GrammarClass.CLOSE_PAREN),

    // Logical operators
    AND(GrammarClass.AND_OR),
    OR(GrammarClass.AND_OR),
    NOT(GrammarClass.NOT),

    // Operands
    PREDICATE_REF(GrammarClass.BLOCK_LIKE),
    BLOCK_REF(GrammarClass.BLOCK_LIKE);

    private final GrammarClass grammarClass;

    TokenType(GrammarClass grammarClass) {
        this.grammarClass = grammarClass;
    }

    /**
     * Class of this token type in the adjacency table.
     */
    public GrammarClass grammarClass() {
        return grammarClass;
    }
}
