package com.tsa.config.expression;

/**
 * Represents a token in a condition expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param position Position in the whitespace-collapsed expression
 */
public record Token(TokenType type, String text, int position) {

    public boolean isBlockLike() {
        return type.grammarClass() == GrammarClass.BLOCK_LIKE;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
