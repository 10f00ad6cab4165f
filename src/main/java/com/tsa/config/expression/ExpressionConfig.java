package com.tsa.config.expression;

import java.util.Map;

/**
 * Keywords and delimiters of the condition expression language.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Connective keywords mapped to token types (matched case-insensitively).
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT
    );

    /**
     * Canonical spelling of each non-operand token in a rebuilt expression.
     */
    public static final Map<TokenType, String> CANONICAL_TEXT = Map.of(
            TokenType.OPEN_PAREN, "(",
            TokenType.CLOSE_PAREN, ")",
            TokenType.AND, " and ",
            TokenType.OR, " or ",
            TokenType.NOT, "not "
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char STATION_SEPARATOR = '#';

        private Operators() {
        }
    }

    /**
     * Fragment ending that opens a parenthesized {@code in} list.
     */
    public static final String IN_SUFFIX = " in";

    /**
     * Fragment content marking an {@code in} predicate.
     */
    public static final String IN_INFIX = " in ";
}
