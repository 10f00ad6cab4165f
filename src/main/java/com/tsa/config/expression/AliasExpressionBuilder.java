package com.tsa.config.expression;

import com.tsa.condition.Block;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.tsa.config.expression.ExpressionConfig.CANONICAL_TEXT;

/**
 * Rebuilds a condition expression with block aliases in place of predicates
 * and references, e.g. {@code (s1#x > 1 and d2)} becomes {@code (a1_0 and a1_1)}.
 * <p>
 * The result is the contract handed to the interval planner and to the SQL
 * generator, so it always uses the canonical connective spelling.
 */
public final class AliasExpressionBuilder {

    private AliasExpressionBuilder() {
    }

    /**
     * Build the alias expression.
     *
     * @param tokens          Validated tokens
     * @param blocksByToken   Resolved block per index of each block-like token
     * @return Alias expression
     * @throws IllegalArgumentException if a block-like token has no resolved block
     */
    public static String build(List<Token> tokens, Map<Integer, Block> blocksByToken) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isBlockLike()) {
                Block block = blocksByToken.get(i);
                if (block == null) {
                    throw new IllegalArgumentException("No block resolved for " + token);
                }
                sb.append(block.getAlias());
            } else {
                sb.append(CANONICAL_TEXT.get(token.type()));
            }
        }
        return sb.toString();
    }

    /**
     * Rebuild an expression with canonical connectives, replacing each operand
     * by {@code operandText}. Used to substitute aliases back with predicate text.
     */
    public static String rebuild(List<Token> tokens, Function<Token, String> operandText) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.isBlockLike() ? operandText.apply(token) : CANONICAL_TEXT.get(token.type()));
        }
        return sb.toString();
    }
}
