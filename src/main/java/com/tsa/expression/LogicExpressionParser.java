package com.tsa.expression;

import com.tsa.config.expression.ExpressionTokenizer;
import com.tsa.config.expression.Token;
import com.tsa.config.expression.TokenType;
import com.tsa.exception.ConfigurationException;
import com.tsa.expression.impl.AliasExpression;
import com.tsa.expression.impl.AndExpression;
import com.tsa.expression.impl.NotExpression;
import com.tsa.expression.impl.OrExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for alias expressions such as {@code (d1_0 and not d1_1) or d1_2}.
 * Converts tokens into a {@link LogicExpression} tree using recursive descent.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | primary
 * primary    := '(' expression ')' | alias
 * </pre>
 */
public final class LogicExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    private LogicExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse an alias expression.
     *
     * @param aliasExpression Expression over block aliases
     * @return Expression tree
     * @throws ConfigurationException if the expression is not well-formed
     */
    public static LogicExpression parse(String aliasExpression) {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(aliasExpression);
        LogicExpressionParser parser = new LogicExpressionParser(tokenizer.getInput(), tokenizer.tokenize());
        return parser.parse();
    }

    private LogicExpression parse() {
        LogicExpression result = parseOr();
        if (!isAtEnd()) {
            throw error("Unexpected " + peek().text());
        }
        return result;
    }

    private LogicExpression parseOr() {
        LogicExpression left = parseAnd();
        List<LogicExpression> operands = new ArrayList<>();
        operands.add(left);

        while (match(TokenType.OR)) {
            operands.add(parseAnd());
        }

        return operands.size() == 1 ? left : new OrExpression(operands);
    }

    private LogicExpression parseAnd() {
        LogicExpression left = parseNot();
        List<LogicExpression> operands = new ArrayList<>();
        operands.add(left);

        while (match(TokenType.AND)) {
            operands.add(parseNot());
        }

        return operands.size() == 1 ? left : new AndExpression(operands);
    }

    private LogicExpression parseNot() {
        if (match(TokenType.NOT)) {
            return new NotExpression(parseNot());
        }
        return parsePrimary();
    }

    private LogicExpression parsePrimary() {
        if (match(TokenType.OPEN_PAREN)) {
            LogicExpression expr = parseOr();
            if (!match(TokenType.CLOSE_PAREN)) {
                throw error("Expected )");
            }
            return expr;
        }
        if (isAtEnd()) {
            throw error("Unexpected end of expression");
        }
        Token token = tokens.get(index);
        if (token.type() != TokenType.BLOCK_REF) {
            throw error("Expected alias but found " + token.text());
        }
        index++;
        return new AliasExpression(token.text());
    }

    private boolean match(TokenType type) {
        if (!isAtEnd() && tokens.get(index).type() == type) {
            index++;
            return true;
        }
        return false;
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private ConfigurationException error(String message) {
        int position = isAtEnd() ? input.length() : peek().position();
        return new ConfigurationException("Invalid alias expression at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
