package com.tsa.expression.impl;

import com.tsa.expression.LogicExpression;
import com.tsa.expression.TriState;

import java.util.Map;
import java.util.Set;

/**
 * Logical NOT - negates the nested expression; unknown stays unknown.
 */
public class NotExpression implements LogicExpression {

    private final LogicExpression operand;

    public NotExpression(LogicExpression operand) {
        this.operand = operand;
    }

    @Override
    public TriState evaluate(Map<String, TriState> values) {
        return operand.evaluate(values).not();
    }

    @Override
    public Set<String> aliases() {
        return operand.aliases();
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
