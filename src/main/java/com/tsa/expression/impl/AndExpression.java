package com.tsa.expression.impl;

import com.tsa.expression.LogicExpression;
import com.tsa.expression.TriState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Logical AND - false if any operand is false, unknown if any is unknown, true otherwise.
 */
public class AndExpression implements LogicExpression {

    private final List<LogicExpression> operands;

    public AndExpression(List<LogicExpression> operands) {
        this.operands = List.copyOf(operands);
    }

    @Override
    public TriState evaluate(Map<String, TriState> values) {
        TriState result = TriState.TRUE;
        for (LogicExpression operand : operands) {
            result = result.and(operand.evaluate(values));
            if (result == TriState.FALSE) {
                return result;
            }
        }
        return result;
    }

    @Override
    public Set<String> aliases() {
        Set<String> aliases = new LinkedHashSet<>();
        operands.forEach(o -> aliases.addAll(o.aliases()));
        return aliases;
    }

    @Override
    public String toString() {
        return "AND(" + operands + ")";
    }
}
