package com.tsa.expression.impl;

import com.tsa.expression.LogicExpression;
import com.tsa.expression.TriState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Logical OR - true if any operand is true, unknown if any is unknown, false otherwise.
 */
public class OrExpression implements LogicExpression {

    private final List<LogicExpression> operands;

    public OrExpression(List<LogicExpression> operands) {
        this.operands = List.copyOf(operands);
    }

    @Override
    public TriState evaluate(Map<String, TriState> values) {
        TriState result = TriState.FALSE;
        for (LogicExpression operand : operands) {
            result = result.or(operand.evaluate(values));
            if (result == TriState.TRUE) {
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
        return "OR(" + operands + ")";
    }
}
