package com.tsa.expression.impl;

import com.tsa.expression.LogicExpression;
import com.tsa.expression.TriState;

import java.util.Map;
import java.util.Set;

/**
 * Leaf of an expression tree: the value of one block alias.
 */
public class AliasExpression implements LogicExpression {

    private final String alias;

    public AliasExpression(String alias) {
        this.alias = alias;
    }

    @Override
    public TriState evaluate(Map<String, TriState> values) {
        return values.getOrDefault(alias, TriState.UNKNOWN);
    }

    @Override
    public Set<String> aliases() {
        return Set.of(alias);
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public String toString() {
        return alias;
    }
}
