package com.tsa.expression;

import java.util.Map;
import java.util.Set;

/**
 * A boolean expression over block aliases, evaluated with three-valued logic.
 */
public interface LogicExpression {

    /**
     * Evaluate this expression.
     *
     * @param values Value of each alias; missing aliases are {@link TriState#UNKNOWN}
     * @return Result of the expression
     */
    TriState evaluate(Map<String, TriState> values);

    /**
     * Aliases referenced by this expression.
     */
    Set<String> aliases();
}
