package com.tsa.expression;

import com.tsa.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Set;

import static com.tsa.expression.TriState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LogicExpressionParser and the expression tree.
 */
class LogicExpressionParserTest {

    @Test
    @DisplayName("AND binds tighter than OR")
    void shouldApplyPrecedence() {
        LogicExpression expression = LogicExpressionParser.parse("a_0 or a_1 and a_2");

        assertEquals(TRUE, expression.evaluate(Map.of("a_0", TRUE, "a_1", FALSE, "a_2", FALSE)));
        assertEquals(FALSE, expression.evaluate(Map.of("a_0", FALSE, "a_1", TRUE, "a_2", FALSE)));
    }

    @Test
    @DisplayName("NOT binds tighter than AND")
    void shouldApplyNot() {
        LogicExpression expression = LogicExpressionParser.parse("not a_0 and a_1");

        assertEquals(TRUE, expression.evaluate(Map.of("a_0", FALSE, "a_1", TRUE)));
        assertEquals(FALSE, expression.evaluate(Map.of("a_0", TRUE, "a_1", TRUE)));
    }

    @Test
    @DisplayName("Parentheses override precedence")
    void shouldHonorParentheses() {
        LogicExpression expression = LogicExpressionParser.parse("(a_0 or a_1) and a_2");

        assertEquals(FALSE, expression.evaluate(Map.of("a_0", TRUE, "a_1", FALSE, "a_2", FALSE)));
        assertEquals(Set.of("a_0", "a_1", "a_2"), expression.aliases());
    }

    @Test
    @DisplayName("Missing aliases evaluate as unknown")
    void shouldTreatMissingAsUnknown() {
        LogicExpression expression = LogicExpressionParser.parse("a_0 and not a_1");

        assertEquals(UNKNOWN, expression.evaluate(Map.of("a_0", TRUE)));
        assertEquals(FALSE, expression.evaluate(Map.of("a_0", FALSE)));
    }

    @ParameterizedTest
    @DisplayName("Should reject malformed alias expressions")
    @ValueSource(strings = {"a_0 and", "(a_0 or a_1", "a_0 a_1 (", "s1#x > 1", "and", ""})
    void shouldRejectMalformed(String aliasExpression) {
        assertThrows(ConfigurationException.class, () -> LogicExpressionParser.parse(aliasExpression));
    }
}
