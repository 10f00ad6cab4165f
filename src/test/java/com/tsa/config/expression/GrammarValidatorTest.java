package com.tsa.config.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GrammarValidator.
 */
class GrammarValidatorTest {

    private static List<GrammarError> validate(String expression) {
        return GrammarValidator.validate(new ExpressionTokenizer(expression).tokenize());
    }

    @ParameterizedTest
    @DisplayName("Should accept well-formed expressions")
    @ValueSource(strings = {
            "(s1#x>1 and s2#y<2)",
            "s1#x > 1",
            "not d1",
            "not (d1 or d2) and d3",
            "((d1))",
            "d1 or not (d2 and d3)"
    })
    void shouldAccept(String expression) {
        assertEquals(List.of(), validate(expression));
    }

    @Test
    @DisplayName("Should reject AND as first element")
    void shouldRejectAndFirst() {
        List<GrammarError> errors = validate("AND s1#x>1");

        assertEquals(1, errors.size());
        assertEquals("\"AND\" cannot be first element in condition", errors.get(0).message());
        assertEquals(TokenType.AND, errors.get(0).token().type());
    }

    @Test
    @DisplayName("Should reject close parenthesis as first element")
    void shouldRejectCloseParenFirst() {
        List<GrammarError> errors = validate(")s1#x>1");

        assertTrue(errors.stream().anyMatch(e -> e.message().contains("cannot be first element")));
        assertTrue(errors.stream().anyMatch(e -> e.message().startsWith("Unequal number of \"(\"")));
    }

    @Test
    @DisplayName("Should report every violation, not only the first")
    void shouldCollectAllErrors() {
        List<GrammarError> errors = validate("or d1 d2 (");

        // unbalanced, "or" first, "d1 d2" before "(", "(" last
        assertEquals(4, errors.size());
        assertNull(errors.get(0).token());
        assertEquals("Illegal combination in condition: \"d1 d2\" before \"(\"", errors.get(2).message());
    }

    @Test
    @DisplayName("Empty expression is a single error")
    void shouldRejectEmpty() {
        List<GrammarError> errors = GrammarValidator.validate(List.of());

        assertEquals(1, errors.size());
        assertEquals("Condition is empty", errors.get(0).message());
    }

    @ParameterizedTest
    @DisplayName("Adjacency table")
    @CsvSource({
            "OPEN_PAREN, OPEN_PAREN, true",
            "OPEN_PAREN, CLOSE_PAREN, false",
            "OPEN_PAREN, AND_OR, false",
            "CLOSE_PAREN, AND_OR, true",
            "CLOSE_PAREN, BLOCK_LIKE, false",
            "AND_OR, NOT, true",
            "AND_OR, AND_OR, false",
            "NOT, NOT, false",
            "NOT, BLOCK_LIKE, true",
            "BLOCK_LIKE, BLOCK_LIKE, false",
            "BLOCK_LIKE, CLOSE_PAREN, true"
    })
    void shouldFollowAdjacencyTable(GrammarClass current, GrammarClass next, boolean allowed) {
        assertEquals(allowed, GrammarValidator.isAllowed(current, next));
    }
}
