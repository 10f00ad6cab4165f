package com.tsa.condition;

import com.tsa.exception.InvalidIdentifierException;
import com.tsa.exception.MalformedPredicateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PredicateParser and Predicate.
 */
class PredicateParserTest {

    @Test
    @DisplayName("Should parse station, sensor, operator and value")
    void shouldParsePredicate() {
        Predicate predicate = PredicateParser.parse("s1122#KITKA3_LUKU >= 0.30");

        assertEquals("s1122", predicate.station());
        assertEquals("kitka3_luku", predicate.sensor());
        assertEquals(Operator.GREATER_THAN_OR_EQUALS, predicate.operator());
        assertEquals("0.30", predicate.value());
    }

    @ParameterizedTest
    @DisplayName("Should recognize every operator")
    @CsvSource({
            "'s1#x = 1', EQUALS",
            "'s1#x != 1', NOT_EQUALS",
            "'s1#x > 1', GREATER_THAN",
            "'s1#x < 1', LESS_THAN",
            "'s1#x >= 1', GREATER_THAN_OR_EQUALS",
            "'s1#x <= 1', LESS_THAN_OR_EQUALS",
            "'s1#x in (1, 2)', IN"
    })
    void shouldRecognizeOperators(String raw, Operator expected) {
        assertEquals(expected, PredicateParser.parse(raw).operator());
    }

    @ParameterizedTest
    @DisplayName("Should reject malformed predicates")
    @ValueSource(strings = {
            "s1122 kitka >= 1",
            "s1#a#b > 1",
            "s1#x>1",
            "s1#x 1",
            "s1#x > 1 < 2",
            "s1#x > abc",
            "s1#x > ",
            "s1# > 1",
            "s1#x in 1, 2",
            "s1#x in ()",
            "s1#x in (  )",
            ""
    })
    void shouldRejectMalformed(String raw) {
        assertThrows(MalformedPredicateException.class, () -> PredicateParser.parse(raw));
    }

    @Test
    @DisplayName("Should report invalid station as identifier error")
    void shouldRejectInvalidStation() {
        assertThrows(InvalidIdentifierException.class, () -> PredicateParser.parse("1122#x > 1"));
    }

    @Test
    @DisplayName("Malformed predicate keeps the offending fragment")
    void shouldKeepFragment() {
        MalformedPredicateException e = assertThrows(MalformedPredicateException.class,
                () -> PredicateParser.parse("s1#a#b > 1"));
        assertEquals("s1#a#b > 1", e.getFragment());
        assertTrue(e.getMessage().endsWith(": s1#a#b > 1"));
    }

    @Test
    @DisplayName("Keys of logically identical predicates are equal")
    void shouldNormalizeKeys() {
        assertEquals(PredicateParser.parse("s1#x >= 0.30").key(), PredicateParser.parse("S1#X >=  0.3").key());
        assertEquals(PredicateParser.parse("s1#x in (1, 2)").key(), PredicateParser.parse("s1#x in (1,2)").key());
        assertNotEquals(PredicateParser.parse("s1#x > 1").key(), PredicateParser.parse("s1#x >= 1").key());
    }

    @Test
    @DisplayName("Should unquote list values")
    void shouldListValues() {
        assertEquals(List.of("1", "2"), PredicateParser.parse("s1#x in (1, 2)").listValues());
        assertEquals(List.of("a", "b"), PredicateParser.parse("s1#x in ('a', 'b')").listValues());
    }

    @Test
    @DisplayName("Should test readings against the predicate")
    void shouldTestReadings() {
        Predicate atLeast = PredicateParser.parse("s1#x >= 0.3");
        assertTrue(atLeast.test(0.3));
        assertTrue(atLeast.test(0.7));
        assertFalse(atLeast.test(0.29));

        Predicate in = PredicateParser.parse("s1#x in (1, 2, 'dry')");
        assertTrue(in.test(2.0));
        assertFalse(in.test(3.0));
    }

    @ParameterizedTest
    @DisplayName("Should accept numeric formats")
    @ValueSource(strings = {"1", "-1", "+0.5", ".5", "1.", "1e3", "2.5e-2"})
    void shouldAcceptNumbers(String value) {
        assertTrue(PredicateParser.isNumeric(value));
        assertEquals(value, PredicateParser.parse("s1#x > " + value).value());
    }
}
