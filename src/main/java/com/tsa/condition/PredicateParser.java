package com.tsa.condition;

import com.tsa.exception.MalformedPredicateException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses {@code station#sensor operator value} fragments into {@link Predicate}s.
 * <p>
 * Operators must be surrounded by whitespace, so that comparison characters
 * inside values never collide with identifiers. Numeric operators need a
 * floating point value; {@code in} needs a value enclosed in parentheses.
 *
 * <pre>
 * PredicateParser.parse("s1122#KITKA3_LUKU >= 0.30")
 *     -> Predicate[station=s1122, sensor=kitka3_luku, operator=>=, value=0.30]
 * </pre>
 */
public final class PredicateParser {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private PredicateParser() {
    }

    /**
     * Parse a predicate fragment.
     *
     * @param raw Predicate text
     * @return Parsed predicate
     * @throws MalformedPredicateException           if the fragment is not well-formed
     * @throws com.tsa.exception.InvalidIdentifierException if station or sensor is not a valid identifier
     */
    public static Predicate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedPredicateException("Empty predicate", String.valueOf(raw));
        }

        String[] stationAndLogic = raw.split("#", -1);
        if (stationAndLogic.length != 2) {
            throw new MalformedPredicateException(
                    "Too many or no \"#\"s, should be [station]#[sensor] [operator] [value]", raw);
        }

        String station = IdentifierNormalizer.normalize(stationAndLogic[0]);
        String logic = stationAndLogic[1].toLowerCase(Locale.ROOT);

        Operator operator = null;
        int occurrences = 0;
        for (Operator op : Operator.values()) {
            if (logic.contains(op.delimited())) {
                occurrences++;
                operator = op;
            }
        }
        if (occurrences != 1) {
            throw new MalformedPredicateException("Too many or no operators, should be exactly one of "
                    + "=, !=, >, <, >=, <=, in surrounded by spaces", raw);
        }

        String[] parts = logic.split(Pattern.quote(operator.delimited()), -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new MalformedPredicateException(
                    "Too many or missing parts separated by operator \"" + operator.symbol() + "\"", raw);
        }

        String sensor = IdentifierNormalizer.normalize(parts[0]);
        String value = parts[1].strip();

        if (!operator.requiresNumericValue()) {
            if (!(value.startsWith("(") && value.endsWith(")"))) {
                throw new MalformedPredicateException(
                        "Value after operator \"in\" is not a valid tuple", raw);
            }
            if (value.substring(1, value.length() - 1).isBlank()) {
                throw new MalformedPredicateException("Empty tuple after operator \"in\"", raw);
            }
        } else if (!isNumeric(value)) {
            throw new MalformedPredicateException(
                    "Must be numeric value after \"" + operator.symbol() + "\"", raw);
        }

        return new Predicate(station, sensor, operator, value);
    }

    /**
     * Whether the text is a plain decimal or exponent number.
     */
    public static boolean isNumeric(String value) {
        return NUMBER.matcher(value).matches();
    }
}
