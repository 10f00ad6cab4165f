package com.tsa.condition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single sensor comparison at one station, e.g. {@code s1122#kitka3_luku >= 0.30}.
 *
 * @param station  Station identifier
 * @param sensor   Sensor identifier
 * @param operator Comparison operator
 * @param value    Comparison value as written (trimmed); a parenthesized list for {@code in}
 */
public record Predicate(String station, String sensor, Operator operator, String value) {

    public Predicate {
        Objects.requireNonNull(station, "station");
        Objects.requireNonNull(sensor, "sensor");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Key used to detect logically identical predicates.
     * Numeric values compare by value ({@code 0.30} equals {@code 0.3}),
     * {@code in} lists compare with whitespace removed.
     */
    public String key() {
        return station + "#" + sensor + operator.delimited() + normalizedValue();
    }

    /**
     * Value in canonical form.
     */
    public String normalizedValue() {
        if (operator == Operator.IN) {
            return value.replaceAll("\\s+", "");
        }
        try {
            return new BigDecimal(value).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            return value;
        }
    }

    public double numericValue() {
        if (operator == Operator.IN) {
            throw new IllegalStateException("Predicate with 'in' has no single numeric value: " + this);
        }
        return Double.parseDouble(value);
    }

    /**
     * Elements of an {@code in} list, trimmed and unquoted.
     */
    public List<String> listValues() {
        if (operator != Operator.IN) {
            return List.of(value);
        }
        String inner = value.substring(1, value.length() - 1).strip();
        if (inner.isEmpty()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String item : inner.split(",")) {
            String trimmed = item.strip();
            if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
                trimmed = trimmed.substring(1, trimmed.length() - 1);
            }
            items.add(trimmed);
        }
        return Collections.unmodifiableList(items);
    }

    /**
     * Evaluate the predicate against a sensor reading.
     * List elements that are not numbers never match.
     */
    public boolean test(double actual) {
        if (operator != Operator.IN) {
            return operator.compare(actual, numericValue());
        }
        return listValues().stream()
                .filter(PredicateParser::isNumeric)
                .anyMatch(item -> Double.parseDouble(item) == actual);
    }

    @Override
    public String toString() {
        return station + "#" + sensor + operator.delimited() + value;
    }
}
