package com.tsa.condition;

import com.tsa.exception.InvalidIdentifierException;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns free-text names (sites, master aliases, stations, sensors) into
 * identifiers that are safe to use as table or column names.
 * <p>
 * An identifier is lowercase, contains only {@code [a-z0-9_]}, does not start
 * with a digit and is at most {@value #MAX_LENGTH} characters long.
 * Normalization is idempotent.
 */
public final class IdentifierNormalizer {

    /**
     * PostgreSQL allows 63 characters; identifiers are combined with suffixes,
     * so the input part is kept shorter.
     */
    public static final int MAX_LENGTH = 40;

    /**
     * Characters folded to their base Latin letter before lowercasing.
     */
    public static final Map<Character, Character> FOLDED_CHARACTERS = Map.of(
            'ä', 'a',
            'Ä', 'A',
            'ö', 'o',
            'Ö', 'O',
            'å', 'a',
            'Å', 'A'
    );

    private static final Pattern NUMERIC_STATION = Pattern.compile("\\d+");

    private IdentifierNormalizer() {
    }

    /**
     * Normalize a raw name into an identifier.
     *
     * @param raw Free-text name
     * @return Normalized identifier
     * @throws InvalidIdentifierException if the name cannot be made into a valid identifier
     */
    public static String normalize(String raw) {
        String given = raw == null ? "" : raw;
        String original = given.strip();
        if (original.isEmpty()) {
            throw new InvalidIdentifierException("Identifier is empty", given, -1);
        }
        // positions refer to the text as given, including leading whitespace
        int offset = given.length() - given.stripLeading().length();

        String x = foldCharacters(original).toLowerCase(Locale.ROOT);

        if (Character.isDigit(x.charAt(0))) {
            throw error("String starts with digit", given, offset);
        }
        if (x.length() > MAX_LENGTH) {
            throw new InvalidIdentifierException("String too long, maximum is " + MAX_LENGTH
                    + " characters:\n" + original, given, -1);
        }
        for (int i = 0; i < x.length(); i++) {
            if (!isIdentifierPart(x.charAt(i))) {
                throw error("String contains whitespace or non-alphanumeric character", given, offset + i);
            }
        }
        return x;
    }

    /**
     * Normalize a station id. Numeric database ids such as {@code 1122} map to
     * the station identifier {@code s1122} used in predicates.
     *
     * @throws InvalidIdentifierException if the id is neither numeric nor a valid identifier
     */
    public static String normalizeStation(String raw) {
        String stripped = raw == null ? "" : raw.strip();
        if (NUMERIC_STATION.matcher(stripped).matches()) {
            return "s" + stripped;
        }
        return normalize(raw);
    }

    /**
     * Check whether a string would normalize without errors.
     */
    public static boolean isValid(String raw) {
        try {
            normalize(raw);
            return true;
        } catch (InvalidIdentifierException e) {
            return false;
        }
    }

    /**
     * Replace characters of the folding table, leaving everything else as is.
     */
    public static String foldCharacters(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            sb.append(FOLDED_CHARACTERS.getOrDefault(c, c));
        }
        return sb.toString();
    }

    private static boolean isIdentifierPart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }

    private static InvalidIdentifierException error(String message, String original, int position) {
        String pointer = "~".repeat(position) + "^";
        return new InvalidIdentifierException(message + " at position " + position + ":\n"
                + original + "\n" + pointer, original, position);
    }
}
