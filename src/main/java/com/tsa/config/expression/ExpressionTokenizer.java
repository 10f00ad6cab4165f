package com.tsa.config.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.tsa.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for condition expressions.
 * <p>
 * Splits on parentheses and on the connectives {@code and}, {@code or}, {@code not}
 * when they stand as separate words, also at either end of the expression or
 * next to a parenthesis; everything between them is a predicate
 * ({@code station#sensor op value}) or a reference to another condition.
 * The parenthesized value list of an {@code in} predicate is glued back to its
 * predicate before fragments are classified.
 */
public final class ExpressionTokenizer {

    private static final Pattern DELIMITER = Pattern.compile(
            "[()]|(?:^|(?<=[\\s()]))(?:and|or|not)(?=$|[\\s()])",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String input;

    public ExpressionTokenizer(String input) {
        this.input = collapseWhitespace(input);
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, empty for a blank expression
     */
    public List<Token> tokenize() {
        List<Fragment> fragments = mergeInLists(split());
        List<Token> tokens = new ArrayList<>(fragments.size());
        for (Fragment fragment : fragments) {
            tokens.add(new Token(classify(fragment.text()), fragment.text(), fragment.position()));
        }
        return tokens;
    }

    /**
     * The expression with whitespace runs collapsed to single spaces; token positions refer to it.
     */
    public String getInput() {
        return input;
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.strip()).replaceAll(" ");
    }

    private List<Fragment> split() {
        List<Fragment> fragments = new ArrayList<>();
        Matcher matcher = DELIMITER.matcher(input);
        int last = 0;
        while (matcher.find()) {
            addText(fragments, last, matcher.start());
            fragments.add(new Fragment(matcher.group(), matcher.start()));
            last = matcher.end();
        }
        addText(fragments, last, input.length());
        return fragments;
    }

    private void addText(List<Fragment> fragments, int start, int end) {
        String raw = input.substring(start, end);
        String text = raw.strip();
        if (!text.isEmpty()) {
            fragments.add(new Fragment(text, start + raw.indexOf(text.charAt(0))));
        }
    }

    /**
     * Parentheses after {@code in} belong to the predicate value, not to the expression.
     * Whether the list is closed correctly is detected later by the predicate parser.
     */
    private static List<Fragment> mergeInLists(List<Fragment> fragments) {
        List<Fragment> merged = new ArrayList<>();
        for (Fragment fragment : fragments) {
            if (merged.isEmpty()) {
                merged.add(fragment);
                continue;
            }
            Fragment previous = merged.get(merged.size() - 1);
            String prev = previous.text().toLowerCase(Locale.ROOT);
            if (prev.length() > IN_SUFFIX.length() && prev.endsWith(IN_SUFFIX)) {
                merged.set(merged.size() - 1, previous.append(" " + fragment.text()));
            } else if (prev.contains(IN_INFIX) && prev.charAt(prev.length() - 1) != Operators.RIGHT_PAREN) {
                merged.set(merged.size() - 1, previous.append(fragment.text()));
            } else {
                merged.add(fragment);
            }
        }
        return merged;
    }

    private static TokenType classify(String text) {
        if (text.length() == 1 && text.charAt(0) == Operators.LEFT_PAREN) {
            return TokenType.OPEN_PAREN;
        }
        if (text.length() == 1 && text.charAt(0) == Operators.RIGHT_PAREN) {
            return TokenType.CLOSE_PAREN;
        }
        TokenType keyword = KEYWORDS.get(text.toLowerCase(Locale.ROOT));
        if (keyword != null) {
            return keyword;
        }
        if (text.indexOf(Operators.STATION_SEPARATOR) >= 0) {
            return TokenType.PREDICATE_REF;
        }
        return TokenType.BLOCK_REF;
    }

    private record Fragment(String text, int position) {
        Fragment append(String suffix) {
            return new Fragment(text + suffix, position);
        }
    }
}
