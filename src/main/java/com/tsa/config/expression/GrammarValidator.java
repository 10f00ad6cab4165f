package com.tsa.config.expression;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.tsa.config.expression.GrammarClass.*;

/**
 * Checks a token sequence for balanced parentheses and legal token adjacency.
 * <p>
 * Row = current token, column = next token:
 * <pre>
 *              OPEN  CLOSE  AND_OR  NOT  BLOCK_LIKE
 * OPEN_PAREN    ok     x      x     ok      ok
 * CLOSE_PAREN   x      ok     ok    x       x
 * AND_OR        ok     x      x     ok      ok
 * NOT           ok     x      x     x       ok
 * BLOCK_LIKE    x      ok     ok    x       x
 * </pre>
 * The first token must be OPEN_PAREN, NOT or BLOCK_LIKE; the last one
 * CLOSE_PAREN or BLOCK_LIKE. All violations are reported, not only the first.
 */
public final class GrammarValidator {

    static final Set<GrammarClass> ALLOWED_FIRST = EnumSet.of(OPEN_PAREN, NOT, BLOCK_LIKE);
    static final Set<GrammarClass> ALLOWED_LAST = EnumSet.of(CLOSE_PAREN, BLOCK_LIKE);
    static final Map<GrammarClass, Set<GrammarClass>> ALLOWED_NEXT = new EnumMap<>(GrammarClass.class);

    static {
        ALLOWED_NEXT.put(OPEN_PAREN, EnumSet.of(OPEN_PAREN, NOT, BLOCK_LIKE));
        ALLOWED_NEXT.put(CLOSE_PAREN, EnumSet.of(CLOSE_PAREN, AND_OR));
        ALLOWED_NEXT.put(AND_OR, EnumSet.of(OPEN_PAREN, NOT, BLOCK_LIKE));
        ALLOWED_NEXT.put(NOT, EnumSet.of(OPEN_PAREN, BLOCK_LIKE));
        ALLOWED_NEXT.put(BLOCK_LIKE, EnumSet.of(CLOSE_PAREN, AND_OR));
    }

    private GrammarValidator() {
    }

    /**
     * Validate a token sequence. Never throws.
     *
     * @param tokens Tokens from {@link ExpressionTokenizer}
     * @return All violations in order of appearance; empty if the sequence is valid
     */
    public static List<GrammarError> validate(List<Token> tokens) {
        List<GrammarError> errors = new ArrayList<>();
        if (tokens == null || tokens.isEmpty()) {
            errors.add(GrammarError.global("Condition is empty"));
            return errors;
        }

        checkBalance(tokens, errors);

        int lastIndex = tokens.size() - 1;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            GrammarClass current = token.type().grammarClass();
            if (i == 0 && !ALLOWED_FIRST.contains(current)) {
                errors.add(new GrammarError(
                        "\"" + token.text() + "\" cannot be first element in condition", token));
            }
            if (i == lastIndex && !ALLOWED_LAST.contains(current)) {
                errors.add(new GrammarError(
                        "\"" + token.text() + "\" cannot be last element in condition", token));
            }
            if (i < lastIndex) {
                Token next = tokens.get(i + 1);
                if (!isAllowed(current, next.type().grammarClass())) {
                    errors.add(new GrammarError("Illegal combination in condition: \""
                            + token.text() + "\" before \"" + next.text() + "\"", next));
                }
            }
        }
        return errors;
    }

    /**
     * Whether {@code next} may directly follow {@code current}.
     */
    public static boolean isAllowed(GrammarClass current, GrammarClass next) {
        return ALLOWED_NEXT.get(current).contains(next);
    }

    private static void checkBalance(List<Token> tokens, List<GrammarError> errors) {
        int open = 0;
        int close = 0;
        for (Token token : tokens) {
            for (int i = 0; i < token.text().length(); i++) {
                char c = token.text().charAt(i);
                if (c == ExpressionConfig.Operators.LEFT_PAREN) {
                    open++;
                } else if (c == ExpressionConfig.Operators.RIGHT_PAREN) {
                    close++;
                }
            }
        }
        if (open != close) {
            errors.add(GrammarError.global("Unequal number of \"(\" (" + open
                    + ") and \")\" (" + close + ") in condition"));
        }
    }
}
