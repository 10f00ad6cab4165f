package com.tsa.condition;

import com.tsa.config.expression.AliasExpressionBuilder;
import com.tsa.config.expression.ExpressionTokenizer;
import com.tsa.config.expression.GrammarError;
import com.tsa.config.expression.GrammarValidator;
import com.tsa.config.expression.Token;
import com.tsa.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Compiles condition definitions: tokenize, validate grammar, resolve blocks
 * and build the alias expression.
 * <p>
 * Structural problems are collected into the condition's error list without
 * stopping; any of them leaves the condition {@link ConditionState#INVALID}.
 */
public final class ConditionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ConditionCompiler.class);

    private ConditionCompiler() {
    }

    public static Condition compile(String site, String masterAlias, String rawCondition) {
        return compile(site, masterAlias, rawCondition, null);
    }

    /**
     * Compile a condition definition.
     *
     * @param site         Site / location name
     * @param masterAlias  Master alias
     * @param rawCondition Condition expression
     * @param sourceRow    Row of the definition in its source, or null
     * @return Compiled condition, valid or invalid
     * @throws com.tsa.exception.InvalidIdentifierException if site or master alias are not valid identifiers
     */
    public static Condition compile(String site, String masterAlias, String rawCondition, Integer sourceRow) {
        Condition condition = new Condition(site, masterAlias, rawCondition, sourceRow);
        condition.startParsing();

        List<Token> tokens = new ExpressionTokenizer(condition.getExpression()).tokenize();

        List<GrammarError> grammarErrors = GrammarValidator.validate(tokens);
        for (GrammarError error : grammarErrors) {
            condition.getErrors().add(ErrorKind.GRAMMAR_ERROR, error.message());
        }

        BlockResolution resolution = BlockResolver.resolve(
                condition.getMasterAlias(), tokens, condition.getErrors());

        boolean valid = grammarErrors.isEmpty() && !resolution.failed();
        if (resolution.isEmpty()) {
            condition.getErrors().add(ErrorKind.NO_BLOCKS_PRODUCED, "No Blocks were created");
            valid = false;
        }

        String aliasExpression = resolution.failed()
                ? ""
                : AliasExpressionBuilder.build(tokens, resolution.blocksByToken());

        condition.finishParsing(tokens, resolution.blocks(), aliasExpression, valid);

        if (valid) {
            log.debug("{} parsed successfully: {}", condition, aliasExpression);
        } else {
            log.warn("There were errors with condition {} and it will not be analyzed: {}",
                    condition.getIdString(), condition.getErrors().getErrors());
        }
        return condition;
    }
}
