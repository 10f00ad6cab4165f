package com.tsa.condition;

import com.tsa.config.expression.Token;
import com.tsa.config.expression.TokenType;
import com.tsa.error.ErrorCollection;
import com.tsa.error.ErrorKind;
import com.tsa.exception.InvalidIdentifierException;
import com.tsa.exception.MalformedPredicateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns predicate and reference tokens into deduplicated {@link Block}s.
 * <p>
 * Operands are compared by their normalized form, so differences in
 * whitespace, case or number formatting never produce two blocks for the same
 * predicate. Order numbers grow only when a new block is allocated.
 * Whether a secondary reference exists is checked later at collection scope.
 */
public final class BlockResolver {

    private static final Logger log = LoggerFactory.getLogger(BlockResolver.class);

    private BlockResolver() {
    }

    /**
     * Resolve all block-like tokens of a condition.
     *
     * @param masterAlias Normalized master alias of the owning condition
     * @param tokens      Tokens of the condition
     * @param errors      Sink for operands that cannot be resolved
     * @return Resolution result
     */
    public static BlockResolution resolve(String masterAlias, List<Token> tokens, ErrorCollection errors) {
        Map<String, Block> blocksByKey = new LinkedHashMap<>();
        Map<Integer, Block> blocksByToken = new HashMap<>();
        boolean failed = false;
        int orderNumber = 0;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isBlockLike()) {
                continue;
            }
            try {
                Block candidate = createBlock(masterAlias, orderNumber, token);
                Block existing = blocksByKey.get(candidate.key());
                if (existing != null) {
                    log.debug("Operand '{}' reuses block {}", token.text(), existing.getAlias());
                    blocksByToken.put(i, existing);
                } else {
                    blocksByKey.put(candidate.key(), candidate);
                    blocksByToken.put(i, candidate);
                    orderNumber++;
                }
            } catch (InvalidIdentifierException e) {
                errors.add(ErrorKind.INVALID_IDENTIFIER,
                        "Cannot create Block from \"" + token.text() + "\": " + e.getMessage());
                failed = true;
            } catch (MalformedPredicateException e) {
                errors.add(ErrorKind.MALFORMED_PREDICATE,
                        "Cannot create Block from \"" + token.text() + "\": " + e.getMessage());
                failed = true;
            }
        }

        List<Block> blocks = new ArrayList<>(blocksByKey.values());
        blocks.sort(Comparator.comparing(Block::getAlias));
        return new BlockResolution(blocks, blocksByToken, failed);
    }

    private static Block createBlock(String masterAlias, int orderNumber, Token token) {
        if (token.type() == TokenType.PREDICATE_REF) {
            return Block.primary(masterAlias, orderNumber, PredicateParser.parse(token.text()), token.text());
        }
        return Block.secondary(masterAlias, orderNumber, IdentifierNormalizer.normalize(token.text()), token.text());
    }
}
