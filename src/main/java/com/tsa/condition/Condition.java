package com.tsa.condition;

import com.tsa.config.expression.Token;
import com.tsa.error.ErrorCollection;
import com.tsa.error.ErrorKind;
import com.tsa.error.TsaError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Logical combination of {@link Block}s, identified by site and master alias.
 * <p>
 * Created by {@link ConditionCompiler}; its tokens, blocks and alias expression
 * are fixed once the state is {@link ConditionState#VALID} or
 * {@link ConditionState#INVALID}. A collection may still invalidate a valid
 * condition when its analysis fails. Unresolved references only hold until
 * the collection resolves references again.
 */
public class Condition {

    private static final Logger log = LoggerFactory.getLogger(Condition.class);

    private final String site;
    private final String masterAlias;
    private final String idString;
    private final String rawCondition;
    private final String expression;
    private final Integer sourceRow;
    private final ErrorCollection errors;
    private final List<TsaError> referenceErrors = new ArrayList<>();

    private ConditionState state = ConditionState.UNPARSED;
    private List<Token> tokens = List.of();
    private List<Block> blocks = List.of();
    private String aliasExpression = "";

    /**
     * @param site         Site / location name
     * @param masterAlias  Master alias of the condition
     * @param rawCondition Condition expression as written
     * @param sourceRow    Row of the definition in its source, or null
     * @throws com.tsa.exception.InvalidIdentifierException if site or master alias are not valid identifiers
     */
    Condition(String site, String masterAlias, String rawCondition, Integer sourceRow) {
        this.site = IdentifierNormalizer.normalize(site);
        this.masterAlias = IdentifierNormalizer.normalize(masterAlias);
        this.idString = IdentifierNormalizer.normalize(this.site + "_" + this.masterAlias);
        this.rawCondition = rawCondition == null ? "" : rawCondition;
        this.expression = IdentifierNormalizer.foldCharacters(this.rawCondition).strip().toLowerCase(Locale.ROOT);
        this.sourceRow = sourceRow;
        this.errors = new ErrorCollection(idString);
    }

    void startParsing() {
        if (state != ConditionState.UNPARSED) {
            throw new IllegalStateException("Condition " + idString + " has already been parsed");
        }
        state = ConditionState.PARSING;
    }

    void finishParsing(List<Token> tokens, List<Block> blocks, String aliasExpression, boolean valid) {
        if (state != ConditionState.PARSING) {
            throw new IllegalStateException("Condition " + idString + " is not being parsed");
        }
        this.tokens = List.copyOf(tokens);
        this.blocks = List.copyOf(blocks);
        this.aliasExpression = aliasExpression;
        this.state = valid ? ConditionState.VALID : ConditionState.INVALID;
    }

    /**
     * Record an error that excludes this condition from analysis.
     */
    public void invalidate(ErrorKind kind, String message) {
        errors.add(kind, message);
        if (state == ConditionState.VALID) {
            if (referenceErrors.isEmpty()) {
                log.warn("{} invalidated: {}", this, message);
            }
            state = ConditionState.INVALID;
        }
    }

    /**
     * Record an unresolved reference. The condition counts as invalid until
     * {@link #clearReferenceErrors()} is called.
     */
    public void rejectReference(String message) {
        TsaError error = TsaError.of(idString, ErrorKind.UNRESOLVED_REFERENCE, message);
        if (isValid()) {
            log.warn("{} has unresolved references: {}", this, message);
        }
        errors.add(error);
        if (!referenceErrors.contains(error)) {
            referenceErrors.add(error);
        }
    }

    /**
     * Drop the errors of the previous reference resolution.
     */
    public void clearReferenceErrors() {
        referenceErrors.forEach(errors::remove);
        referenceErrors.clear();
    }

    public String getSite() {
        return site;
    }

    public String getMasterAlias() {
        return masterAlias;
    }

    /**
     * Unique identifier {@code site_masterAlias}.
     */
    public String getIdString() {
        return idString;
    }

    public String getRawCondition() {
        return rawCondition;
    }

    /**
     * Expression text after folding, trimming and lowercasing.
     */
    public String getExpression() {
        return expression;
    }

    public Optional<Integer> getSourceRow() {
        return Optional.ofNullable(sourceRow);
    }

    public ConditionState getState() {
        if (state == ConditionState.VALID && !referenceErrors.isEmpty()) {
            return ConditionState.INVALID;
        }
        return state;
    }

    public boolean isValid() {
        return getState() == ConditionState.VALID;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Unique blocks sorted by alias.
     */
    public List<Block> getBlocks() {
        return blocks;
    }

    public String getAliasExpression() {
        return aliasExpression;
    }

    /**
     * A condition is secondary if any of its blocks refers to another condition.
     */
    public boolean isSecondary() {
        return blocks.stream().anyMatch(Block::isSecondary);
    }

    public ErrorCollection getErrors() {
        return errors;
    }

    public Optional<Block> getBlock(String alias) {
        return blocks.stream().filter(b -> b.getAlias().equals(alias)).findFirst();
    }

    /**
     * Station identifiers used by primary blocks.
     */
    public Set<String> getStationIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Block block : blocks) {
            if (!block.isSecondary()) {
                ids.add(block.getPredicate().station());
            }
        }
        return ids;
    }

    /**
     * Identifiers of the conditions referenced by secondary blocks.
     */
    public Set<String> getReferences() {
        Set<String> references = new LinkedHashSet<>();
        for (Block block : blocks) {
            if (block.isSecondary()) {
                references.add(block.getReference());
            }
        }
        return references;
    }

    @Override
    public String toString() {
        String kind;
        if (!state.isTerminal()) {
            kind = "Unknown";
        } else {
            kind = isSecondary() ? "Secondary" : "Primary";
        }
        return kind + " Condition <" + idString + "> with " + blocks.size() + " Blocks";
    }
}
