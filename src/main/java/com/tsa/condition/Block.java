package com.tsa.condition;

import java.util.Objects;

/**
 * A named operand of a condition.
 * <p>
 * A primary block wraps one {@link Predicate} on one station/sensor; a secondary
 * block refers to another condition by its identifier. The alias is
 * {@code masterAlias + "_" + orderNumber}, so aliases are scoped by the owning
 * condition. Blocks are immutable.
 */
public final class Block {

    private final String masterAlias;
    private final int orderNumber;
    private final String alias;
    private final Predicate predicate;
    private final String reference;
    private final String rawText;

    private Block(String masterAlias, int orderNumber, Predicate predicate, String reference, String rawText) {
        this.masterAlias = Objects.requireNonNull(masterAlias, "masterAlias");
        this.orderNumber = orderNumber;
        this.alias = masterAlias + "_" + orderNumber;
        this.predicate = predicate;
        this.reference = reference;
        this.rawText = rawText;
    }

    /**
     * Create a primary block.
     */
    public static Block primary(String masterAlias, int orderNumber, Predicate predicate, String rawText) {
        return new Block(masterAlias, orderNumber, Objects.requireNonNull(predicate, "predicate"), null, rawText);
    }

    /**
     * Create a secondary block referring to another condition.
     *
     * @param reference Normalized identifier of the referenced condition
     */
    public static Block secondary(String masterAlias, int orderNumber, String reference, String rawText) {
        return new Block(masterAlias, orderNumber, null, Objects.requireNonNull(reference, "reference"), rawText);
    }

    /**
     * Key under which logically identical blocks are deduplicated.
     */
    public String key() {
        return isSecondary() ? "ref:" + reference : predicate.key();
    }

    public String getMasterAlias() {
        return masterAlias;
    }

    public int getOrderNumber() {
        return orderNumber;
    }

    public String getAlias() {
        return alias;
    }

    public boolean isSecondary() {
        return reference != null;
    }

    /**
     * Predicate of a primary block; null for secondary blocks.
     */
    public Predicate getPredicate() {
        return predicate;
    }

    /**
     * Referenced condition identifier of a secondary block; null for primary blocks.
     */
    public String getReference() {
        return reference;
    }

    /**
     * Operand text as written in the expression.
     */
    public String getRawText() {
        return rawText;
    }

    /**
     * Normalized operand text: the predicate or the referenced identifier.
     */
    public String getCanonicalText() {
        return isSecondary() ? reference : predicate.toString();
    }

    @Override
    public String toString() {
        return (isSecondary() ? "SecondaryBlock<" : "PrimaryBlock<") + alias + ": " + getCanonicalText() + ">";
    }
}
