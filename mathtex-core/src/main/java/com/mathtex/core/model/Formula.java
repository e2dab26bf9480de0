package com.mathtex.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A mathematical formula: the root container of a formula tree.
 *
 * <p>Block formulas are displayed as a separate, centered block; inline formulas flow
 * with the surrounding text. Only a root formula may be a block: a nested block
 * formula has no inline markup representation.
 *
 * @param block whether the formula is displayed as a separate block
 * @param children the pieces of the formula, in order
 * @param span source location
 */
public record Formula(
    boolean block,
    List<MathNode> children,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Formula {
        Objects.requireNonNull(children, "children must not be null");
        Objects.requireNonNull(span, "span must not be null");
        children = List.copyOf(children);
    }

    public Formula(boolean block, List<MathNode> children) {
        this(block, children, SourceSpan.detached());
    }

    /**
     * Creates an inline formula.
     *
     * @param children formula pieces
     * @return inline formula
     */
    public static Formula inline(MathNode... children) {
        return new Formula(false, List.of(children));
    }

    /**
     * Creates a block formula.
     *
     * @param children formula pieces
     * @return block formula
     */
    public static Formula block(MathNode... children) {
        return new Formula(true, List.of(children));
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitFormula(this);
    }
}
