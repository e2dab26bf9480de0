package com.mathtex.core.model;

import java.util.Objects;

/**
 * A fraction. One layer of explicit grouping parentheses around either operand is
 * implicit and not rendered: {@code (x+1)/2} shows no parentheses, {@code ((x+1))/2}
 * shows one pair.
 *
 * @param num the numerator
 * @param denom the denominator
 * @param span source location
 */
public record Fraction(
    MathNode num,
    MathNode denom,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Fraction {
        Objects.requireNonNull(num, "num must not be null");
        Objects.requireNonNull(denom, "denom must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    public Fraction(MathNode num, MathNode denom) {
        this(num, denom, SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitFraction(this);
    }
}
