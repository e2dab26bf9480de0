package com.mathtex.core.model;

import java.util.Objects;

/**
 * A binomial coefficient.
 *
 * @param upper the upper index
 * @param lower the lower index
 * @param span source location
 */
public record Binomial(
    MathNode upper,
    MathNode lower,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Binomial {
        Objects.requireNonNull(upper, "upper must not be null");
        Objects.requireNonNull(lower, "lower must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    public Binomial(MathNode upper, MathNode lower) {
        this(upper, lower, SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitBinomial(this);
    }
}
