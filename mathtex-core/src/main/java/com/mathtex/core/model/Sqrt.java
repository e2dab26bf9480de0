package com.mathtex.core.model;

import java.util.Objects;

/**
 * A square root. Non-square roots are not supported.
 *
 * @param body the expression to take the square root of
 * @param span source location
 */
public record Sqrt(
    MathNode body,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Sqrt {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    public Sqrt(MathNode body) {
        this(body, SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitSqrt(this);
    }
}
