package com.mathtex.core.model;

import java.util.Objects;

/**
 * A floored expression.
 *
 * @param body the expression to floor
 * @param span source location
 */
public record Floor(
    MathNode body,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Floor {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    public Floor(MathNode body) {
        this(body, SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitFloor(this);
    }
}
