package com.mathtex.core.model;

import java.util.Objects;

/**
 * A ceiled expression.
 *
 * @param body the expression to ceil
 * @param span source location
 */
public record Ceil(
    MathNode body,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Ceil {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    public Ceil(MathNode body) {
        this(body, SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitCeil(this);
    }
}
