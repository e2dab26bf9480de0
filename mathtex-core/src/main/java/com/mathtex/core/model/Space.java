package com.mathtex.core.model;

import java.util.Objects;

/**
 * A weak space between two pieces of a formula.
 *
 * @param span source location
 */
public record Space(SourceSpan span) implements MathNode {

    public Space {
        Objects.requireNonNull(span, "span must not be null");
    }

    public Space() {
        this(SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitSpace(this);
    }
}
