package com.mathtex.core.model;

import java.util.Objects;

/**
 * A hard line break.
 *
 * @param span source location
 */
public record ForcedBreak(SourceSpan span) implements MathNode {

    public ForcedBreak {
        Objects.requireNonNull(span, "span must not be null");
    }

    public ForcedBreak() {
        this(SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitForcedBreak(this);
    }
}
