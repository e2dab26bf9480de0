package com.mathtex.core.model;

import java.util.Objects;

/**
 * An alignment point: {@code &}, {@code &&}. Has no linear markup form.
 *
 * @param index the alignment point's index, starting at 1
 * @param span source location
 */
public record AlignPoint(
    int index,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public AlignPoint {
        Objects.requireNonNull(span, "span must not be null");
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive, got " + index);
        }
    }

    public AlignPoint(int index) {
        this(index, SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitAlignPoint(this);
    }
}
