package com.mathtex.core.model;

import java.util.Objects;

/**
 * Text rendered upright and verbatim inside a formula, e.g. {@code "if"}.
 *
 * @param text the text
 * @param span source location
 */
public record LiteralText(
    String text,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public LiteralText {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    public LiteralText(String text) {
        this(text, SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitLiteralText(this);
    }
}
