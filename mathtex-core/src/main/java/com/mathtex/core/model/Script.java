package com.mathtex.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A base with an optional subscript and an optional superscript: {@code a_i},
 * {@code 2^(1+i)}.
 *
 * @param base the scripted node
 * @param sub the subscript, or null if absent
 * @param sup the superscript, or null if absent
 * @param span source location
 */
public record Script(
    MathNode base,
    MathNode sub,
    MathNode sup,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Script {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    public Script(MathNode base, MathNode sub, MathNode sup) {
        this(base, sub, sup, SourceSpan.detached());
    }

    public Optional<MathNode> subscript() {
        return Optional.ofNullable(sub);
    }

    public Optional<MathNode> superscript() {
        return Optional.ofNullable(sup);
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitScript(this);
    }
}
