package com.mathtex.core.model;

import com.mathtex.core.error.TexifyException;
import com.mathtex.core.symbol.AccentNormalizer;

import java.util.Objects;

/**
 * An accented node, e.g. {@code acc(a, ->)}.
 *
 * <p>The accent is stored as its canonical combining codepoint (U+0300 grave, U+0303
 * tilde, U+20D7 arrow, ...). Use {@link #of(MathNode, MathNode, SourceSpan)} to build
 * an accent from a typed operand such as {@code ~} or {@code tilde}; it normalizes the
 * operand and fails with a {@link TexifyException} if the operand is not an accent.
 *
 * @param base the node the accent is applied to, may span several letters
 * @param accent canonical combining accent codepoint
 * @param span source location
 */
public record Accent(
    MathNode base,
    int accent,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if {@code accent} is not a canonical accent
     */
    public Accent {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(span, "span must not be null");
        if (!AccentNormalizer.isCanonical(accent)) {
            throw new IllegalArgumentException(
                String.format("not a canonical accent: U+%04X", accent));
        }
    }

    public Accent(MathNode base, int accent) {
        this(base, accent, SourceSpan.detached());
    }

    /**
     * Builds an accent from an operand as the user typed it.
     *
     * @param base accent base
     * @param operand accent operand: a one-character atom or a symbol, possibly wrapped
     *                in a single-child formula or sequence; null if missing
     * @param span location of the operand, reported on failure
     * @return the accent node
     * @throws TexifyException if the operand is not an accent or names an unknown symbol
     */
    public static Accent of(MathNode base, MathNode operand, SourceSpan span) throws TexifyException {
        return of(base, operand, span, AccentNormalizer.standard());
    }

    /**
     * Builds an accent, resolving symbol operands with the given normalizer.
     *
     * @param base accent base
     * @param operand accent operand, null if missing
     * @param span location of the operand, reported on failure
     * @param normalizer normalizer to resolve the operand with
     * @return the accent node
     * @throws TexifyException if the operand is not an accent or names an unknown symbol
     */
    public static Accent of(MathNode base, MathNode operand, SourceSpan span,
                            AccentNormalizer normalizer) throws TexifyException {
        int accent = normalizer.normalize(operand, span);
        return new Accent(base, accent, span);
    }

    /**
     * Builds an accent, reporting failures at the operand's own location.
     *
     * @param base accent base
     * @param operand accent operand, null if missing
     * @return the accent node
     * @throws TexifyException if the operand is not an accent or names an unknown symbol
     */
    public static Accent of(MathNode base, MathNode operand) throws TexifyException {
        return of(base, operand, operand != null ? operand.span() : SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitAccent(this);
    }
}
