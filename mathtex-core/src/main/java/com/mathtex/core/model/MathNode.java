package com.mathtex.core.model;

/**
 * A node of a formula tree.
 *
 * <p>The variant set is closed: every node is exactly one of the permitted records.
 * Nodes are immutable, own their children exclusively and carry the {@link SourceSpan}
 * that errors raised for them report. Code that needs to branch on the variant goes
 * through {@link #accept(MathNodeVisitor)}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * MathNode half = new Fraction(new Atom("1"), new Atom("2"));
 * String tex = new Texifier().texify(half); // \frac{1}{2}
 * }</pre>
 */
public sealed interface MathNode
    permits Formula, Atom, Symbol, LiteralText, Space, ForcedBreak, Sequence,
            Accent, Fraction, Binomial, Script, AlignPoint, Sqrt, Floor, Ceil {

    /**
     * Returns the location this node was built from.
     *
     * @return source span, never null
     */
    SourceSpan span();

    /**
     * Dispatches to the visitor method for this variant.
     *
     * @param visitor visitor to call
     * @param <R> visitor result type
     * @param <X> exception type the visitor may throw
     * @return the visitor's result
     * @throws X if the visitor fails
     */
    <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X;
}
