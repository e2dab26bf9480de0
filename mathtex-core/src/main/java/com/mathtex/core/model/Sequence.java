package com.mathtex.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Plain concatenation of nodes. No separator is inserted between children; only
 * embedded {@link Space} nodes produce one.
 *
 * @param children the concatenated nodes, in order
 * @param span source location
 */
public record Sequence(
    List<MathNode> children,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Sequence {
        Objects.requireNonNull(children, "children must not be null");
        Objects.requireNonNull(span, "span must not be null");
        children = List.copyOf(children);
    }

    public Sequence(List<MathNode> children) {
        this(children, SourceSpan.detached());
    }

    /**
     * Creates a sequence of the given nodes.
     *
     * @param children nodes to concatenate
     * @return the sequence
     */
    public static Sequence of(MathNode... children) {
        return new Sequence(List.of(children));
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitSequence(this);
    }
}
