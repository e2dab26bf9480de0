package com.mathtex.core.model;

import java.util.Objects;

/**
 * A reference to a named symbol, such as {@code arrow.r} or {@code alpha}.
 *
 * <p>The name is resolved against the symbol table when the formula is converted.
 *
 * @param name symbol identifier
 * @param span source location
 */
public record Symbol(
    String name,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Symbol {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(span, "span must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public Symbol(String name) {
        this(name, SourceSpan.detached());
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitSymbol(this);
    }
}
