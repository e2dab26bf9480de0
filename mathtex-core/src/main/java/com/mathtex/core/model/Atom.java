package com.mathtex.core.model;

import java.text.BreakIterator;
import java.util.Objects;

/**
 * An atom in a formula: {@code x}, {@code +}, {@code 12}.
 *
 * <p>Single-grapheme atoms are rendered as math characters; atoms spanning several
 * graphemes are rendered upright, like {@link LiteralText}.
 *
 * @param text the atom's text, never empty
 * @param span source location
 */
public record Atom(
    String text,
    SourceSpan span
) implements MathNode {

    /**
     * Compact constructor with validation.
     */
    public Atom {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(span, "span must not be null");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
    }

    public Atom(String text) {
        this(text, SourceSpan.detached());
    }

    /**
     * Counts the user-perceived characters of the text.
     *
     * @return number of graphemes, at least one
     */
    public int graphemeCount() {
        BreakIterator graphemes = BreakIterator.getCharacterInstance();
        graphemes.setText(text);
        int count = 0;
        while (graphemes.next() != BreakIterator.DONE) {
            count++;
        }
        return count;
    }

    /**
     * Returns whether the text is a single grapheme.
     *
     * @return true for one user-perceived character
     */
    public boolean isSingleGrapheme() {
        return graphemeCount() == 1;
    }

    @Override
    public <R, X extends Exception> R accept(MathNodeVisitor<R, X> visitor) throws X {
        return visitor.visitAtom(this);
    }
}
