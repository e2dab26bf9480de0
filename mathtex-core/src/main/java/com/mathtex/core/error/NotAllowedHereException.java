package com.mathtex.core.error;

import com.mathtex.core.model.SourceSpan;

/**
 * A node with no inline markup representation appeared inside a formula.
 *
 * <p>Every current node kind has a markup form ({@code AlignPoint} writes nothing), so
 * the converter never raises this; it is kept for node kinds that cannot be written
 * inline.
 */
public class NotAllowedHereException extends TexifyException {

    public NotAllowedHereException(String what, SourceSpan span) {
        super(what + " is not allowed here", span);
    }
}
