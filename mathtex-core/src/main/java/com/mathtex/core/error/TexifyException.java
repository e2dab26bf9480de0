package com.mathtex.core.error;

import com.mathtex.core.model.SourceSpan;

import java.util.Objects;

/**
 * Base class of the structural failures raised while building or converting a formula.
 *
 * <p>Failures are deterministic: they are raised where they are detected, carry the
 * location of the node that triggered them and unwind the whole conversion. Turning
 * them into user-facing diagnostics is up to the caller of the top-level conversion.
 *
 * @see UnknownSymbolException
 * @see NotAllowedHereException
 * @see NotAnAccentException
 */
public abstract class TexifyException extends Exception {

    private final SourceSpan span;

    protected TexifyException(String message, SourceSpan span) {
        super(message);
        this.span = Objects.requireNonNull(span, "span must not be null");
    }

    /**
     * Returns the location of the node that triggered this failure.
     *
     * @return source span
     */
    public SourceSpan span() {
        return span;
    }

    /**
     * Formats the message together with its location.
     *
     * @return message suitable for a diagnostic line
     */
    public String describe() {
        return span.isDetached() ? getMessage() : getMessage() + " (at " + span + ")";
    }
}
