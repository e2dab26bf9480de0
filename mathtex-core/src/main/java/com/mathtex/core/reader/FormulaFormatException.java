package com.mathtex.core.reader;

import com.mathtex.core.model.SourceSpan;

import java.io.IOException;

/**
 * A formula document does not describe a valid formula tree.
 */
public class FormulaFormatException extends IOException {

    private final SourceSpan span;

    public FormulaFormatException(String message, SourceSpan span) {
        super(message + " (at " + span + ")");
        this.span = span;
    }

    public SourceSpan span() {
        return span;
    }
}
