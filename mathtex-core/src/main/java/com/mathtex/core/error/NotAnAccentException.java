package com.mathtex.core.error;

import com.mathtex.core.model.SourceSpan;

/**
 * An accent operand is missing, spans more than one character, or is a character
 * with no accent equivalent.
 */
public class NotAnAccentException extends TexifyException {

    public NotAnAccentException(String detail, SourceSpan span) {
        super("not an accent: " + detail, span);
    }
}
