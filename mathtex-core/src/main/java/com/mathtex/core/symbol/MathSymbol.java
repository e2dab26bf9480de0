package com.mathtex.core.symbol;

import java.util.Objects;

/**
 * A symbol table entry: a codepoint and the markup command that renders it.
 *
 * @param codepoint Unicode codepoint
 * @param command markup command name, without the leading backslash
 * @param type math class of the symbol
 */
public record MathSymbol(
    int codepoint,
    String command,
    AtomType type
) {
    /**
     * Compact constructor with validation.
     */
    public MathSymbol {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (!Character.isValidCodePoint(codepoint)) {
            throw new IllegalArgumentException("Invalid codepoint: " + codepoint);
        }
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
    }

    public boolean isAccent() {
        return type == AtomType.ACCENT;
    }

    /**
     * Formats the codepoint in {@code U+XXXX} notation.
     *
     * @return formatted codepoint
     */
    public String formattedCodepoint() {
        return SymbolTable.formatCodepoint(codepoint);
    }
}
