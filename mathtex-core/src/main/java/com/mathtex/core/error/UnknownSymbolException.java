package com.mathtex.core.error;

import com.mathtex.core.model.SourceSpan;

/**
 * A symbol name has no entry in the symbol table.
 */
public class UnknownSymbolException extends TexifyException {

    private final String name;

    public UnknownSymbolException(String name, SourceSpan span) {
        super("unknown symbol: " + name, span);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
