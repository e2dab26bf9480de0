package com.mathtex.core.texify;

import com.mathtex.core.symbol.MathSymbol;
import com.mathtex.core.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates the markup of one conversion.
 *
 * <p>Spaces are weak: {@link #recordWeakSpace()} only notes that a space was seen. The
 * next write decides whether it becomes a visible explicit space, which happens only
 * if a neighboring position was marked with {@link #markSupport()}. Named commands
 * are marked this way so they never glue onto following text, while plain characters
 * may abut each other without a separator.
 *
 * <p>A builder is single-use: {@link #finish()} hands out the buffer and any later
 * write fails.
 */
public final class TexBuilder {

    private static final Logger log = LoggerFactory.getLogger(TexBuilder.class);

    static final String EXPLICIT_SPACE = "\\ ";
    static final String LEFT = "\\left";
    static final String RIGHT = "\\right";

    private final SymbolTable symbols;
    private final StringBuilder tex = new StringBuilder();
    private boolean space;
    private boolean support;
    private boolean finished;

    public TexBuilder(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
    }

    /**
     * Records a weak space. Spaces before any output are dropped and consecutive
     * spaces collapse into one.
     */
    public void recordWeakSpace() {
        ensureOpen();
        space = tex.length() > 0;
    }

    /**
     * Marks the current position as one where an adjacent weak space may become visible.
     */
    public void markSupport() {
        ensureOpen();
        support = true;
    }

    /**
     * Writes markup unchanged, after settling any pending space.
     *
     * @param markup markup to append
     */
    public void pushVerbatim(String markup) {
        flush();
        tex.append(markup);
    }

    /**
     * Writes one character, escaped for math markup, after settling any pending space.
     *
     * <p>Characters without a markup form are dropped.
     *
     * @param codepoint character to write
     */
    public void pushEscaped(int codepoint) {
        flush();
        switch (codepoint) {
            case ' ' -> tex.append(EXPLICIT_SPACE);
            case '%', '&', '$', '#' -> tex.append('\\').appendCodePoint(codepoint).append(' ');
            case '{' -> tex.append(LEFT).append("\\{");
            case '}' -> tex.append(RIGHT).append("\\}");
            case '(', '[' -> tex.append(LEFT).appendCodePoint(codepoint);
            case ')', ']' -> tex.append(RIGHT).appendCodePoint(codepoint);
            default -> {
                if (passesThrough(codepoint)) {
                    tex.appendCodePoint(codepoint);
                } else {
                    pushCommand(codepoint);
                }
            }
        }
    }

    /**
     * Returns the markup written so far and closes the builder. A pending weak space is
     * dropped.
     *
     * @return the markup
     */
    public String finish() {
        ensureOpen();
        finished = true;
        return tex.toString();
    }

    private void pushCommand(int codepoint) {
        Optional<MathSymbol> symbol = symbols.lookup(codepoint);
        if (symbol.isPresent()) {
            tex.append('\\').append(symbol.get().command()).append(' ');
        } else {
            // TODO: decide with the renderer owners whether unmapped characters should fail the conversion
            log.debug("Dropping {} with no markup command", SymbolTable.formatCodepoint(codepoint));
        }
    }

    private void flush() {
        ensureOpen();
        if (space && support) {
            tex.append(EXPLICIT_SPACE);
        }
        space = false;
        support = false;
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("TexBuilder already finished");
        }
    }

    static boolean passesThrough(int c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9')
            || (c >= 'Α' && c <= 'Ω')
            || (c >= 'α' && c <= 'ω')
            || "*+-?!=<>:,;|/@.\"".indexOf(c) >= 0;
    }
}
