package com.mathtex.core.model;

import java.util.Objects;

/**
 * Opaque location of a node in the document it was built from.
 *
 * <p>Spans are threaded through unchanged into every error raised for a node. The
 * {@code pointer} is a JSON Pointer when the node came from a formula document, but
 * callers must not interpret it beyond printing it.
 *
 * @param source name of the originating document (file name, "stdin", ...)
 * @param pointer position of the node inside that document
 */
public record SourceSpan(
    String source,
    String pointer
) {
    private static final SourceSpan DETACHED = new SourceSpan("<detached>", "");

    /**
     * Compact constructor with validation.
     */
    public SourceSpan {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(pointer, "pointer must not be null");
    }

    /**
     * Returns the span used for nodes built in code rather than read from a document.
     *
     * @return the shared detached span
     */
    public static SourceSpan detached() {
        return DETACHED;
    }

    /**
     * Creates the span of a document root.
     *
     * @param source document name
     * @return span pointing at the whole document
     */
    public static SourceSpan root(String source) {
        return new SourceSpan(source, "");
    }

    /**
     * Returns whether this span carries no real location.
     *
     * @return true for {@link #detached()}
     */
    public boolean isDetached() {
        return this.equals(DETACHED);
    }

    /**
     * Returns the span of a child member or array element of this node.
     *
     * @param segment member name or array index
     * @return span one level deeper
     */
    public SourceSpan child(String segment) {
        String escaped = segment.replace("~", "~0").replace("/", "~1");
        return new SourceSpan(source, pointer + "/" + escaped);
    }

    /**
     * Returns the span of an array element of this node.
     *
     * @param index element index
     * @return span one level deeper
     */
    public SourceSpan child(int index) {
        return child(Integer.toString(index));
    }

    @Override
    public String toString() {
        if (isDetached()) {
            return source;
        }
        return pointer.isEmpty() ? source : source + "#" + pointer;
    }
}
