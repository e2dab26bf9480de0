package com.mathtex.core.generator;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;

/**
 * How generated markup is delimited for embedding in a host document.
 */
public enum DelimiterStyle {
    /** Bare markup */
    NONE("", "", "", ""),

    /** {@code $...$} inline, {@code $$...$$} for blocks */
    DOLLARS("$", "$", "$$", "$$"),

    /** {@code \(...\)} inline, {@code \[...\]} for blocks */
    BRACKETS("\\(", "\\)", "\\[", "\\]");

    private final String inlineOpen;
    private final String inlineClose;
    private final String blockOpen;
    private final String blockClose;

    DelimiterStyle(String inlineOpen, String inlineClose, String blockOpen, String blockClose) {
        this.inlineOpen = inlineOpen;
        this.inlineClose = inlineClose;
        this.blockOpen = blockOpen;
        this.blockClose = blockClose;
    }

    /**
     * Wraps markup in this style's delimiters.
     *
     * @param tex markup
     * @param block whether the formula is a block formula
     * @return delimited markup
     */
    public String wrap(String tex, boolean block) {
        return block ? blockOpen + tex + blockClose : inlineOpen + tex + inlineClose;
    }

    /**
     * Parses a style name, ignoring case.
     *
     * @param id style name such as "dollars"
     * @return the style
     * @throws IllegalArgumentException if no style has that name
     */
    @JsonCreator
    public static DelimiterStyle fromId(String id) {
        return Arrays.stream(values())
            .filter(style -> style.name().equals(id.toUpperCase(Locale.ROOT)))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown delimiter style: " + id + ". Use: none, dollars, or brackets"));
    }
}
