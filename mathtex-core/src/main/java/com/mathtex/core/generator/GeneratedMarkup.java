package com.mathtex.core.generator;

import java.util.Objects;

/**
 * Markup generated for one formula.
 *
 * @param content the markup, delimited as configured
 * @param block whether the formula is displayed as a separate block
 */
public record GeneratedMarkup(
    String content,
    boolean block
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedMarkup {
        Objects.requireNonNull(content, "content must not be null");
    }
}
