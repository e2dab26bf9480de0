package com.mathtex.core.generator;

/**
 * Configuration for markup generation.
 *
 * @param delimiters delimiters wrapped around the generated markup
 */
public record GeneratorConfig(
    DelimiterStyle delimiters
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (delimiters == null) {
            delimiters = DelimiterStyle.NONE;
        }
    }

    /**
     * Creates a default configuration producing bare markup.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DelimiterStyle.NONE);
    }
}
