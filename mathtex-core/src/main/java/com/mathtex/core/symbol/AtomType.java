package com.mathtex.core.symbol;

import java.util.Arrays;

/**
 * Math class of a symbol, following the classes used by Unicode math fonts.
 */
public enum AtomType {
    /** Letters and letter-like symbols (α, ℝ, ∂) */
    ALPHA("alpha"),

    /** Ordinary symbols (∞, ∀) */
    ORDINARY("ordinary"),

    /** Binary operators (±, ×) */
    BINARY("binary"),

    /** Relations (=, ≤, →) */
    RELATION("relation"),

    /** Large operators (∑, ∫) */
    OPERATOR("operator"),

    /** Opening delimiters (⟨, ⌈) */
    OPENING("opening"),

    /** Closing delimiters (⟩, ⌉) */
    CLOSING("closing"),

    /** Delimiters that both open and close (|, ‖) */
    FENCE("fence"),

    /** Punctuation */
    PUNCTUATION("punctuation"),

    /** Combining accents placed above the base */
    ACCENT("accent"),

    /** Combining accents placed below the base */
    BOTTOM_ACCENT("bottom-accent"),

    /** Wide constructions over the base (overbrace) */
    OVER("over"),

    /** Wide constructions under the base (underbrace) */
    UNDER("under");

    private final String id;

    AtomType(String id) {
        this.id = id;
    }

    /**
     * Returns the identifier used in symbol files.
     *
     * @return lowercase identifier
     */
    public String id() {
        return id;
    }

    /**
     * Parses a symbol file identifier.
     *
     * @param id identifier such as "relation" or "bottom-accent"
     * @return matching atom type
     * @throws IllegalArgumentException if no type has that identifier
     */
    public static AtomType fromId(String id) {
        return Arrays.stream(values())
            .filter(type -> type.id.equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown atom class: " + id));
    }
}
