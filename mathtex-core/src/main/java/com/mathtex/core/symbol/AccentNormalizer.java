package com.mathtex.core.symbol;

import com.mathtex.core.error.NotAnAccentException;
import com.mathtex.core.error.TexifyException;
import com.mathtex.core.error.UnknownSymbolException;
import com.mathtex.core.model.Atom;
import com.mathtex.core.model.Formula;
import com.mathtex.core.model.MathNode;
import com.mathtex.core.model.Sequence;
import com.mathtex.core.model.SourceSpan;
import com.mathtex.core.model.Symbol;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps an accent operand to its canonical combining accent codepoint.
 *
 * <p>Every supported accent accepts its combining codepoint plus the characters people
 * actually type for it:
 * <ul>
 *   <li>Grave: {@code `}</li>
 *   <li>Acute: {@code ´}</li>
 *   <li>Circumflex: {@code ^}</li>
 *   <li>Tilde: {@code ~}, {@code ∼}</li>
 *   <li>Macron: {@code ¯}</li>
 *   <li>Overline: {@code ‾}</li>
 *   <li>Breve: {@code ˘}</li>
 *   <li>Dot: {@code .}, {@code ⋅}</li>
 *   <li>Diaeresis: {@code ¨}</li>
 *   <li>Caron: {@code ˇ}</li>
 *   <li>Arrow: {@code →}</li>
 * </ul>
 *
 * <p>Operands naming a symbol ({@code tilde}, {@code arrow.r}) are resolved through the
 * symbol table first.
 */
public final class AccentNormalizer {

    public static final int GRAVE = 0x0300;
    public static final int ACUTE = 0x0301;
    public static final int CIRCUMFLEX = 0x0302;
    public static final int TILDE = 0x0303;
    public static final int MACRON = 0x0304;
    public static final int OVERLINE = 0x0305;
    public static final int BREVE = 0x0306;
    public static final int DOT = 0x0307;
    public static final int DIAERESIS = 0x0308;
    public static final int CARON = 0x030C;
    public static final int ARROW = 0x20D7;

    private static final Map<Integer, Integer> EQUIVALENTS = equivalents();
    private static final Set<Integer> CANONICAL = Collections.unmodifiableSet(new TreeSet<>(EQUIVALENTS.values()));

    private final SymbolTable symbols;

    public AccentNormalizer(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
    }

    /**
     * Returns the normalizer backed by the standard symbol table.
     *
     * @return shared normalizer
     */
    public static AccentNormalizer standard() {
        return StandardHolder.STANDARD;
    }

    /**
     * Maps a character to its canonical accent.
     *
     * @param codepoint typed or combining accent character
     * @return canonical combining codepoint, or empty if the character is no accent
     */
    public static OptionalInt canonicalize(int codepoint) {
        Integer canonical = EQUIVALENTS.get(codepoint);
        return canonical == null ? OptionalInt.empty() : OptionalInt.of(canonical);
    }

    /**
     * Returns whether a codepoint is one of the canonical combining accents.
     *
     * @param codepoint Unicode codepoint
     * @return true for canonical accents
     */
    public static boolean isCanonical(int codepoint) {
        return CANONICAL.contains(codepoint);
    }

    /**
     * Returns the canonical combining accents, in codepoint order.
     *
     * @return unmodifiable set of codepoints
     */
    public static Set<Integer> canonicalAccents() {
        return CANONICAL;
    }

    /**
     * Normalizes an accent operand.
     *
     * <p>The operand must reduce to exactly one character: a one-codepoint {@link Atom} or
     * a {@link Symbol}, optionally wrapped in a {@link Formula} or {@link Sequence} with a
     * single child.
     *
     * @param operand accent operand, null if missing
     * @param span location reported on failure
     * @return canonical combining codepoint
     * @throws UnknownSymbolException if a symbol operand has no table entry
     * @throws NotAnAccentException if the operand has any other shape or no accent equivalent
     */
    public int normalize(MathNode operand, SourceSpan span) throws TexifyException {
        if (operand == null) {
            throw new NotAnAccentException("missing accent", span);
        }

        int codepoint = character(unwrap(operand), span);
        return canonicalize(codepoint).orElseThrow(() -> new NotAnAccentException(
            new String(Character.toChars(codepoint)) + " (" + SymbolTable.formatCodepoint(codepoint) + ")", span));
    }

    private int character(MathNode operand, SourceSpan span) throws TexifyException {
        if (operand instanceof Atom atom) {
            String text = atom.text();
            if (text.codePointCount(0, text.length()) != 1) {
                throw new NotAnAccentException("expected a single character, got \"" + text + "\"", span);
            }
            return text.codePointAt(0);
        }
        if (operand instanceof Symbol symbol) {
            return symbols.resolve(symbol.name())
                .orElseThrow(() -> new UnknownSymbolException(symbol.name(), span));
        }
        throw new NotAnAccentException("expected a single character", span);
    }

    private static MathNode unwrap(MathNode operand) {
        MathNode current = operand;
        while (true) {
            List<MathNode> children;
            if (current instanceof Formula formula) {
                children = formula.children();
            } else if (current instanceof Sequence sequence) {
                children = sequence.children();
            } else {
                return current;
            }
            if (children.size() != 1) {
                return current;
            }
            current = children.get(0);
        }
    }

    private static Map<Integer, Integer> equivalents() {
        Map<Integer, Integer> map = new HashMap<>();
        accept(map, GRAVE, '`');
        accept(map, ACUTE, '´');
        accept(map, CIRCUMFLEX, '^');
        accept(map, TILDE, '~', '∼');
        accept(map, MACRON, '¯');
        accept(map, OVERLINE, '‾');
        accept(map, BREVE, '˘');
        accept(map, DOT, '.', '⋅');
        accept(map, DIAERESIS, '¨');
        accept(map, CARON, 'ˇ');
        accept(map, ARROW, '→');
        return Map.copyOf(map);
    }

    private static void accept(Map<Integer, Integer> map, int canonical, int... aliases) {
        map.put(canonical, canonical);
        for (int alias : aliases) {
            map.put(alias, canonical);
        }
    }

    private static final class StandardHolder {
        private static final AccentNormalizer STANDARD = new AccentNormalizer(SymbolTable.standard());
    }
}
