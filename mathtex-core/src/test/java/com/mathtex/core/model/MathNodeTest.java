package com.mathtex.core.model;

import com.mathtex.core.error.NotAnAccentException;
import com.mathtex.core.error.UnknownSymbolException;
import com.mathtex.core.symbol.AccentNormalizer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the formula node records.
 */
class MathNodeTest {

    @Test
    void atom_withEmptyText_throwsException() {
        assertThatThrownBy(() -> new Atom(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("text must not be empty");
    }

    @Test
    void atom_countsGraphemes() {
        assertThat(new Atom("x").graphemeCount()).isEqualTo(1);
        assertThat(new Atom("sin").graphemeCount()).isEqualTo(3);
        assertThat(new Atom("e\u0301").graphemeCount()).isEqualTo(1);
        assertThat(new Atom("e\u0301").isSingleGrapheme()).isTrue();
        assertThat(new Atom("ab").isSingleGrapheme()).isFalse();
    }

    @Test
    void atom_withoutSpan_isDetached() {
        assertThat(new Atom("x").span().isDetached()).isTrue();
    }

    @Test
    void symbol_withBlankName_throwsException() {
        assertThatThrownBy(() -> new Symbol(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formula_copiesChildren() {
        List<MathNode> children = new ArrayList<>();
        children.add(new Atom("x"));
        Formula formula = new Formula(false, children);

        children.add(new Atom("y"));

        assertThat(formula.children()).hasSize(1);
        assertThatThrownBy(() -> formula.children().add(new Atom("z")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void formula_factoriesSetBlockFlag() {
        assertThat(Formula.inline(new Atom("x")).block()).isFalse();
        assertThat(Formula.block(new Atom("x")).block()).isTrue();
    }

    @Test
    void script_exposesOptionalScripts() {
        Script script = new Script(new Atom("a"), new Atom("i"), null);

        assertThat(script.subscript()).contains(new Atom("i"));
        assertThat(script.superscript()).isEmpty();
    }

    @Test
    void alignPoint_withZeroIndex_throwsException() {
        assertThatThrownBy(() -> new AlignPoint(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void accent_withNonCanonicalAccent_throwsException() {
        assertThatThrownBy(() -> new Accent(new Atom("a"), '~'))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("U+007E");
    }

    @Test
    void accentOf_normalizesTypedOperand() throws Exception {
        Accent typed = Accent.of(new Atom("a"), new Atom("~"));
        Accent named = Accent.of(new Atom("a"), new Symbol("tilde"));
        Accent combining = Accent.of(new Atom("a"), new Atom("\u0303"));

        assertThat(typed.accent()).isEqualTo(AccentNormalizer.TILDE);
        assertThat(named).isEqualTo(typed);
        assertThat(combining).isEqualTo(typed);
    }

    @Test
    void accentOf_withTwoCharacters_reportsOperandSpan() {
        SourceSpan span = SourceSpan.root("f.json").child("accent");

        assertThatThrownBy(() -> Accent.of(new Atom("a"), new Atom("~~", span)))
            .isInstanceOf(NotAnAccentException.class)
            .satisfies(e -> assertThat(((NotAnAccentException) e).span()).isEqualTo(span));
    }

    @Test
    void accentOf_withUnknownSymbol_throwsUnknownSymbol() {
        assertThatThrownBy(() -> Accent.of(new Atom("a"), new Symbol("nope")))
            .isInstanceOf(UnknownSymbolException.class)
            .hasMessage("unknown symbol: nope");
    }
}
