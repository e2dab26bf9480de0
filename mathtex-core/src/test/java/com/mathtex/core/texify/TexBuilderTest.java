package com.mathtex.core.texify;

import com.mathtex.core.symbol.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TexBuilder}.
 */
class TexBuilderTest {

    private TexBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TexBuilder(SymbolTable.standard());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '\'', value = {
        "x     | x",
        "Z     | Z",
        "7     | 7",
        "α     | α",
        "Ω     | Ω",
        "+     | +",
        "=     | =",
        "'%'   | '\\% '",
        "'&'   | '\\& '",
        "'$'   | '\\$ '",
        "'#'   | '\\# '",
        "'{'   | '\\left\\{'",
        "'}'   | '\\right\\}'",
        "(     | \\left(",
        "[     | \\left[",
        ")     | \\right)",
        "]     | \\right]",
        "'∞'   | '\\infty '",
        "'→'   | '\\rightarrow '",
        "'∑'   | '\\sum '",
        "'≤'   | '\\leq '"
    })
    void pushEscaped_writesMarkupForm(String character, String expected) {
        builder.pushEscaped(character.codePointAt(0));

        assertThat(builder.finish()).isEqualTo(expected);
    }

    @Test
    void pushEscaped_space_writesExplicitSpace() {
        builder.pushEscaped(' ');

        assertThat(builder.finish()).isEqualTo("\\ ");
    }

    @Test
    void pushEscaped_unmappedCharacter_isDropped() {
        builder.pushEscaped('a');
        builder.pushEscaped(0x2603);
        builder.pushEscaped('b');

        assertThat(builder.finish()).isEqualTo("ab");
    }

    @Test
    void weakSpace_withoutSupport_isDropped() {
        builder.pushVerbatim("a");
        builder.recordWeakSpace();
        builder.pushVerbatim("b");

        assertThat(builder.finish()).isEqualTo("ab");
    }

    @Test
    void weakSpace_withSupportBefore_becomesExplicit() {
        builder.pushVerbatim("a");
        builder.markSupport();
        builder.recordWeakSpace();
        builder.pushVerbatim("b");

        assertThat(builder.finish()).isEqualTo("a\\ b");
    }

    @Test
    void weakSpace_withSupportAfter_becomesExplicit() {
        builder.pushVerbatim("a");
        builder.recordWeakSpace();
        builder.markSupport();
        builder.pushVerbatim("b");

        assertThat(builder.finish()).isEqualTo("a\\ b");
    }

    @Test
    void weakSpace_repeated_collapses() {
        builder.pushVerbatim("a");
        builder.markSupport();
        builder.recordWeakSpace();
        builder.recordWeakSpace();
        builder.pushVerbatim("b");

        assertThat(builder.finish()).isEqualTo("a\\ b");
    }

    @Test
    void weakSpace_beforeAnyOutput_isDropped() {
        builder.markSupport();
        builder.recordWeakSpace();
        builder.pushVerbatim("a");

        assertThat(builder.finish()).isEqualTo("a");
    }

    @Test
    void weakSpace_atEnd_isDropped() {
        builder.pushVerbatim("a");
        builder.markSupport();
        builder.recordWeakSpace();

        assertThat(builder.finish()).isEqualTo("a");
    }

    @Test
    void support_isConsumedByNextWrite() {
        builder.markSupport();
        builder.pushVerbatim("a");
        builder.recordWeakSpace();
        builder.pushVerbatim("b");

        assertThat(builder.finish()).isEqualTo("ab");
    }

    @Test
    void finish_twice_throwsException() {
        builder.finish();

        assertThatThrownBy(() -> builder.finish())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("TexBuilder already finished");
    }

    @Test
    void write_afterFinish_throwsException() {
        builder.finish();

        assertThatThrownBy(() -> builder.pushVerbatim("x"))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.recordWeakSpace())
            .isInstanceOf(IllegalStateException.class);
    }
}
