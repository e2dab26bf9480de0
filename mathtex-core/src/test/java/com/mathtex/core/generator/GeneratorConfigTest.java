package com.mathtex.core.generator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GeneratorConfig} and {@link DelimiterStyle}.
 */
class GeneratorConfigTest {

    @Test
    void constructor_withNullDelimiters_defaultsToNone() {
        GeneratorConfig config = new GeneratorConfig(null);

        assertThat(config.delimiters()).isEqualTo(DelimiterStyle.NONE);
    }

    @Test
    void defaults_producesBareMarkup() {
        assertThat(GeneratorConfig.defaults().delimiters()).isEqualTo(DelimiterStyle.NONE);
    }

    @Test
    void wrap_appliesInlineAndBlockDelimiters() {
        assertThat(DelimiterStyle.NONE.wrap("x", true)).isEqualTo("x");
        assertThat(DelimiterStyle.DOLLARS.wrap("x", false)).isEqualTo("$x$");
        assertThat(DelimiterStyle.DOLLARS.wrap("x", true)).isEqualTo("$$x$$");
        assertThat(DelimiterStyle.BRACKETS.wrap("x", false)).isEqualTo("\\(x\\)");
        assertThat(DelimiterStyle.BRACKETS.wrap("x", true)).isEqualTo("\\[x\\]");
    }

    @ParameterizedTest
    @ValueSource(strings = {"dollars", "DOLLARS", "Dollars"})
    void fromId_ignoresCase(String id) {
        assertThat(DelimiterStyle.fromId(id)).isEqualTo(DelimiterStyle.DOLLARS);
    }

    @Test
    void fromId_unknownStyle_throwsException() {
        assertThatThrownBy(() -> DelimiterStyle.fromId("parens"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown delimiter style: parens");
    }
}
