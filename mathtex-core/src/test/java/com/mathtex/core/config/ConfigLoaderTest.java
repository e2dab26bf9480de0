package com.mathtex.core.config;

import com.mathtex.core.generator.DelimiterStyle;
import com.mathtex.core.symbol.MathSymbol;
import com.mathtex.core.symbol.SymbolTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader} and {@link MathTexConfig}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("mathtex.yaml");
        Files.writeString(configFile, """
            symbols:
              files:
                - extra.yaml

            output:
              delimiters: dollars
            """);

        MathTexConfig config = ConfigLoader.load(configFile);

        assertThat(config.symbols().files()).containsExactly("extra.yaml");
        assertThat(config.output().delimiters()).isEqualTo(DelimiterStyle.DOLLARS);
        assertThat(config.generatorConfig().delimiters()).isEqualTo(DelimiterStyle.DOLLARS);
    }

    @Test
    void load_minimalYaml_keepsMissingSectionsNull() throws IOException {
        Path configFile = tempDir.resolve("mathtex.yaml");
        Files.writeString(configFile, """
            output:
              delimiters: brackets
            """);

        MathTexConfig config = ConfigLoader.load(configFile);

        assertThat(config.symbols()).isNull();
        assertThat(config.symbolTable(tempDir)).isSameAs(SymbolTable.standard());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("mathtex.yaml");
        Files.writeString(configFile, """
            renderer:
              font: stix
            output:
              delimiters: none
            """);

        MathTexConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().delimiters()).isEqualTo(DelimiterStyle.NONE);
    }

    @Test
    void load_missingFile_returnsDefaults() {
        MathTexConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(MathTexConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("mathtex.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(MathTexConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("mathtex.yaml");
        Files.writeString(configFile, """
            output:
              delimiters: parens
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(MathTexConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(MathTexConfig.defaults());
    }

    @Test
    void symbolTable_layersConfiguredFilesUnderStandardTable() throws IOException {
        Files.writeString(tempDir.resolve("extra.yaml"), """
            symbols:
              - { codepoint: "U+2603", command: snowman, names: [snowman] }
              - { codepoint: "U+03B1", command: upalpha, class: alpha, names: [alpha] }
            """);
        Path configFile = tempDir.resolve("mathtex.yaml");
        Files.writeString(configFile, """
            symbols:
              files: [extra.yaml]
            """);

        SymbolTable table = ConfigLoader.load(configFile).symbolTable(tempDir);

        assertThat(table.resolve("snowman")).hasValue(0x2603);
        assertThat(table.lookup(0x03B1)).map(MathSymbol::command).contains("alpha");
    }

    @Test
    void symbolTable_missingFile_throwsException() {
        MathTexConfig config = new MathTexConfig(
            new MathTexConfig.SymbolsConfig(List.of("missing.yaml")), null);

        assertThatThrownBy(() -> config.symbolTable(tempDir))
            .isInstanceOf(IOException.class);
    }
}
