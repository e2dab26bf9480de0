package com.mathtex.cli;

import com.mathtex.MathTexCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TexifyCommand}.
 */
@DisplayName("texify command")
class TexifyCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;
    private Path config;

    @BeforeEach
    void setUp() {
        commandLine = MathTexCLI.commandLine();
        out = new StringWriter();
        err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        config = tempDir.resolve("mathtex.yaml");
    }

    @Test
    @DisplayName("Should print markup for a JSON document")
    void texify_jsonDocument_printsMarkup() throws IOException {
        Path input = tempDir.resolve("half.json");
        Files.writeString(input, """
            {"type": "frac", "num": ["(", "x", "+", "1", ")"], "denom": "2"}
            """);

        int exitCode = commandLine.execute("texify", input.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("\\frac{x+1}{2}");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should wrap block formulas in display delimiters")
    void texify_withDelimiterOption_wrapsMarkup() throws IOException {
        Path input = tempDir.resolve("sum.yaml");
        Files.writeString(input, """
            type: formula
            block: true
            children:
              - { type: script, base: { type: symbol, name: sum }, sub: i }
            """);

        int exitCode = commandLine.execute("texify", input.toString(), "-c", config.toString(), "-d", "dollars");

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("$$\\sum _{i}$$");
    }

    @Test
    @DisplayName("Should use delimiters and symbol files from the configuration")
    void texify_withConfig_appliesConfiguration() throws IOException {
        Files.writeString(tempDir.resolve("weather.yaml"), """
            symbols:
              - { codepoint: "U+2603", command: snowman, names: [snowman] }
            """);
        Files.writeString(config, """
            symbols:
              files: [weather.yaml]
            output:
              delimiters: brackets
            """);
        Path input = tempDir.resolve("snow.yaml");
        Files.writeString(input, "[x, { type: symbol, name: snowman }]");

        int exitCode = commandLine.execute("texify", input.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("\\(x\\snowman \\)");
    }

    @Test
    @DisplayName("Should write markup to the output file")
    void texify_withOutputOption_writesFile() throws IOException {
        Path input = tempDir.resolve("root.yaml");
        Files.writeString(input, "{ type: sqrt, body: x }");
        Path output = tempDir.resolve("root.tex");

        int exitCode = commandLine.execute("texify", input.toString(), "-c", config.toString(),
            "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output).strip()).isEqualTo("\\sqrt{x}");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should report unknown symbols with their location")
    void texify_unknownSymbol_reportsLocation() throws IOException {
        Path input = tempDir.resolve("bad.yaml");
        Files.writeString(input, """
            type: formula
            children:
              - { type: symbol, name: nope }
            """);

        int exitCode = commandLine.execute("texify", input.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ unknown symbol: nope (at bad.yaml#/children/0)");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should report malformed documents")
    void texify_malformedDocument_fails() throws IOException {
        Path input = tempDir.resolve("bad.json");
        Files.writeString(input, "{\"type\": \"frac\", \"num\": \"1\"}");

        int exitCode = commandLine.execute("texify", input.toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("missing member 'denom'");
    }

    @Test
    @DisplayName("Should fail for a missing input file")
    void texify_missingFile_fails() {
        int exitCode = commandLine.execute("texify", tempDir.resolve("none.json").toString(),
            "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("✗");
    }
}
