package com.mathtex.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mathtex.core.generator.DelimiterStyle;
import com.mathtex.core.generator.GeneratorConfig;
import com.mathtex.core.symbol.SymbolTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Root configuration for MathTeX.
 *
 * <p>Loaded from {@code mathtex.yaml}. Every section is optional.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * symbols:
 *   files:
 *     - extra-symbols.yaml
 *
 * output:
 *   delimiters: dollars
 * }</pre>
 *
 * @param symbols symbol table configuration
 * @param output output configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MathTexConfig(
    @JsonProperty("symbols") SymbolsConfig symbols,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Creates the default configuration: standard symbols, bare markup.
     *
     * @return default configuration
     */
    public static MathTexConfig defaults() {
        return new MathTexConfig(
            new SymbolsConfig(List.of()),
            new OutputConfig(DelimiterStyle.NONE)
        );
    }

    /**
     * Builds the symbol table: the standard table extended with the configured files,
     * in order.
     *
     * @param baseDirectory directory relative file names are resolved against
     * @return the symbol table to convert with
     * @throws IOException if a symbol file cannot be read
     */
    public SymbolTable symbolTable(Path baseDirectory) throws IOException {
        SymbolTable table = SymbolTable.standard();
        if (symbols == null || symbols.files() == null) {
            return table;
        }
        for (String file : symbols.files()) {
            table = table.extendedWith(SymbolTable.load(baseDirectory.resolve(file)));
        }
        return table;
    }

    /**
     * Returns the generator settings described by the output section.
     *
     * @return generator config
     */
    public GeneratorConfig generatorConfig() {
        return new GeneratorConfig(output == null ? null : output.delimiters());
    }

    /**
     * Symbol table configuration.
     *
     * @param files additional symbol files, layered under the standard table
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SymbolsConfig(
        @JsonProperty("files") List<String> files
    ) {}

    /**
     * Output configuration.
     *
     * @param delimiters delimiters wrapped around generated markup
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("delimiters") DelimiterStyle delimiters
    ) {}
}
