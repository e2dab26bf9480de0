package com.mathtex.cli;

import com.mathtex.core.config.ConfigLoader;
import com.mathtex.core.config.MathTexConfig;
import com.mathtex.core.error.TexifyException;
import com.mathtex.core.generator.DelimiterStyle;
import com.mathtex.core.generator.GeneratedMarkup;
import com.mathtex.core.generator.GeneratorConfig;
import com.mathtex.core.generator.TexGenerator;
import com.mathtex.core.model.Formula;
import com.mathtex.core.reader.FormulaReader;
import com.mathtex.core.symbol.AccentNormalizer;
import com.mathtex.core.symbol.SymbolTable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to convert a formula document into math markup.
 *
 * <p>Orchestrates the conversion pipeline:
 * <ol>
 *   <li>Load configuration and build the symbol table</li>
 *   <li>Read the formula document</li>
 *   <li>Generate markup</li>
 *   <li>Print it, or write it to the output file</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * mathtex texify formula.json
 * mathtex texify formula.yaml -d dollars -o formula.tex
 * }</pre>
 */
@Command(
    name = "texify",
    description = "Convert a formula document (.json, .yaml) into math markup",
    mixinStandardHelpOptions = true
)
public class TexifyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TexifyCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Formula document")
    private Path input;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: mathtex.yaml)"
    )
    private Path configPath = Paths.get("mathtex.yaml");

    @Option(
        names = {"-d", "--delimiters"},
        description = "Delimiters around the markup: ${COMPLETION-CANDIDATES} (overrides config)"
    )
    private DelimiterStyle delimiters;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: standard output)"
    )
    private Path output;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            log.info("Converting formula document: {}", input);

            MathTexConfig config = ConfigLoader.load(configPath);
            Path configDirectory = configPath.toAbsolutePath().getParent();
            SymbolTable symbols = config.symbolTable(configDirectory);

            FormulaReader reader = new FormulaReader(new AccentNormalizer(symbols));
            Formula formula = reader.read(input);

            GeneratorConfig generatorConfig = delimiters != null
                ? new GeneratorConfig(delimiters)
                : config.generatorConfig();
            GeneratedMarkup markup = new TexGenerator(symbols).generate(formula, generatorConfig);

            if (output != null) {
                Files.writeString(output, markup.content() + System.lineSeparator());
                log.info("Wrote markup to: {}", output);
            } else {
                out.println(markup.content());
                out.flush();
            }
            return 0;

        } catch (TexifyException e) {
            log.error("Conversion failed: {}", e.describe());
            err.println("✗ " + e.describe());
            err.flush();
            return 1;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Conversion failed", e);
            err.println("✗ " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
