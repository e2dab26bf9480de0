package com.mathtex.cli;

import com.mathtex.core.symbol.MathSymbol;
import com.mathtex.core.symbol.SymbolTable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.Callable;

/**
 * Command to list the standard symbol table or resolve one symbol name.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all symbol names
 * mathtex symbols
 *
 * # Resolve one name
 * mathtex symbols arrow.r
 * }</pre>
 */
@Command(
    name = "symbols",
    description = "List symbol names, or resolve one name",
    mixinStandardHelpOptions = true
)
public class SymbolsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SymbolsCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Symbol name to resolve (default: list all)"
    )
    private String name;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        SymbolTable symbols = SymbolTable.standard();

        if (name == null) {
            out.println("Available Symbols:");
            out.println();
            for (Map.Entry<String, Integer> entry : symbols.names().entrySet()) {
                out.println(describe(symbols, entry.getKey(), entry.getValue()));
            }
            out.println();
            out.println(symbols.names().size() + " names");
            out.flush();
            return 0;
        }

        OptionalInt codepoint = symbols.resolve(name);
        if (codepoint.isEmpty()) {
            log.error("Unknown symbol: {}", name);
            spec.commandLine().getErr().println("✗ unknown symbol: " + name);
            spec.commandLine().getErr().flush();
            return 1;
        }

        out.println(describe(symbols, name, codepoint.getAsInt()));
        out.flush();
        return 0;
    }

    private static String describe(SymbolTable symbols, String name, int codepoint) {
        String command = symbols.lookup(codepoint)
            .map(MathSymbol::command)
            .map(c -> "\\" + c)
            .orElse("");
        return String.format("  %-22s %s  %-8s %s",
            name, new String(Character.toChars(codepoint)), SymbolTable.formatCodepoint(codepoint), command).stripTrailing();
    }
}
