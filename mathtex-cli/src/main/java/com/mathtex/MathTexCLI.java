package com.mathtex;

import com.mathtex.cli.SymbolsCommand;
import com.mathtex.cli.TexifyCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Command line front end of the formula converter.
 *
 * <pre>{@code
 * mathtex texify pythagoras.yaml --delimiters brackets
 * mathtex symbols arrow.r
 * }</pre>
 *
 * <p>{@code -v} and {@code -q} set the Logback root level before the subcommand runs.
 */
@Command(
    name = "mathtex",
    mixinStandardHelpOptions = true,
    version = "MathTeX 1.0.0-SNAPSHOT",
    description = "Converts formula documents into TeX-like math markup",
    subcommands = {
        TexifyCommand.class,
        SymbolsCommand.class
    }
)
public class MathTexCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MathTexCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Log conversion details (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Log errors only")
    private boolean quiet;

    @Override
    public void run() {
        // No subcommand given
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        Level level = quiet ? Level.ERROR : verbose ? Level.DEBUG : Level.INFO;
        root.setLevel(level);
        log.debug("Root log level set to {}", level);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the logging options before any subcommand
     * runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        MathTexCLI cli = new MathTexCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
