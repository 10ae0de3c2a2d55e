package com.mermaidbuilder;

import ch.qos.logback.classic.Level;
import com.mermaidbuilder.cli.ListCommand;
import com.mermaidbuilder.cli.RenderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for Mermaid Builder.
 *
 * <p>Mermaid Builder turns YAML diagram definitions into Mermaid flowcharts, class
 * diagrams and entity-relationship diagrams.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a diagram definition to Mermaid text</li>
 *   <li>{@code list} - List dialects, shapes, arrows or cardinalities</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Print a diagram to stdout
 * mermaid-builder render checkout.yaml
 *
 * # Write it to a file with debug logging
 * mermaid-builder -v render checkout.yaml -o docs/checkout.mmd
 *
 * # Show the flowchart node shapes
 * mermaid-builder list shapes
 * }</pre>
 */
@Command(
    name = "mermaid-builder",
    mixinStandardHelpOptions = true,
    version = "Mermaid Builder 1.0.0-SNAPSHOT",
    description = "Builds Mermaid diagrams from YAML definitions",
    subcommands = {
        RenderCommand.class,
        ListCommand.class
    }
)
public class MermaidBuilderCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MermaidBuilderCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Mermaid Builder - Mermaid diagrams from YAML definitions");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'mermaid-builder --help' to see available commands");
        System.out.println("Use 'mermaid-builder <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        MermaidBuilderCLI cli = new MermaidBuilderCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy((ParseResult parseResult) -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
