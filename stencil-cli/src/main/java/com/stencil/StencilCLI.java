package com.stencil;

import ch.qos.logback.classic.Level;
import com.stencil.cli.CompileCommand;
import com.stencil.cli.ListCommand;
import com.stencil.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Stencil.
 *
 * <p>Stencil compiles parsed templates, serialized as node-tree documents, into Gleam
 * modules that render them.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Generate Gleam sources from node trees</li>
 *   <li>{@code validate} - Check node trees without writing anything</li>
 *   <li>{@code list} - List available output writers</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Compile every tree below templates/ into ./generated
 * stencil compile templates
 *
 * # Print the generated source instead of writing it
 * stencil compile greeting.tree.json -w console
 *
 * # Check trees with debug logging
 * stencil -v validate templates
 * }</pre>
 */
@Command(
    name = "stencil",
    mixinStandardHelpOptions = true,
    version = "Stencil 1.0.0-SNAPSHOT",
    description = "Compiles template node trees into Gleam render functions",
    subcommands = {
        CompileCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class StencilCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("Stencil - Template to Gleam compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'stencil --help' to see available commands");
        System.out.println("Use 'stencil <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return ready-to-execute command line
     */
    public static CommandLine commandLine() {
        StencilCLI cli = new StencilCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
