package com.flowscribe;

import com.flowscribe.cli.ClassifyCommand;
import com.flowscribe.cli.InterpretCommand;
import com.flowscribe.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for FlowScribe.
 *
 * <p>FlowScribe reads GraphML diagrams, works out what kind of diagram each one is and
 * what every node means, and writes a normalized flow document for downstream code renderers.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code interpret} - Interpret a diagram file or a directory of diagrams</li>
 *   <li>{@code classify} - Show diagram type scores and node roles for one diagram</li>
 *   <li>{@code list} - List loaders, renderers, or diagram types</li>
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
 * # Interpret one diagram into ./flows
 * flowscribe interpret login.graphml
 *
 * # Interpret every diagram below a directory, printing to the console
 * flowscribe -v interpret diagrams/ --stdout
 *
 * # Inspect classification
 * flowscribe classify login.graphml --roles
 * }</pre>
 */
@Command(
    name = "flowscribe",
    mixinStandardHelpOptions = true,
    version = "FlowScribe 1.0.0-SNAPSHOT",
    description = "Turns GraphML diagrams into ordered, role-annotated flow documents",
    subcommands = {
        InterpretCommand.class,
        ClassifyCommand.class,
        ListCommand.class
    }
)
public class FlowScribeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FlowScribeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("FlowScribe - Diagram to flow document interpreter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'flowscribe --help' to see available commands");
        System.out.println("Use 'flowscribe <command> --help' for command-specific help");
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
        log.debug("Logging level set to {}", root.getLevel());
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
     * Builds the command line with the logging level applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        FlowScribeCLI cli = new FlowScribeCLI();
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
