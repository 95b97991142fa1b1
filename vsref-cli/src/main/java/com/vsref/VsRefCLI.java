package com.vsref;

import ch.qos.logback.classic.Level;
import com.vsref.cli.ListCommand;
import com.vsref.cli.ResolveCommand;
import com.vsref.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for vsref.
 *
 * <p>vsref reads Visual Studio solution files and resolves the projects and web sites they
 * reference, optionally down to the source files each project compiles.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code resolve} - Resolve solution references and print a report</li>
 *   <li>{@code validate} - Check that solution files load</li>
 *   <li>{@code list} - List supported project types and path resolvers</li>
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
 * # Resolve one solution
 * vsref resolve App.sln
 *
 * # Resolve every solution below src, including project sources, as JSON
 * vsref resolve --recursive --cascade --format json "src/*.sln"
 *
 * # Validate with debug logging
 * vsref -v validate App.sln
 * }</pre>
 */
@Command(
    name = "vsref",
    mixinStandardHelpOptions = true,
    version = "vsref 1.0.0-SNAPSHOT",
    description = "Visual Studio solution reference resolver",
    subcommands = {
        ResolveCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class VsRefCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(VsRefCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("vsref - Visual Studio solution reference resolver");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'vsref --help' to see available commands");
        System.out.println("Use 'vsref <command> --help' for command-specific help");
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
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        VsRefCLI cli = new VsRefCLI();
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
