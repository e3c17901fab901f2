package com.migrationanalyzer;

import com.migrationanalyzer.cli.AnalyzeCommand;
import com.migrationanalyzer.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Migration Analyzer.
 *
 * <p>Migration Analyzer inspects a checked-out Java repository before a JVM migration and
 * reports vulnerable or stale dependencies, source anti-patterns, estimated test coverage,
 * refactoring candidates, a Java version recommendation and an overall health score.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a repository and print or write the report</li>
 *   <li>{@code list} - List available scanners or report formats</li>
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
 * # Analyze current directory, JSON to stdout
 * migration-analyzer analyze
 *
 * # Human-readable summary with debug logging
 * migration-analyzer -v analyze /checkouts/legacy-app -f text
 *
 * # Write the JSON report to a file
 * migration-analyzer analyze /checkouts/legacy-app -o report.json
 * }</pre>
 */
@Command(
    name = "migration-analyzer",
    mixinStandardHelpOptions = true,
    version = "Migration Analyzer 1.0.0-SNAPSHOT",
    description = "Static pre-migration analysis of Java repositories",
    subcommands = {
        AnalyzeCommand.class,
        ListCommand.class
    }
)
public class MigrationAnalyzerCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MigrationAnalyzerCLI.class);

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

        System.out.println("Migration Analyzer - Static pre-migration analysis of Java repositories");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'migration-analyzer --help' to see available commands");
        System.out.println("Use 'migration-analyzer <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line, shared by {@link #main(String[])} and tests.
     *
     * @return command line for the root command
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new MigrationAnalyzerCLI())
            .setCaseInsensitiveEnumValuesAllowed(true);
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
