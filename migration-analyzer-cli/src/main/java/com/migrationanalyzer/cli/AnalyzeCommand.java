package com.migrationanalyzer.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.migrationanalyzer.MigrationAnalyzerCLI;
import com.migrationanalyzer.core.analysis.RepositoryAccessException;
import com.migrationanalyzer.core.analysis.RepositoryAnalyzer;
import com.migrationanalyzer.core.config.AnalyzerConfig;
import com.migrationanalyzer.core.config.ConfigLoader;
import com.migrationanalyzer.core.model.AnalysisReport;
import com.migrationanalyzer.core.report.JsonReportWriter;
import com.migrationanalyzer.core.report.ReportWriter;
import com.migrationanalyzer.core.report.TextReportWriter;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to analyze a repository and emit the report.
 *
 * <p>Loads {@code migration-analyzer.yaml} from the repository root unless another file is
 * given, applies command-line overrides, runs the analysis and prints the report to standard
 * output or writes it to {@code --output}.
 *
 * <p><b>Exit codes:</b> 0 on success; 1 when the root cannot be analyzed or the report cannot
 * be written; 2 for invalid options such as a negative {@code --file-cap}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze current directory
 * migration-analyzer analyze
 *
 * # Only the first 50 source files, one scanner at a time
 * migration-analyzer analyze /path/to/repo --file-cap 50 --sequential
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a Java repository before migration",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    /**
     * Report formats.
     */
    public enum Format {
        JSON, TEXT
    }

    @ParentCommand
    private MigrationAnalyzerCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Repository directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: migration-analyzer.yaml in the repository root)"
    )
    private Path configPath;

    @Option(
        names = {"-f", "--format"},
        description = "Report format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "JSON"
    )
    private Format format;

    @Option(
        names = {"-o", "--output"},
        description = "Write the report to this file instead of standard output"
    )
    private Path outputFile;

    @Option(
        names = {"--file-cap"},
        description = "Maximum number of Java source files to read, 0 or more (overrides config; "
            + "negative values are rejected)"
    )
    private Integer fileCap;

    @Option(
        names = {"--sequential"},
        description = "Run the scanners one after another instead of in parallel"
    )
    private boolean sequential;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        if (fileCap != null && fileCap < 0) {
            throw new ParameterException(spec.commandLine(), "--file-cap must be 0 or more, got " + fileCap);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            AnalyzerConfig config = loadConfiguration();
            log.info("Starting analysis of: {}", projectPath.toAbsolutePath());

            AnalysisReport report = new RepositoryAnalyzer(config).analyze(projectPath);
            ReportWriter writer = format == Format.TEXT ? new TextReportWriter() : new JsonReportWriter();

            if (outputFile != null) {
                writer.write(report, outputFile);
                if (parent == null || !parent.isQuiet()) {
                    out.println("Report written to: " + outputFile.toAbsolutePath());
                }
            } else {
                out.println(writer.render(report));
            }
            out.flush();
            return 0;

        } catch (RepositoryAccessException e) {
            log.error("Cannot analyze repository: {}", e.getMessage());
            err.println("Cannot analyze repository: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to write report to {}", outputFile, e);
            err.println("Failed to write report: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads configuration and applies command-line overrides.
     */
    private AnalyzerConfig loadConfiguration() {
        Path absoluteConfigPath = configPath == null
            ? projectPath.resolve(ConfigLoader.DEFAULT_FILE_NAME)
            : configPath;

        log.debug("Loading configuration from: {}", absoluteConfigPath);
        AnalyzerConfig config = ConfigLoader.load(absoluteConfigPath);

        if (fileCap != null) {
            config = config.withFileCap(fileCap);
        }
        if (sequential) {
            config = config.withParallel(false);
        }
        return config;
    }
}
