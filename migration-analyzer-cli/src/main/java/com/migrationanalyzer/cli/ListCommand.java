package com.migrationanalyzer.cli;

import com.migrationanalyzer.core.analysis.RepositoryAnalyzer;
import com.migrationanalyzer.core.report.JsonReportWriter;
import com.migrationanalyzer.core.report.ReportWriter;
import com.migrationanalyzer.core.report.TextReportWriter;
import com.migrationanalyzer.core.scanner.Scanner;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available scanners or report formats.
 *
 * <p>Scanners are discovered via Java Service Provider Interface (SPI) and shown in the order
 * the analyzer runs them.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all scanners
 * migration-analyzer list scanners
 *
 * # List report formats
 * migration-analyzer list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available scanners or report formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: scanners or formats",
        defaultValue = "scanners"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = switch (type.toLowerCase(Locale.ROOT)) {
            case "scanners", "scanner" -> listScanners(out);
            case "formats", "format" -> listFormats(out);
            default -> {
                log.error("Unknown type: {}. Use: scanners or formats", type);
                spec.commandLine().getErr().println("Unknown type: " + type + ". Use: scanners or formats");
                yield 1;
            }
        };
        out.flush();
        return exitCode;
    }

    private int listScanners(PrintWriter out) {
        out.println("Available Scanners:");
        out.println();

        List<Scanner> scanners = new RepositoryAnalyzer().getScanners();
        for (Scanner scanner : scanners) {
            out.printf("  * %s (ID: %s)%n", scanner.getDisplayName(), scanner.getId());
            out.printf("    Files: %s%n", String.join(", ", scanner.getSupportedFilePatterns().stream().sorted().toList()));
            out.printf("    Priority: %d%n", scanner.getPriority());
            out.println();
        }

        if (scanners.isEmpty()) {
            out.println("  No scanners found. Check META-INF/services registration on the classpath.");
        }
        return 0;
    }

    private int listFormats(PrintWriter out) {
        out.println("Available Report Formats:");
        out.println();
        for (ReportWriter writer : List.<ReportWriter>of(new JsonReportWriter(), new TextReportWriter())) {
            out.printf("  * %s%n", writer.getId());
        }
        return 0;
    }
}
