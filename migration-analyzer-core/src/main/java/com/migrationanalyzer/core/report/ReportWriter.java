package com.migrationanalyzer.core.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.migrationanalyzer.core.model.AnalysisReport;

/**
 * Turns an {@link AnalysisReport} into a document.
 *
 * <p>Implementations are stateless and may be shared between threads.
 */
public interface ReportWriter {

    /**
     * Returns the format identifier used on the command line, e.g. {@code json}.
     *
     * @return lowercase format identifier
     */
    String getId();

    /**
     * Renders the report.
     *
     * @param report analysis report
     * @return rendered document
     */
    String render(AnalysisReport report);

    /**
     * Renders the report into a UTF-8 file, creating parent directories as needed.
     *
     * @param report analysis report
     * @param target output file
     * @throws IOException if the file cannot be written
     */
    default void write(AnalysisReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(report), StandardCharsets.UTF_8);
    }
}
