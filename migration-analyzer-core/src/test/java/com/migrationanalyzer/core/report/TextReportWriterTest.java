package com.migrationanalyzer.core.report;

import com.migrationanalyzer.core.analysis.RepositoryAnalyzer;
import com.migrationanalyzer.core.model.AnalysisReport;
import com.migrationanalyzer.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class TextReportWriterTest extends ScannerTestBase {

    @Test
    void render_listsSummaryFindingsAndNotes() throws IOException {
        // Given
        createFile("src/main/java/app/Job.java", """
            package app;

            class Job {
                void run() {
                    try {
                        execute();
                    } catch (Throwable t) {
                        t.printStackTrace();
                    }
                }
            }
            """);
        AnalysisReport report = new RepositoryAnalyzer().analyze(tempDir);

        // When
        String text = new TextReportWriter().render(report);

        // Then
        assertThat(text)
            .startsWith("Migration Readiness Report\n")
            .contains("Health score:")
            .contains("Java version:            unknown -> 21 [LOW]")
            .contains("  exception_handling: 2")
            .contains("  src/main/java/app/Job.java:7 [catch-generic-exception]")
            .contains("Notes\n  * No Maven or Gradle manifest found; dependency analysis skipped");
    }

    @Test
    void render_truncatesLongLists() throws IOException {
        // Given: more high-priority findings than are listed
        Map<String, String> files = new TreeMap<>();
        for (int i = 0; i < TextReportWriter.MAX_LISTED + 3; i++) {
            files.put("src/main/java/Eq" + i + ".java", "class Eq" + i + " { boolean b = x.equals(null); }\n");
        }
        createFiles(files);
        AnalysisReport report = new RepositoryAnalyzer().analyze(tempDir);

        // When
        String text = new TextReportWriter().render(report);

        // Then
        assertThat(text).contains("High priority findings").contains("  ... and 3 more\n");
    }
}
