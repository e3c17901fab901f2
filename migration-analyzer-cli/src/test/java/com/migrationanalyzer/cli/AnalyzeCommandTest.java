package com.migrationanalyzer.cli;

import com.migrationanalyzer.MigrationAnalyzerCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@code analyze} command, run through the same command line as {@code main}.
 */
@DisplayName("Analyze Command")
class AnalyzeCommandTest {

    @TempDir
    Path repository;

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        Path source = repository.resolve("src/main/java/app/Legacy.java");
        Files.createDirectories(source.getParent());
        Files.writeString(source, """
            package app;

            class Legacy {
                boolean check(String role) {
                    return role == "admin";
                }
            }
            """);

        out = new StringWriter();
        err = new StringWriter();
        commandLine = MigrationAnalyzerCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    @DisplayName("Should print the JSON report to standard output")
    void shouldPrintJsonReport() {
        int exitCode = commandLine.execute("analyze", repository.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("\"business_logic_issues\"")
            .contains("\"string-identity-comparison\"")
            .contains("\"overall_health_score\"");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should render the text report case-insensitively")
    void shouldRenderTextReport() {
        int exitCode = commandLine.execute("analyze", repository.toString(), "-f", "text", "--sequential");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .startsWith("Migration Readiness Report")
            .contains("src/main/java/app/Legacy.java:5 [string-identity-comparison]");
    }

    @Test
    @DisplayName("Should write the report to the output file")
    void shouldWriteReportFile() throws IOException {
        Path report = repository.resolve("out/report.json");

        int exitCode = commandLine.execute("analyze", repository.toString(), "-o", report.toString());

        assertThat(exitCode).isZero();
        assertThat(report).exists();
        assertThat(Files.readString(report)).contains("\"java_version\"");
        assertThat(out.toString()).contains("Report written to: ");
    }

    @Test
    @DisplayName("Should stay silent on success in quiet mode")
    void shouldRespectQuietMode() {
        Path report = repository.resolve("quiet.json");

        int exitCode = commandLine.execute("-q", "analyze", repository.toString(), "-o", report.toString());

        assertThat(exitCode).isZero();
        assertThat(report).exists();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should apply the file cap from the command line over the config file")
    void shouldApplyFileCapOverride() throws IOException {
        Files.writeString(repository.resolve("migration-analyzer.yaml"), "fileCap: 50\n");

        int exitCode = commandLine.execute("analyze", repository.toString(), "--file-cap", "0");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .doesNotContain("\"string-identity-comparison\"")
            .contains("analyzed 0 of 1 files (file cap reached)");
    }

    @Test
    @DisplayName("Should reject a negative file cap as invalid input")
    void shouldRejectNegativeFileCap() {
        int exitCode = commandLine.execute("analyze", repository.toString(), "--file-cap=-1");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--file-cap must be 0 or more, got -1");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should fail with exit code 1 for a missing repository")
    void shouldFailForMissingRepository() {
        int exitCode = commandLine.execute("analyze", repository.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot analyze repository: Repository root does not exist");
        assertThat(out.toString()).isEmpty();
    }
}
