package com.migrationanalyzer.cli;

import com.migrationanalyzer.MigrationAnalyzerCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("List Command")
class ListCommandTest {

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = MigrationAnalyzerCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    @DisplayName("Should list scanners in priority order by default")
    void shouldListScanners() {
        int exitCode = commandLine.execute("list");

        assertThat(exitCode).isZero();
        String text = out.toString();
        assertThat(text)
            .startsWith("Available Scanners:")
            .contains("Maven Manifest Scanner (ID: maven-manifest)")
            .contains("Priority: 10")
            .contains("(ID: refactoring)");
        assertThat(text.indexOf("maven-manifest")).isLessThan(text.indexOf("gradle-manifest"));
        assertThat(text.indexOf("test-coverage")).isLessThan(text.indexOf("(ID: refactoring)"));
    }

    @Test
    @DisplayName("Should list report formats")
    void shouldListFormats() {
        int exitCode = commandLine.execute("list", "FORMATS");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("  * json").contains("  * text");
    }

    @Test
    @DisplayName("Should reject an unknown type")
    void shouldRejectUnknownType() {
        int exitCode = commandLine.execute("list", "plugins");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown type: plugins");
    }
}
