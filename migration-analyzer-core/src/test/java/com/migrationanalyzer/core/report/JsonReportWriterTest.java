package com.migrationanalyzer.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.migrationanalyzer.core.analysis.RepositoryAnalyzer;
import com.migrationanalyzer.core.model.AnalysisReport;
import com.migrationanalyzer.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonReportWriter}: the JSON field names are the report's wire contract.
 */
class JsonReportWriterTest extends ScannerTestBase {

    private final ObjectMapper mapper = new ObjectMapper();
    private AnalysisReport report;

    @BeforeEach
    void analyzeFixture() throws IOException {
        createFile("pom.xml", """
            <project>
                <groupId>com.example</groupId>
                <artifactId>demo</artifactId>
                <version>1.0</version>
                <dependencies>
                    <dependency>
                        <groupId>org.apache.logging.log4j</groupId>
                        <artifactId>log4j-core</artifactId>
                        <version>2.13.0</version>
                    </dependency>
                </dependencies>
            </project>
            """);
        createFile("src/main/java/demo/Clock.java", """
            package demo;

            class Clock {
                Object now() {
                    return new Date();
                }
            }
            """);
        report = new RepositoryAnalyzer().analyze(tempDir);
    }

    @Test
    void toJson_usesSnakeCaseTopLevelSections() throws IOException {
        // When
        JsonNode json = mapper.readTree(new JsonReportWriter().toJson(report));

        // Then
        assertThat(json.has("dependencies")).isTrue();
        assertThat(json.has("business_logic_issues")).isTrue();
        assertThat(json.has("testing_coverage")).isTrue();
        assertThat(json.has("code_refactoring")).isTrue();
        assertThat(json.has("java_version")).isTrue();
        assertThat(json.path("summary").has("overall_health_score")).isTrue();
        assertThat(json.path("summary").path("findings_by_category").path("deprecated_api").asInt()).isEqualTo(1);
    }

    @Test
    void toJson_writesEnumsAndFindingFields() throws IOException {
        // When
        JsonNode json = mapper.readTree(new JsonReportWriter().toJson(report));

        // Then: categories and types use their ids, severities their names
        JsonNode finding = json.path("business_logic_issues").get(0);
        assertThat(finding.path("rule_id").asText()).isEqualTo("legacy-date");
        assertThat(finding.path("category").asText()).isEqualTo("deprecated_api");
        assertThat(finding.path("file_path").asText()).isEqualTo("src/main/java/demo/Clock.java");
        assertThat(finding.path("line_number").asInt()).isEqualTo(5);
        assertThat(finding.path("severity").asText()).isEqualTo("LOW");

        JsonNode dependency = json.path("dependencies").path("maven").path("dependencies").get(0);
        assertThat(dependency.path("coordinate").asText()).isEqualTo("org.apache.logging.log4j:log4j-core");
        assertThat(dependency.path("ecosystem").asText()).isEqualTo("maven");
        assertThat(dependency.path("is_outdated").asBoolean()).isTrue();
        assertThat(dependency.path("severity").asText()).isEqualTo("CRITICAL");

        assertThat(json.path("code_refactoring").path("issues").get(0).path("type").asText())
            .isEqualTo("deprecated_api");
        assertThat(json.path("testing_coverage").path("coverage_is_estimate").asBoolean()).isTrue();
    }

    @Test
    void write_createsParentDirectoriesAndWritesUtf8() throws IOException {
        // Given
        Path target = tempDir.resolve("reports/nested/report.json");

        // When
        new JsonReportWriter().write(report, target);

        // Then
        assertThat(target).exists();
        JsonNode json = mapper.readTree(Files.readString(target));
        assertThat(json.path("summary").path("total_dependencies").asInt()).isEqualTo(1);
    }

    @Test
    void getId_isJson() {
        assertThat(new JsonReportWriter().getId()).isEqualTo("json");
    }
}
