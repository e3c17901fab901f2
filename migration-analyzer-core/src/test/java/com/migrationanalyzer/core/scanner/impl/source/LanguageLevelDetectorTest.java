package com.migrationanalyzer.core.scanner.impl.source;

import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LanguageLevelDetector}.
 */
class LanguageLevelDetectorTest extends ScannerTestBase {

    private LanguageLevelDetector detector;

    @BeforeEach
    void setUpDetector() {
        detector = new LanguageLevelDetector();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "public sealed interface Shape permits Circle {}                 | 17",
        "public record Point(int x, int y) {}                            | 16",
        "if (shape instanceof Circle c) {                                | 16",
        "String sql = \"\"\"                                             | 15",
        "case MONDAY -> open();                                          | 14",
        "var names = loadNames();                                        | 10",
        "names.forEach(name -> print(name));                             | 8",
        "names.stream().map(String::trim);                               | 8",
        "List<String> names = new ArrayList<>();                         | 7",
        "try (InputStream in = open()) {                                 | 7",
        "List names = new ArrayList();                                   | 0"
    })
    void levelOf_singleFeatureLine_returnsFeatureLevel(String line, int expected) {
        assertThat(detector.levelOf(List.of(line))).isEqualTo(expected);
    }

    @Test
    void levelOf_withSeveralFeatures_returnsHighest() {
        List<String> lines = List.of(
            "List<String> names = new ArrayList<>();",
            "names.forEach(name -> print(name));",
            "var count = names.size();");

        assertThat(detector.levelOf(lines)).isEqualTo(10);
    }

    @Test
    void levelOf_ignoresCommentedFeatures() {
        List<String> lines = List.of(
            "// var count = names.size();",
            "/* record Point(int x) {} */",
            "int count = 0;");

        assertThat(detector.levelOf(lines)).isZero();
    }

    @Test
    void scan_withModuleInfo_reportsAtLeastJava9() throws IOException {
        // Given: a module descriptor and a class using lambdas
        createFile("src/main/java/module-info.java", "module app {\n}\n");
        createFile("src/main/java/app/Main.java", """
            package app;

            class Main {
                Runnable task = () -> System.out.println("run");
            }
            """);

        // When
        ScanResult result = detector.scan(context);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.sourceLevel()).isEqualTo(9);
        assertThat(result.findings()).isEmpty();
    }

    @Test
    void scan_withPlainSources_reportsNoLevel() throws IOException {
        // Given: sources without any versioned language feature
        createJavaClasses(3);

        // When
        ScanResult result = detector.scan(context);

        // Then
        assertThat(result.sourceLevel()).isNull();
        assertThat(result.statistics().filesScanned()).isEqualTo(3);
    }

    @Test
    void scan_readsOnlyTheSample() throws IOException {
        // Given: a record in a file that sorts after the first 20 files
        createJavaClasses(LanguageLevelDetector.SAMPLE_SIZE + 5);
        createFile("src/main/java/z/deep/Point.java", "public record Point(int x, int y) {}\n");

        // When
        ScanResult result = detector.scan(context);

        // Then: the record is outside the sample
        assertThat(result.sourceLevel()).isNull();
        assertThat(result.statistics().filesDiscovered()).isEqualTo(LanguageLevelDetector.SAMPLE_SIZE + 6);
        assertThat(result.statistics().filesScanned()).isEqualTo(LanguageLevelDetector.SAMPLE_SIZE);
    }
}
