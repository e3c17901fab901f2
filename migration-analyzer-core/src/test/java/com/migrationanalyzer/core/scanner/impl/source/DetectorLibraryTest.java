package com.migrationanalyzer.core.scanner.impl.source;

import com.migrationanalyzer.core.model.FindingCategory;
import com.migrationanalyzer.core.model.Severity;
import com.migrationanalyzer.core.scanner.base.SourceLine;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorLibraryTest {

    @Test
    void defaults_coverEverySourceCategory() {
        DetectorLibrary library = DetectorLibrary.defaults();

        Arrays.stream(FindingCategory.values())
            .filter(category -> category != FindingCategory.TEST_COVERAGE)
            .forEach(category -> assertThat(library.detectors(category))
                .as("detectors for %s", category.id())
                .isNotEmpty());
        assertThat(library.detectors(FindingCategory.TEST_COVERAGE)).isEmpty();
    }

    @Test
    void defaults_areOrderedByCategoryBlocks() {
        List<LineDetector> detectors = DetectorLibrary.defaults().detectors();

        assertThat(detectors.get(0).ruleId()).isEqualTo("boxed-primitive-constructor");
        assertThat(detectors.get(detectors.size() - 1).ruleId()).isEqualTo("missing-serial-version-uid");
        assertThat(DetectorLibrary.defaults().size()).isEqualTo(detectors.size());
    }

    @Test
    void detectors_isImmutable() {
        List<LineDetector> detectors = DetectorLibrary.defaults().detectors();

        assertThatThrownBy(() -> detectors.add(detectors.get(0)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void customLibrary_appliesOnlyItsDetectors() {
        // Given: a library with a single substring detector
        DetectorLibrary library = new DetectorLibrary(List.of(
            new SubstringDetector("system-exit", FindingCategory.EXCEPTION_HANDLING, Severity.MEDIUM,
                "System.exit(", "Return an exit code instead")));
        SourcePatternScanner scanner = new SourcePatternScanner(library);

        // When
        var findings = scanner.scanLines("Main.java", List.of(
            "class Main {",
            "    void stop() { System.exit(1); }",
            "    void fail(Exception e) { e.printStackTrace(); }",
            "}"));

        // Then: the matched text is the whole line, trimmed
        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).ruleId()).isEqualTo("system-exit");
        assertThat(findings.get(0).lineNumber()).isEqualTo(2);
        assertThat(findings.get(0).matchedText()).isEqualTo("void stop() { System.exit(1); }");
    }

    @Test
    void regexDetector_withExclusionOnPreviousLine_doesNotTrigger() {
        RegexDetector detector = new RegexDetector("chain", FindingCategory.NULL_SAFETY, Severity.LOW,
            Pattern.compile("a\\.b\\(\\)"),
            Pattern.compile("guard"), null, "Guard it");
        SourceFile file = new SourceFile("X.java",
            List.of(new SourceLine(1, "guard();"), new SourceLine(2, "a.b();"), new SourceLine(3, "a.b();")),
            "guard();\na.b();\na.b();");

        assertThat(detector.detect(file, 1)).isEmpty();
        assertThat(detector.detect(file, 2)).hasValueSatisfying(finding -> {
            assertThat(finding.lineNumber()).isEqualTo(3);
            assertThat(finding.matchedText()).isEqualTo("a.b()");
        });
    }

    @Test
    void nextLineDetector_atEndOfFile_doesNotTrigger() {
        SourceFile file = new SourceFile("Y.java",
            List.of(new SourceLine(4, "} catch (RuntimeException e) {")), null);

        LineDetector emptyCatch = DetectorLibrary.defaults().detectors().stream()
            .filter(NextLineRegexDetector.class::isInstance)
            .findFirst()
            .orElseThrow();

        assertThat(emptyCatch.detect(file, 0)).isEmpty();
        assertThat(file.content()).isEmpty();
    }
}
