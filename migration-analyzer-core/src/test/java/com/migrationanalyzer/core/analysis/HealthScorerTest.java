package com.migrationanalyzer.core.analysis;

import com.migrationanalyzer.core.config.AnalysisThresholds;
import com.migrationanalyzer.core.config.ScoreWeights;
import com.migrationanalyzer.core.model.CoverageSummary;
import com.migrationanalyzer.core.model.Dependency;
import com.migrationanalyzer.core.model.Ecosystem;
import com.migrationanalyzer.core.model.Finding;
import com.migrationanalyzer.core.model.FindingCategory;
import com.migrationanalyzer.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class HealthScorerTest {

    private static final CoverageSummary HEALTHY_TESTS =
        new CoverageSummary(8, 10, new TreeSet<>(List.of("JUnit")), 80, true, List.of());

    private final HealthScorer scorer = new HealthScorer();

    @Test
    void score_withNothingToReport_isHundred() {
        assertThat(scorer.score(List.of(), List.of(), HEALTHY_TESTS)).isEqualTo(100);
    }

    @Test
    void score_withNullInputs_neverThrows() {
        assertThat(scorer.score(null, null, null)).isEqualTo(100);
        assertThat(scorer.score(Arrays.asList(null, dependency(Severity.HIGH)), Arrays.asList(null, null), null))
            .isEqualTo(92);
    }

    @Test
    void score_deductsPerVulnerableDependency() {
        List<Dependency> dependencies = List.of(
            dependency(Severity.CRITICAL), dependency(Severity.HIGH), dependency(Severity.MEDIUM), dependency(Severity.OK));

        assertThat(scorer.score(dependencies, List.of(), HEALTHY_TESTS)).isEqualTo(77);
    }

    @Test
    void score_capsDependencyDeduction() {
        List<Dependency> dependencies = Collections.nCopies(4, dependency(Severity.CRITICAL));

        assertThat(scorer.dependencyDeduction(dependencies)).isEqualTo(45.0);
        assertThat(scorer.score(dependencies, List.of(), HEALTHY_TESTS)).isEqualTo(55);
    }

    @Test
    void score_deductsPerFindingSeverityAndCaps() {
        List<Finding> mixed = List.of(
            finding(Severity.CRITICAL), finding(Severity.HIGH), finding(Severity.MEDIUM), finding(Severity.LOW));

        assertThat(scorer.score(List.of(), mixed, HEALTHY_TESTS)).isEqualTo(91);
        assertThat(scorer.findingDeduction(Collections.nCopies(20, finding(Severity.HIGH)))).isEqualTo(30.0);
    }

    @Test
    void score_deductsForMissingFrameworkAndCoverageGap() {
        CoverageSummary noTests = new CoverageSummary(0, 10, null, 0, true, List.of());
        CoverageSummary someTests = new CoverageSummary(4, 10, new TreeSet<>(List.of("JUnit")), 40, true, List.of());

        assertThat(scorer.testingDeduction(noTests)).isEqualTo(35.0);
        assertThat(scorer.score(List.of(), List.of(), noTests)).isEqualTo(65);
        assertThat(scorer.score(List.of(), List.of(), someTests)).isEqualTo(95);
    }

    @Test
    void score_neverDropsBelowZero() {
        List<Dependency> dependencies = Collections.nCopies(10, dependency(Severity.CRITICAL));
        List<Finding> findings = Collections.nCopies(50, finding(Severity.CRITICAL));
        CoverageSummary noTests = new CoverageSummary(0, 10, null, 0, true, List.of());

        assertThat(scorer.score(dependencies, findings, noTests)).isZero();
    }

    @Test
    void score_isMonotonicInFindings() {
        List<Finding> findings = new ArrayList<>();
        int previous = scorer.score(List.of(), findings, HEALTHY_TESTS);

        for (Severity severity : List.of(Severity.LOW, Severity.MEDIUM, Severity.HIGH, Severity.CRITICAL,
            Severity.HIGH, Severity.CRITICAL, Severity.MEDIUM)) {
            findings.add(finding(severity));
            int current = scorer.score(List.of(), findings, HEALTHY_TESTS);
            assertThat(current).isLessThanOrEqualTo(previous).isBetween(0, 100);
            previous = current;
        }
    }

    @Test
    void score_isIndependentOfOrder() {
        List<Dependency> dependencies = new ArrayList<>(List.of(
            dependency(Severity.CRITICAL), dependency(Severity.HIGH), dependency(Severity.LOW)));
        List<Finding> findings = new ArrayList<>(List.of(
            finding(Severity.HIGH), finding(Severity.MEDIUM), finding(Severity.CRITICAL), finding(Severity.OK)));
        int expected = scorer.score(dependencies, findings, HEALTHY_TESTS);

        Random random = new Random(42);
        for (int i = 0; i < 5; i++) {
            Collections.shuffle(dependencies, random);
            Collections.shuffle(findings, random);
            assertThat(scorer.score(dependencies, findings, HEALTHY_TESTS)).isEqualTo(expected);
        }
    }

    @Test
    void score_usesConfiguredWeights() {
        ScoreWeights weights = new ScoreWeights(30.0, null, 60.0, null, null, null, null, null, null, null);
        HealthScorer custom = new HealthScorer(weights, AnalysisThresholds.defaults());

        assertThat(custom.score(List.of(dependency(Severity.CRITICAL)), List.of(), HEALTHY_TESTS)).isEqualTo(70);
    }

    @Test
    void isVulnerable_startsAtHigh() {
        assertThat(HealthScorer.isVulnerable(Severity.CRITICAL)).isTrue();
        assertThat(HealthScorer.isVulnerable(Severity.HIGH)).isTrue();
        assertThat(HealthScorer.isVulnerable(Severity.MEDIUM)).isFalse();
        assertThat(HealthScorer.isVulnerable(null)).isFalse();
    }

    private static Dependency dependency(Severity severity) {
        return Dependency.declared("org.example", "lib-" + severity.name().toLowerCase(), "1.0", null,
                Ecosystem.MAVEN, "pom.xml", null)
            .withVerdict(severity, severity != Severity.OK, null);
    }

    private static Finding finding(Severity severity) {
        return new Finding("rule", FindingCategory.NULL_SAFETY, "src/App.java", 1, severity, "x == null", "Fix it");
    }
}
