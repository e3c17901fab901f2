package com.migrationanalyzer.core.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.migrationanalyzer.core.classifier.DependencyClassifier;
import com.migrationanalyzer.core.config.AnalyzerConfig;
import com.migrationanalyzer.core.model.AnalysisReport;
import com.migrationanalyzer.core.model.AnalysisSummary;
import com.migrationanalyzer.core.model.CoverageSummary;
import com.migrationanalyzer.core.model.CriticalIssue;
import com.migrationanalyzer.core.model.Dependency;
import com.migrationanalyzer.core.model.DependencyReport;
import com.migrationanalyzer.core.model.Finding;
import com.migrationanalyzer.core.model.FindingCategory;
import com.migrationanalyzer.core.model.JavaVersionAssessment;
import com.migrationanalyzer.core.model.ManifestSummary;
import com.migrationanalyzer.core.model.RefactorOpportunity;
import com.migrationanalyzer.core.model.RefactorType;
import com.migrationanalyzer.core.model.RefactoringReport;
import com.migrationanalyzer.core.model.Severity;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.impl.manifest.GradleManifestScanner;
import com.migrationanalyzer.core.scanner.impl.manifest.MavenManifestScanner;
import com.migrationanalyzer.core.scanner.impl.refactoring.RefactoringScanner;
import com.migrationanalyzer.core.scanner.impl.source.LanguageLevelDetector;
import com.migrationanalyzer.core.scanner.impl.source.SourcePatternScanner;
import com.migrationanalyzer.core.scanner.impl.testing.CoverageEstimator;
import com.migrationanalyzer.core.scanner.impl.testing.TestCoverageScanner;

/**
 * Joins the scanner results of one analysis into an {@link AnalysisReport}.
 *
 * <p>Runs after all scanners have finished and is a pure function of their results:
 * <ol>
 *   <li>Classify the manifest dependencies (vulnerabilities, staleness)</li>
 *   <li>Estimate test coverage from the test inventory and the declared test dependencies</li>
 *   <li>Cross-reference deprecated API findings into refactoring opportunities</li>
 *   <li>Assess the Java version</li>
 *   <li>Compute counts, notes and the health score</li>
 * </ol>
 *
 * <p>A missing scanner result is treated as an empty one.
 */
public class ReportAggregator {

    private static final Logger log = LoggerFactory.getLogger(ReportAggregator.class);

    private static final String DEPRECATED_API_SUGGESTION_PREFIX = "Replace deprecated API: ";

    private final DependencyClassifier classifier;
    private final CoverageEstimator coverageEstimator;
    private final HealthScorer healthScorer;
    private final JavaVersionAdvisor versionAdvisor;

    public ReportAggregator() {
        this(AnalyzerConfig.defaults());
    }

    public ReportAggregator(AnalyzerConfig config) {
        AnalyzerConfig effective = config == null ? AnalyzerConfig.defaults() : config;
        this.classifier = new DependencyClassifier(effective);
        this.coverageEstimator = new CoverageEstimator(effective.thresholds());
        this.healthScorer = new HealthScorer(effective.weights(), effective.thresholds());
        this.versionAdvisor = new JavaVersionAdvisor();
    }

    /**
     * Builds the report.
     *
     * @param results scanner results keyed by scanner ID, in scanner priority order
     * @return the analysis report
     */
    public AnalysisReport aggregate(Map<String, ScanResult> results) {
        ScanResult mavenResult = resultOf(results, MavenManifestScanner.SCANNER_ID);
        ScanResult gradleResult = resultOf(results, GradleManifestScanner.SCANNER_ID);
        ScanResult sourceResult = resultOf(results, SourcePatternScanner.SCANNER_ID);
        ScanResult levelResult = resultOf(results, LanguageLevelDetector.SCANNER_ID);
        ScanResult testResult = resultOf(results, TestCoverageScanner.SCANNER_ID);
        ScanResult refactoringResult = resultOf(results, RefactoringScanner.SCANNER_ID);

        ManifestSummary maven = classify(mavenResult.manifest());
        ManifestSummary gradle = classify(gradleResult.manifest());
        List<Dependency> dependencies = new ArrayList<>(maven.dependencies());
        dependencies.addAll(gradle.dependencies());
        DependencyReport dependencyReport = dependencyReport(maven, gradle, dependencies);

        List<Finding> findings = sourceResult.findings();
        CoverageSummary coverage = coverageEstimator.estimate(testResult.testInventory(), dependencies);

        int javaFiles = Math.max(refactoringResult.statistics().filesDiscovered(),
            sourceResult.statistics().filesDiscovered());
        RefactoringReport refactoring = new RefactoringReport(javaFiles,
            refactorOpportunities(refactoringResult.refactorOpportunities(), findings));

        String declaredVersion = maven.languageVersion() != null ? maven.languageVersion() : gradle.languageVersion();
        JavaVersionAssessment javaVersion = versionAdvisor.assess(declaredVersion, levelResult.sourceLevel());

        int score = healthScorer.score(dependencies, findings, coverage);
        List<String> notes = notes(results, maven, gradle, sourceResult, javaFiles);

        AnalysisSummary summary = new AnalysisSummary(
            dependencyReport.totalDependencies(),
            dependencyReport.outdatedCount(),
            dependencyReport.vulnerableCount(),
            dependencyReport.criticalIssues().size(),
            findings.size(),
            (int) findings.stream().filter(f -> f.severity().isAtLeast(Severity.HIGH)).count(),
            findingsByCategory(findings),
            coverage.coveragePercentage(),
            coverage.testFileCount(),
            coverage.frameworksDetected(),
            coverage.issues().size(),
            javaFiles,
            refactoring.issues().size(),
            score,
            notes
        );

        log.info("Analysis complete: {} dependencies, {} findings, {} refactoring opportunities, health score {}",
            summary.totalDependencies(), summary.businessLogicIssues(), summary.refactoringOpportunities(), score);

        return new AnalysisReport(dependencyReport, findings, coverage, refactoring, javaVersion, summary);
    }

    private ManifestSummary classify(ManifestSummary summary) {
        if (summary.dependencies().isEmpty()) {
            return summary;
        }
        return summary.withDependencies(classifier.classify(summary.dependencies()));
    }

    private DependencyReport dependencyReport(ManifestSummary maven, ManifestSummary gradle,
                                              List<Dependency> dependencies) {
        int outdated = 0;
        int vulnerable = 0;
        List<CriticalIssue> criticalIssues = new ArrayList<>();
        for (Dependency dependency : dependencies) {
            if (dependency.outdated()) {
                outdated++;
            }
            if (HealthScorer.isVulnerable(dependency.severity())) {
                vulnerable++;
                criticalIssues.add(new CriticalIssue(dependency.coordinate(), dependency.declaredVersion(),
                    dependency.severity(), dependency.note()));
            }
        }
        return new DependencyReport(maven, gradle, dependencies.size(), outdated, vulnerable, criticalIssues);
    }

    /**
     * Structural opportunities first, then one deprecated API entry per deprecated API finding.
     */
    private List<RefactorOpportunity> refactorOpportunities(List<RefactorOpportunity> structural,
                                                            List<Finding> findings) {
        List<RefactorOpportunity> opportunities = new ArrayList<>(structural);
        for (Finding finding : findings) {
            if (finding.category() == FindingCategory.DEPRECATED_API && finding.filePath() != null) {
                opportunities.add(new RefactorOpportunity(RefactorType.DEPRECATED_API, finding.filePath(),
                    finding.lineNumber(), DEPRECATED_API_SUGGESTION_PREFIX + finding.matchedText(),
                    finding.suggestion()));
            }
        }
        return opportunities;
    }

    private Map<String, Integer> findingsByCategory(List<Finding> findings) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Finding finding : findings) {
            counts.merge(finding.category().id(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Notes that tell "nothing found" apart from "not analyzed".
     */
    private List<String> notes(Map<String, ScanResult> results, ManifestSummary maven, ManifestSummary gradle,
                               ScanResult sourceResult, int javaFiles) {
        List<String> notes = new ArrayList<>();

        if (!maven.found() && !gradle.found()) {
            notes.add("No Maven or Gradle manifest found; dependency analysis skipped");
        }
        maven.warnings().forEach(notes::add);
        gradle.warnings().forEach(notes::add);

        // filesScanned includes files that failed to read
        int sourceFilesRead = sourceResult.statistics().filesScanned() - sourceResult.statistics().filesFailed();
        if (javaFiles == 0) {
            notes.add("No Java source files found; source, test and refactoring analysis skipped");
        } else if (sourceResult.success() && sourceFilesRead > 0 && sourceResult.findings().isEmpty()) {
            notes.add("No source anti-patterns found in " + sourceFilesRead + " Java files");
        }

        for (ScanResult result : results.values()) {
            if (!result.success()) {
                notes.add("Scanner " + result.scannerId() + " failed: " + String.join("; ", result.errors()));
                continue;
            }
            if (result.statistics().wasTruncated()) {
                notes.add("Scanner " + result.scannerId() + " analyzed " + result.statistics().filesScanned()
                    + " of " + result.statistics().filesDiscovered() + " files (file cap reached)");
            }
            if (result.statistics().hasFailures()) {
                notes.add("Scanner " + result.scannerId() + " could not read "
                    + result.statistics().filesFailed() + " file(s)");
            }
        }
        return notes;
    }

    private static ScanResult resultOf(Map<String, ScanResult> results, String scannerId) {
        ScanResult result = results == null ? null : results.get(scannerId);
        return result == null ? ScanResult.empty(scannerId) : result;
    }
}
