package com.migrationanalyzer.core.analysis;

import java.util.Collection;

import com.migrationanalyzer.core.config.AnalysisThresholds;
import com.migrationanalyzer.core.config.ScoreWeights;
import com.migrationanalyzer.core.model.CoverageSummary;
import com.migrationanalyzer.core.model.Dependency;
import com.migrationanalyzer.core.model.Finding;
import com.migrationanalyzer.core.model.Severity;

/**
 * Computes the 0-100 health score of a repository.
 *
 * <p>Starts at 100 and subtracts:
 * <ul>
 *   <li>per CRITICAL and HIGH dependency, capped at {@link ScoreWeights#dependencyCap()}</li>
 *   <li>per CRITICAL, HIGH and MEDIUM source finding, capped at {@link ScoreWeights#findingCap()}</li>
 *   <li>a fixed amount when no test framework is detected</li>
 *   <li>per percentage point of coverage below the coverage threshold, capped at
 *       {@link ScoreWeights#coverageCap()}</li>
 * </ul>
 * The result is rounded and floored at 0.
 *
 * <p>The score depends only on counts, so it is independent of collection order. Null
 * collections, null elements and null severities contribute nothing.
 */
public class HealthScorer {

    private static final int MAX_SCORE = 100;

    private final ScoreWeights weights;
    private final AnalysisThresholds thresholds;

    public HealthScorer() {
        this(ScoreWeights.defaults(), AnalysisThresholds.defaults());
    }

    public HealthScorer(ScoreWeights weights, AnalysisThresholds thresholds) {
        this.weights = weights == null ? ScoreWeights.defaults() : weights;
        this.thresholds = thresholds == null ? AnalysisThresholds.defaults() : thresholds;
    }

    /**
     * Scores a repository.
     *
     * @param dependencies classified dependencies, nullable
     * @param findings source findings, nullable
     * @param coverage coverage estimate, nullable
     * @return score between 0 and 100
     */
    public int score(Collection<Dependency> dependencies, Collection<Finding> findings, CoverageSummary coverage) {
        double deduction = dependencyDeduction(dependencies)
            + findingDeduction(findings)
            + testingDeduction(coverage);
        long rounded = Math.round(MAX_SCORE - deduction);
        return (int) Math.max(0, Math.min(MAX_SCORE, rounded));
    }

    double dependencyDeduction(Collection<Dependency> dependencies) {
        if (dependencies == null) {
            return 0;
        }
        double total = 0;
        for (Dependency dependency : dependencies) {
            if (dependency == null || dependency.severity() == null) {
                continue;
            }
            total += switch (dependency.severity()) {
                case CRITICAL -> weights.criticalDependency();
                case HIGH -> weights.highDependency();
                default -> 0;
            };
        }
        return Math.min(total, weights.dependencyCap());
    }

    double findingDeduction(Collection<Finding> findings) {
        if (findings == null) {
            return 0;
        }
        double total = 0;
        for (Finding finding : findings) {
            if (finding == null || finding.severity() == null) {
                continue;
            }
            total += switch (finding.severity()) {
                case CRITICAL -> weights.criticalFinding();
                case HIGH -> weights.highFinding();
                case MEDIUM -> weights.mediumFinding();
                default -> 0;
            };
        }
        return Math.min(total, weights.findingCap());
    }

    double testingDeduction(CoverageSummary coverage) {
        if (coverage == null) {
            return 0;
        }
        double total = 0;
        if (coverage.frameworksDetected().isEmpty()) {
            total += weights.missingTestFramework();
        }
        int gap = Math.max(0, thresholds.coverageThreshold() - coverage.coveragePercentage());
        total += Math.min(gap * weights.coveragePoint(), weights.coverageCap());
        return total;
    }

    /**
     * Returns true if the severity counts against the score for dependencies.
     *
     * @param severity dependency severity, nullable
     * @return true for HIGH and CRITICAL
     */
    public static boolean isVulnerable(Severity severity) {
        return severity != null && severity.isAtLeast(Severity.HIGH);
    }
}
