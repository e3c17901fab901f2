package com.migrationanalyzer.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Deductions applied by the health scorer, starting from 100.
 *
 * <p>Every weight is a named constant so the score stays auditable. Values can be overridden
 * under {@code weights:} in {@code migration-analyzer.yaml}; missing or negative values use the
 * defaults.</p>
 *
 * @param criticalDependency per CRITICAL dependency
 * @param highDependency per HIGH dependency
 * @param dependencyCap maximum total dependency deduction
 * @param criticalFinding per CRITICAL source finding
 * @param highFinding per HIGH source finding
 * @param mediumFinding per MEDIUM source finding
 * @param findingCap maximum total finding deduction
 * @param missingTestFramework when no test framework is detected
 * @param coveragePoint per percentage point of coverage below the coverage threshold
 * @param coverageCap maximum total coverage deduction
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoreWeights(
    @JsonProperty("criticalDependency") Double criticalDependency,
    @JsonProperty("highDependency") Double highDependency,
    @JsonProperty("dependencyCap") Double dependencyCap,
    @JsonProperty("criticalFinding") Double criticalFinding,
    @JsonProperty("highFinding") Double highFinding,
    @JsonProperty("mediumFinding") Double mediumFinding,
    @JsonProperty("findingCap") Double findingCap,
    @JsonProperty("missingTestFramework") Double missingTestFramework,
    @JsonProperty("coveragePoint") Double coveragePoint,
    @JsonProperty("coverageCap") Double coverageCap
) {
    public static final double DEFAULT_CRITICAL_DEPENDENCY = 15.0;
    public static final double DEFAULT_HIGH_DEPENDENCY = 8.0;
    public static final double DEFAULT_DEPENDENCY_CAP = 45.0;
    public static final double DEFAULT_CRITICAL_FINDING = 5.0;
    public static final double DEFAULT_HIGH_FINDING = 3.0;
    public static final double DEFAULT_MEDIUM_FINDING = 1.0;
    public static final double DEFAULT_FINDING_CAP = 30.0;
    public static final double DEFAULT_MISSING_TEST_FRAMEWORK = 10.0;
    public static final double DEFAULT_COVERAGE_POINT = 0.5;
    public static final double DEFAULT_COVERAGE_CAP = 25.0;

    public ScoreWeights {
        criticalDependency = nonNegativeOr(criticalDependency, DEFAULT_CRITICAL_DEPENDENCY);
        highDependency = nonNegativeOr(highDependency, DEFAULT_HIGH_DEPENDENCY);
        dependencyCap = nonNegativeOr(dependencyCap, DEFAULT_DEPENDENCY_CAP);
        criticalFinding = nonNegativeOr(criticalFinding, DEFAULT_CRITICAL_FINDING);
        highFinding = nonNegativeOr(highFinding, DEFAULT_HIGH_FINDING);
        mediumFinding = nonNegativeOr(mediumFinding, DEFAULT_MEDIUM_FINDING);
        findingCap = nonNegativeOr(findingCap, DEFAULT_FINDING_CAP);
        missingTestFramework = nonNegativeOr(missingTestFramework, DEFAULT_MISSING_TEST_FRAMEWORK);
        coveragePoint = nonNegativeOr(coveragePoint, DEFAULT_COVERAGE_POINT);
        coverageCap = nonNegativeOr(coverageCap, DEFAULT_COVERAGE_CAP);
    }

    /**
     * Creates weights with all defaults.
     *
     * @return default weights
     */
    public static ScoreWeights defaults() {
        return new ScoreWeights(null, null, null, null, null, null, null, null, null, null);
    }

    private static Double nonNegativeOr(Double value, double defaultValue) {
        return value == null || value < 0 || value.isNaN() ? defaultValue : value;
    }
}
