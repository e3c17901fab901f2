package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Terminal result of one repository analysis.
 *
 * <p>Field names are the wire contract consumed by the dashboard.</p>
 *
 * @param dependencies dependency section
 * @param businessLogicIssues source findings in scan order
 * @param testingCoverage coverage estimate
 * @param codeRefactoring refactoring section
 * @param javaVersion Java version recommendation
 * @param summary derived counts and health score
 */
@JsonPropertyOrder({"dependencies", "business_logic_issues", "testing_coverage", "code_refactoring",
    "java_version", "summary"})
public record AnalysisReport(
    @JsonProperty("dependencies") DependencyReport dependencies,
    @JsonProperty("business_logic_issues") List<Finding> businessLogicIssues,
    @JsonProperty("testing_coverage") CoverageSummary testingCoverage,
    @JsonProperty("code_refactoring") RefactoringReport codeRefactoring,
    @JsonProperty("java_version") JavaVersionAssessment javaVersion,
    @JsonProperty("summary") AnalysisSummary summary
) {
    public AnalysisReport {
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        Objects.requireNonNull(testingCoverage, "testingCoverage must not be null");
        Objects.requireNonNull(codeRefactoring, "codeRefactoring must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        businessLogicIssues = businessLogicIssues == null ? List.of() : List.copyOf(businessLogicIssues);
    }
}
