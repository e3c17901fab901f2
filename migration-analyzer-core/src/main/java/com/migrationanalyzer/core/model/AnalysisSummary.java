package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derived counts, the health score, and textual notes of one analysis.
 *
 * <p>{@code notes} tell "no findings" apart from "could not analyze", e.g. a missing manifest
 * or skipped files.</p>
 *
 * @param totalDependencies total dependencies
 * @param outdatedDependencies outdated dependencies
 * @param vulnerableDependencies HIGH or CRITICAL dependencies
 * @param criticalDependencyIssues number of critical issue entries
 * @param businessLogicIssues number of source findings
 * @param highPriorityBusinessLogic source findings with HIGH or CRITICAL severity
 * @param findingsByCategory finding count per category id
 * @param testCoveragePercentage estimated coverage
 * @param testFiles number of test files
 * @param testFrameworks detected test frameworks
 * @param testingIssues number of coverage advisories
 * @param javaFiles number of Java files analyzed for structure
 * @param refactoringOpportunities number of refactoring opportunities
 * @param overallHealthScore 0 to 100
 * @param notes diagnostic notes
 */
public record AnalysisSummary(
    @JsonProperty("total_dependencies") int totalDependencies,
    @JsonProperty("outdated_dependencies") int outdatedDependencies,
    @JsonProperty("vulnerable_dependencies") int vulnerableDependencies,
    @JsonProperty("critical_dependency_issues") int criticalDependencyIssues,
    @JsonProperty("business_logic_issues") int businessLogicIssues,
    @JsonProperty("high_priority_business_logic") int highPriorityBusinessLogic,
    @JsonProperty("findings_by_category") Map<String, Integer> findingsByCategory,
    @JsonProperty("test_coverage_percentage") int testCoveragePercentage,
    @JsonProperty("test_files") int testFiles,
    @JsonProperty("test_frameworks") SortedSet<String> testFrameworks,
    @JsonProperty("testing_issues") int testingIssues,
    @JsonProperty("java_files") int javaFiles,
    @JsonProperty("refactoring_opportunities") int refactoringOpportunities,
    @JsonProperty("overall_health_score") int overallHealthScore,
    @JsonProperty("notes") List<String> notes
) {
    public AnalysisSummary {
        findingsByCategory = findingsByCategory == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(findingsByCategory));
        testFrameworks = testFrameworks == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(testFrameworks));
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
