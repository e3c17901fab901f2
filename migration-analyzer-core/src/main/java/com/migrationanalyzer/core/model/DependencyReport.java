package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Dependency section of the report, holding classified manifests and their counts.
 *
 * @param maven classified Maven summary
 * @param gradle classified Gradle summary
 * @param totalDependencies Maven plus Gradle dependency count
 * @param outdatedCount dependencies flagged outdated
 * @param vulnerableCount dependencies with HIGH or CRITICAL severity
 * @param criticalIssues one entry per vulnerable dependency
 */
public record DependencyReport(
    @JsonProperty("maven") ManifestSummary maven,
    @JsonProperty("gradle") ManifestSummary gradle,
    @JsonProperty("total_dependencies") int totalDependencies,
    @JsonProperty("outdated_count") int outdatedCount,
    @JsonProperty("vulnerable_count") int vulnerableCount,
    @JsonProperty("critical_issues") List<CriticalIssue> criticalIssues
) {
    public DependencyReport {
        if (maven == null) {
            maven = ManifestSummary.notFound();
        }
        if (gradle == null) {
            gradle = ManifestSummary.notFound();
        }
        criticalIssues = criticalIssues == null ? List.of() : List.copyOf(criticalIssues);
    }
}
