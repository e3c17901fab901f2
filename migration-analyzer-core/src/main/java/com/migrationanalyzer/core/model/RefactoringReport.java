package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Refactoring section of the report.
 *
 * @param totalJavaFiles number of Java files analyzed for structure
 * @param issues refactoring opportunities
 */
public record RefactoringReport(
    @JsonProperty("total_java_files") int totalJavaFiles,
    @JsonProperty("issues") List<RefactorOpportunity> issues
) {
    public RefactoringReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
