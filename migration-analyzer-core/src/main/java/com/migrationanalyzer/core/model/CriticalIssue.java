package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Dashboard entry for a HIGH or CRITICAL dependency.
 *
 * @param artifact dependency coordinate
 * @param version declared version, nullable
 * @param severity dependency severity
 * @param issue description of the problem
 */
public record CriticalIssue(
    @JsonProperty("artifact") String artifact,
    @JsonProperty("version") String version,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("issue") String issue
) {
}
