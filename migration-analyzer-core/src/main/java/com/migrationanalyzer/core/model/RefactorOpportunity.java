package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Structural smell worth refactoring before or during a migration.
 *
 * @param type opportunity type
 * @param filePath path relative to the analyzed root
 * @param lineNumber first line of the affected element, nullable
 * @param details free text, e.g. method name and line count
 * @param suggestion refactoring guidance
 */
public record RefactorOpportunity(
    @JsonProperty("type") RefactorType type,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("line_number") Integer lineNumber,
    @JsonProperty("details") String details,
    @JsonProperty("suggestion") String suggestion
) {
    public RefactorOpportunity {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
    }
}
