package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One detected source-code issue.
 *
 * <p>Findings are advisory: they come from line-level pattern matching and must be presented
 * as suggestions. Located findings carry a 1-based {@code lineNumber}; advisories (e.g. test
 * coverage) have no file and line number 0.</p>
 *
 * @param ruleId id of the detector that produced the finding
 * @param category finding category
 * @param filePath path relative to the analyzed root, null for advisories
 * @param lineNumber 1-based line of the match, 0 for advisories
 * @param severity severity
 * @param matchedText triggering snippet, at most {@value #MAX_MATCHED_TEXT} characters
 * @param suggestion fix guidance
 */
public record Finding(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("category") FindingCategory category,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("line_number") int lineNumber,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("matched_text") String matchedText,
    @JsonProperty("suggestion") String suggestion
) {
    /**
     * Maximum length of {@link #matchedText()}.
     */
    public static final int MAX_MATCHED_TEXT = 100;

    public Finding {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (lineNumber < 0) {
            lineNumber = 0;
        }
        if (matchedText != null && matchedText.length() > MAX_MATCHED_TEXT) {
            matchedText = matchedText.substring(0, MAX_MATCHED_TEXT);
        }
    }

    /**
     * Creates an advisory finding that is not tied to a file location.
     *
     * @param ruleId advisory id
     * @param category category
     * @param severity severity
     * @param message advisory text
     * @param suggestion fix guidance
     * @return advisory finding
     */
    public static Finding advisory(String ruleId, FindingCategory category, Severity severity,
                                   String message, String suggestion) {
        return new Finding(ruleId, category, null, 0, severity, message, suggestion);
    }
}
