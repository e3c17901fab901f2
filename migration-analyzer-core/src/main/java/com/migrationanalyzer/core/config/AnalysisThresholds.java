package com.migrationanalyzer.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Heuristic thresholds used by the scanners and the classifier.
 *
 * <p>Missing or non-positive values fall back to the {@code DEFAULT_*} constants.</p>
 *
 * @param longMethodLines methods spanning more lines are flagged as long
 * @param godClassPublicMethods classes with more public methods are flagged as god classes
 * @param duplicateBlockLines minimum normalized lines of a duplicated block
 * @param coverageThreshold estimated coverage below this is a HIGH advisory and costs score
 * @param coverageTarget estimated coverage below this is a MEDIUM advisory
 * @param stalenessLowMajors majors behind the latest known version for a LOW verdict
 * @param stalenessMediumMajors majors behind the latest known version for a MEDIUM verdict
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisThresholds(
    @JsonProperty("longMethodLines") Integer longMethodLines,
    @JsonProperty("godClassPublicMethods") Integer godClassPublicMethods,
    @JsonProperty("duplicateBlockLines") Integer duplicateBlockLines,
    @JsonProperty("coverageThreshold") Integer coverageThreshold,
    @JsonProperty("coverageTarget") Integer coverageTarget,
    @JsonProperty("stalenessLowMajors") Integer stalenessLowMajors,
    @JsonProperty("stalenessMediumMajors") Integer stalenessMediumMajors
) {
    public static final int DEFAULT_LONG_METHOD_LINES = 50;
    public static final int DEFAULT_GOD_CLASS_PUBLIC_METHODS = 20;
    public static final int DEFAULT_DUPLICATE_BLOCK_LINES = 6;
    public static final int DEFAULT_COVERAGE_THRESHOLD = 50;
    public static final int DEFAULT_COVERAGE_TARGET = 80;
    public static final int DEFAULT_STALENESS_LOW_MAJORS = 1;
    public static final int DEFAULT_STALENESS_MEDIUM_MAJORS = 2;

    public AnalysisThresholds {
        longMethodLines = positiveOr(longMethodLines, DEFAULT_LONG_METHOD_LINES);
        godClassPublicMethods = positiveOr(godClassPublicMethods, DEFAULT_GOD_CLASS_PUBLIC_METHODS);
        duplicateBlockLines = duplicateBlockLines == null || duplicateBlockLines < 2
            ? DEFAULT_DUPLICATE_BLOCK_LINES
            : duplicateBlockLines;
        coverageThreshold = percentOr(coverageThreshold, DEFAULT_COVERAGE_THRESHOLD);
        coverageTarget = percentOr(coverageTarget, DEFAULT_COVERAGE_TARGET);
        if (coverageTarget < coverageThreshold) {
            coverageTarget = coverageThreshold;
        }
        stalenessLowMajors = positiveOr(stalenessLowMajors, DEFAULT_STALENESS_LOW_MAJORS);
        stalenessMediumMajors = positiveOr(stalenessMediumMajors, DEFAULT_STALENESS_MEDIUM_MAJORS);
        if (stalenessMediumMajors < stalenessLowMajors) {
            stalenessMediumMajors = stalenessLowMajors;
        }
    }

    /**
     * Creates thresholds with all defaults.
     *
     * @return default thresholds
     */
    public static AnalysisThresholds defaults() {
        return new AnalysisThresholds(null, null, null, null, null, null, null);
    }

    private static Integer positiveOr(Integer value, int defaultValue) {
        return value == null || value <= 0 ? defaultValue : value;
    }

    private static Integer percentOr(Integer value, int defaultValue) {
        return value == null || value < 0 || value > 100 ? defaultValue : value;
    }
}
