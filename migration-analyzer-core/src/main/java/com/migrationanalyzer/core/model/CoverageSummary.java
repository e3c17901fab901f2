package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Estimated test coverage of a repository.
 *
 * <p>{@code coveragePercentage} is a ratio of test files to source files, not a measured
 * line or branch coverage; {@code coverageIsEstimate} is always true so consumers label it.</p>
 *
 * @param testFileCount number of test files
 * @param sourceFileCount number of non-test Java files
 * @param frameworksDetected detected test frameworks, sorted
 * @param coveragePercentage estimated coverage, 0 to 100
 * @param coverageIsEstimate always true
 * @param issues advisory findings
 */
public record CoverageSummary(
    @JsonProperty("test_file_count") int testFileCount,
    @JsonProperty("source_file_count") int sourceFileCount,
    @JsonProperty("frameworks_detected") SortedSet<String> frameworksDetected,
    @JsonProperty("coverage_percentage") int coveragePercentage,
    @JsonProperty("coverage_is_estimate") boolean coverageIsEstimate,
    @JsonProperty("issues") List<Finding> issues
) {
    public CoverageSummary {
        testFileCount = Math.max(0, testFileCount);
        sourceFileCount = Math.max(0, sourceFileCount);
        coveragePercentage = Math.max(0, Math.min(100, coveragePercentage));
        coverageIsEstimate = true;
        frameworksDetected = frameworksDetected == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(frameworksDetected));
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Summary used when the test scan produced no data.
     *
     * @return zero summary without advisories
     */
    public static CoverageSummary empty() {
        return new CoverageSummary(0, 0, null, 0, true, List.of());
    }
}
