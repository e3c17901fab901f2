package com.migrationanalyzer.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.migrationanalyzer.core.classifier.VulnerabilityRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Root configuration of the analyzer.
 *
 * <p>Loaded from {@code migration-analyzer.yaml} by {@link ConfigLoader}. Every field is
 * optional; the compact constructor substitutes defaults so a partially filled file is valid.
 * A negative {@code fileCap} is logged at WARN and replaced by the default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * fileCap: 300
 * parallel: true
 * thresholds:
 *   longMethodLines: 60
 *   coverageThreshold: 40
 * weights:
 *   criticalDependency: 20
 * latestVersions:
 *   "com.acme:*": "4.0.0"
 * vulnerabilities:
 *   - match: "acme-legacy"
 *     mode: CONTAINS
 *     cveId: "CVE-2024-0001"
 *     description: "Internal advisory"
 *     severity: HIGH
 * }</pre>
 *
 * @param fileCap maximum number of source files scanned per analysis
 * @param manifestCap maximum number of manifests parsed per ecosystem
 * @param maxDepth maximum directory depth walked below the root
 * @param excludedDirectories directory names never descended into
 * @param parallel run the independent scans concurrently
 * @param thresholds heuristic thresholds
 * @param weights health score weights
 * @param latestVersions latest known versions, keyed {@code group:artifact} or {@code group:*}
 * @param vulnerabilities vulnerability rules appended to the built-in table
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("fileCap") Integer fileCap,
    @JsonProperty("manifestCap") Integer manifestCap,
    @JsonProperty("maxDepth") Integer maxDepth,
    @JsonProperty("excludedDirectories") List<String> excludedDirectories,
    @JsonProperty("parallel") Boolean parallel,
    @JsonProperty("thresholds") AnalysisThresholds thresholds,
    @JsonProperty("weights") ScoreWeights weights,
    @JsonProperty("latestVersions") Map<String, String> latestVersions,
    @JsonProperty("vulnerabilities") List<VulnerabilityRule> vulnerabilities
) {
    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    public static final int DEFAULT_FILE_CAP = 200;
    public static final int DEFAULT_MANIFEST_CAP = 50;
    public static final int DEFAULT_MAX_DEPTH = 12;
    public static final List<String> DEFAULT_EXCLUDED_DIRECTORIES =
        List.of(".git", ".gradle", ".idea", "target", "build", "out", "node_modules");

    public AnalyzerConfig {
        if (fileCap != null && fileCap < 0) {
            log.warn("Ignoring negative fileCap {}; using default {}", fileCap, DEFAULT_FILE_CAP);
            fileCap = null;
        }
        if (fileCap == null) {
            fileCap = DEFAULT_FILE_CAP;
        }
        if (manifestCap == null || manifestCap <= 0) {
            manifestCap = DEFAULT_MANIFEST_CAP;
        }
        if (maxDepth == null || maxDepth <= 0) {
            maxDepth = DEFAULT_MAX_DEPTH;
        }
        excludedDirectories = excludedDirectories == null
            ? DEFAULT_EXCLUDED_DIRECTORIES
            : List.copyOf(excludedDirectories);
        if (parallel == null) {
            parallel = Boolean.TRUE;
        }
        if (thresholds == null) {
            thresholds = AnalysisThresholds.defaults();
        }
        if (weights == null) {
            weights = ScoreWeights.defaults();
        }
        latestVersions = latestVersions == null ? Map.of() : Map.copyOf(latestVersions);
        vulnerabilities = vulnerabilities == null ? List.of() : List.copyOf(vulnerabilities);
    }

    /**
     * Creates a configuration with every default.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Returns a copy with a different source file cap.
     *
     * @param newFileCap file cap, 0 or more
     * @return updated configuration
     * @throws IllegalArgumentException if the cap is negative
     */
    public AnalyzerConfig withFileCap(int newFileCap) {
        if (newFileCap < 0) {
            throw new IllegalArgumentException("fileCap must be 0 or more, got " + newFileCap);
        }
        return new AnalyzerConfig(newFileCap, manifestCap, maxDepth, excludedDirectories, parallel,
            thresholds, weights, latestVersions, vulnerabilities);
    }

    /**
     * Returns a copy with parallel execution switched on or off.
     *
     * @param runParallel whether scans run concurrently
     * @return updated configuration
     */
    public AnalyzerConfig withParallel(boolean runParallel) {
        return new AnalyzerConfig(fileCap, manifestCap, maxDepth, excludedDirectories, runParallel,
            thresholds, weights, latestVersions, vulnerabilities);
    }
}
