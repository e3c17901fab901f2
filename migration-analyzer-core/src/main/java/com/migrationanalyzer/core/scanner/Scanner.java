package com.migrationanalyzer.core.scanner;

import java.util.Set;

/**
 * Interface for scanners that extract migration-relevant facts from a checked-out source tree.
 *
 * <p>Each scanner analyzes one aspect of a codebase (build manifests, source anti-patterns, test
 * inventory, structural refactoring candidates) and produces a {@link ScanResult}. Scanners are
 * stateless and read-only, so the analyzer may run them concurrently.
 *
 * @see ScanContext
 * @see ScanResult
 */
public interface Scanner {

    /**
     * Returns unique identifier for this scanner.
     *
     * <p>Should be kebab-case (e.g., "maven-manifest", "source-patterns").
     *
     * @return unique scanner identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this scanner.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file name glob patterns for files this scanner analyzes.
     *
     * <p>Examples: {@code pom.xml}, {@code *.java}, {@code build.gradle.kts}.
     *
     * @return file name glob patterns
     */
    Set<String> getSupportedFilePatterns();

    /**
     * Returns execution priority for this scanner.
     *
     * <p>Lower values execute first when scans run sequentially. Recommended ranges:
     * <ul>
     *   <li>1-50: manifest scanners</li>
     *   <li>50-100: source scanners</li>
     *   <li>100+: structural scanners</li>
     * </ul>
     *
     * @return priority value (lower = earlier execution)
     */
    int getPriority();

    /**
     * Checks if this scanner should run for the given context.
     *
     * @param context scan context containing project information
     * @return true if scanner should execute, false otherwise
     */
    boolean appliesTo(ScanContext context);

    /**
     * Executes the scan and returns results.
     *
     * <p>Per-file problems (unreadable or malformed files) are reported as warnings and counted in
     * the {@link ScanStatistics}; the scan continues with the remaining files. If scanning fails
     * completely, return a {@link ScanResult} with {@code success=false} and populate the
     * {@code errors} list. Do not throw exceptions unless the error is unrecoverable.
     *
     * @param context scan context with access to files and configuration
     * @return scan result
     */
    ScanResult scan(ScanContext context);
}
