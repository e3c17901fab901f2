package com.migrationanalyzer.core.scanner;

import com.migrationanalyzer.core.model.Finding;
import com.migrationanalyzer.core.model.ManifestSummary;
import com.migrationanalyzer.core.model.RefactorOpportunity;
import com.migrationanalyzer.core.model.TestInventory;

import java.util.List;
import java.util.Objects;

/**
 * Result returned by a scanner after execution.
 *
 * <p>Each scanner fills the part it is responsible for and leaves the others empty.
 *
 * @param scannerId ID of the scanner that produced this result
 * @param success whether the scan completed successfully
 * @param manifest manifest summary (manifest scanners)
 * @param findings source findings in file, line, detector order (source pattern scanner)
 * @param refactorOpportunities structural refactoring candidates (refactoring scanner)
 * @param testInventory test and source file counts (test coverage scanner)
 * @param sourceLevel minimum Java level implied by source features, or null (language level detector)
 * @param warnings non-fatal issues encountered during scanning
 * @param errors fatal errors that prevented complete scanning
 * @param statistics file statistics (discovered, scanned, skipped, failed)
 */
public record ScanResult(
    String scannerId,
    boolean success,
    ManifestSummary manifest,
    List<Finding> findings,
    List<RefactorOpportunity> refactorOpportunities,
    TestInventory testInventory,
    Integer sourceLevel,
    List<String> warnings,
    List<String> errors,
    ScanStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public ScanResult {
        Objects.requireNonNull(scannerId, "scannerId must not be null");
        if (manifest == null) {
            manifest = ManifestSummary.notFound();
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
        refactorOpportunities = refactorOpportunities == null ? List.of() : List.copyOf(refactorOpportunities);
        if (testInventory == null) {
            testInventory = TestInventory.empty();
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
    }

    /**
     * Creates a successful scan result with no findings.
     *
     * @param scannerId scanner ID
     * @return empty successful result
     */
    public static ScanResult empty(String scannerId) {
        return new ScanResult(scannerId, true, null, List.of(), List.of(), null, null,
            List.of(), List.of(), ScanStatistics.empty());
    }

    /**
     * Creates a failed scan result with errors.
     *
     * @param scannerId scanner ID
     * @param errors error messages
     * @return failed result
     */
    public static ScanResult failed(String scannerId, List<String> errors) {
        return new ScanResult(scannerId, false, null, List.of(), List.of(), null, null,
            List.of(), errors, ScanStatistics.empty());
    }

    /**
     * Returns true if this result has any findings.
     *
     * @return true if dependencies, findings, refactoring candidates, test files or a source
     *         level were found
     */
    public boolean hasFindings() {
        return !manifest.dependencies().isEmpty()
            || !findings.isEmpty()
            || !refactorOpportunities.isEmpty()
            || testInventory.testFileCount() > 0
            || sourceLevel != null;
    }
}
