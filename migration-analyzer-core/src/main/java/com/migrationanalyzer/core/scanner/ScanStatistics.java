package com.migrationanalyzer.core.scanner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected during a scan operation.
 *
 * <p>Makes bounded and partial scans visible: files beyond the configured cap are counted as
 * skipped, unreadable files as failed.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanStatistics.Builder stats = new ScanStatistics.Builder().filesDiscovered(files.size());
 * for (Path file : files) {
 *     stats.incrementFilesScanned();
 * }
 * ScanStatistics statistics = stats.build();
 * }</pre>
 *
 * @param filesDiscovered total files matching the scanner's patterns
 * @param filesScanned files actually examined
 * @param filesSkipped files not examined because of the file cap
 * @param filesFailed files that could not be read or parsed
 * @param errorCounts map of error types to their occurrence counts
 * @param topErrors list of most significant error messages (max 10)
 */
public record ScanStatistics(
    int filesDiscovered,
    int filesScanned,
    int filesSkipped,
    int filesFailed,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    private static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ScanStatistics {
        filesDiscovered = Math.max(0, filesDiscovered);
        filesScanned = Math.max(0, filesScanned);
        filesSkipped = Math.max(0, filesSkipped);
        filesFailed = Math.max(0, filesFailed);
        if (errorCounts == null) {
            errorCounts = Map.of();
        }
        if (topErrors == null) {
            topErrors = List.of();
        }
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Calculates the failure rate.
     *
     * @return failure rate as percentage (0.0 to 100.0), or 0 if no files scanned
     */
    public double getFailureRate() {
        if (filesScanned == 0) {
            return 0.0;
        }
        return (filesFailed * 100.0) / filesScanned;
    }

    /**
     * Returns true if this scan had any failures.
     *
     * @return true if at least one file failed
     */
    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns true if the file cap cut the scan short.
     *
     * @return true if at least one file was skipped
     */
    public boolean wasTruncated() {
        return filesSkipped > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Discovered: %d, Scanned: %d, Skipped: %d, Failed: %d (%.1f%%)",
            filesDiscovered,
            filesScanned,
            filesSkipped,
            filesFailed,
            getFailureRate()
        );
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesScanned = 0;
        private int filesSkipped = 0;
        private int filesFailed = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        public Builder filesSkipped(int count) {
            this.filesSkipped = count;
            return this;
        }

        public Builder incrementFilesScanned() {
            this.filesScanned++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                filesDiscovered,
                filesScanned,
                filesSkipped,
                filesFailed,
                Map.copyOf(errorCounts),
                List.copyOf(topErrors)
            );
        }
    }
}
