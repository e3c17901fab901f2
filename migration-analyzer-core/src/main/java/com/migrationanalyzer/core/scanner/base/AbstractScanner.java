package com.migrationanalyzer.core.scanner.base;

import com.migrationanalyzer.core.scanner.ScanContext;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.ScanStatistics;
import com.migrationanalyzer.core.scanner.Scanner;
import com.migrationanalyzer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstract base class for scanner implementations providing common functionality.
 *
 * <p>This class reduces code duplication across scanner implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per scanner class)</li>
 *   <li>File reading utilities ({@link #readFileContent(Path)}, {@link #readFileLines(Path)})</li>
 *   <li>appliesTo() helper ({@link #hasAnyFiles(ScanContext, String...)})</li>
 *   <li>Bounded file selection ({@link #capFiles(List, int, ScanStatistics.Builder)})</li>
 *   <li>ScanResult creation helpers ({@link #emptyResult()}, {@link #failedResult(List)})</li>
 *   <li>Uniform recording of unreadable files ({@link #recordUnreadable})</li>
 * </ul>
 *
 * @see Scanner
 * @see ScanContext
 * @see ScanResult
 */
public abstract class AbstractScanner implements Scanner {

    /**
     * Logger instance for this scanner.
     * Automatically initialized with the concrete scanner class name.
     */
    protected final Logger log;

    /**
     * Constructor that initializes the logger for the concrete scanner class.
     */
    protected AbstractScanner() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== File Reading Utilities ====================

    /**
     * Reads the entire content of a file as a single UTF-8 string.
     *
     * @param file path to the file to read
     * @return file content as string
     * @throws IOException if file cannot be read
     */
    protected String readFileContent(Path file) throws IOException {
        return FileUtils.readString(file);
    }

    /**
     * Reads all lines from a file as strict UTF-8.
     *
     * @param file path to the file to read
     * @return list of lines
     * @throws IOException if file cannot be read or is not valid UTF-8
     */
    protected List<String> readFileLines(Path file) throws IOException {
        return FileUtils.readLines(file);
    }

    // ==================== appliesTo() Helper ====================

    /**
     * Checks if any files matching the given file name patterns exist in the scan context.
     *
     * @param context scan context
     * @param patterns file name glob patterns to check
     * @return true if at least one matching file exists
     */
    protected boolean hasAnyFiles(ScanContext context, String... patterns) {
        return !context.findFiles(patterns).isEmpty();
    }

    // ==================== Bounded Scanning ====================

    /**
     * Keeps the first {@code cap} files and records the rest as skipped.
     *
     * <p>Files are never sampled: the deterministic discovery order decides which files fall
     * beyond the cap.
     *
     * @param files discovered files in discovery order
     * @param cap maximum number of files to keep
     * @param stats statistics builder to update
     * @return files to scan
     */
    protected List<Path> capFiles(List<Path> files, int cap, ScanStatistics.Builder stats) {
        stats.filesDiscovered(files.size());
        if (files.size() <= cap) {
            return files;
        }
        int skipped = files.size() - cap;
        stats.filesSkipped(skipped);
        log.info("{}: scanning {} of {} files, {} skipped by file cap", getDisplayName(), cap, files.size(), skipped);
        return files.subList(0, cap);
    }

    /**
     * Records a file that could not be read, for statistics, warnings and the log.
     *
     * @param relativePath file path relative to the root
     * @param e failure cause
     * @param stats statistics builder to update
     * @param warnings warning list to append to
     */
    protected void recordUnreadable(String relativePath, IOException e,
                                    ScanStatistics.Builder stats, List<String> warnings) {
        String reason = e instanceof CharacterCodingException ? "not valid UTF-8" : e.getMessage();
        log.warn("Skipping unreadable file {}: {}", relativePath, reason);
        stats.incrementFilesFailed();
        stats.addError(e.getClass().getSimpleName(), relativePath + ": " + reason);
        warnings.add("Could not read " + relativePath + ": " + reason);
    }

    // ==================== ScanResult Creation Helpers ====================

    /**
     * Creates an empty ScanResult for this scanner.
     *
     * @return empty ScanResult with this scanner's ID
     */
    protected ScanResult emptyResult() {
        return ScanResult.empty(getId());
    }

    /**
     * Creates a failed ScanResult for this scanner with error messages.
     *
     * @param errors list of error messages
     * @return failed ScanResult with this scanner's ID and errors
     */
    protected ScanResult failedResult(List<String> errors) {
        return ScanResult.failed(getId(), errors);
    }
}
