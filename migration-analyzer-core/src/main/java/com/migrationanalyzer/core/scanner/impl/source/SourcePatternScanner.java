package com.migrationanalyzer.core.scanner.impl.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.migrationanalyzer.core.model.Finding;
import com.migrationanalyzer.core.scanner.ScanContext;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.ScanStatistics;
import com.migrationanalyzer.core.scanner.base.AbstractRegexScanner;

/**
 * Scanner for source-level anti-patterns in Java files.
 *
 * <p>Each {@code *.java} file (in discovery order, at most {@code fileCap} files) is read as
 * UTF-8 and its non-comment lines are tested against the {@link DetectorLibrary}. Every trigger
 * emits one {@link Finding}; findings are never deduplicated.
 *
 * <p><b>Finding Order:</b> file discovery order, then line order, then detector order.
 *
 * <p>Files that cannot be read or are not valid UTF-8 are skipped with a warning and counted as
 * failed in the {@link ScanStatistics}.
 */
public class SourcePatternScanner extends AbstractRegexScanner {

    public static final String SCANNER_ID = "source-patterns";
    private static final String DISPLAY_NAME = "Source Pattern Scanner";
    private static final String JAVA_FILE_PATTERN = "*.java";
    private static final int PRIORITY = 50;

    private final DetectorLibrary library;

    /**
     * Creates a scanner with the built-in detectors.
     */
    public SourcePatternScanner() {
        this(DetectorLibrary.defaults());
    }

    /**
     * Creates a scanner with a custom detector library.
     *
     * @param library detectors to apply
     */
    public SourcePatternScanner(DetectorLibrary library) {
        this.library = Objects.requireNonNull(library, "library must not be null");
    }

    @Override
    public String getId() {
        return SCANNER_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of(JAVA_FILE_PATTERN);
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean appliesTo(ScanContext context) {
        return hasAnyFiles(context, JAVA_FILE_PATTERN);
    }

    @Override
    public ScanResult scan(ScanContext context) {
        log.info("Scanning Java sources for anti-patterns in: {}", context.rootPath());

        ScanStatistics.Builder stats = new ScanStatistics.Builder();
        List<Path> files = capFiles(context.findFiles(JAVA_FILE_PATTERN), context.config().fileCap(), stats);

        List<Finding> findings = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Path file : files) {
            String relativePath = context.relativize(file);
            stats.incrementFilesScanned();
            try {
                findings.addAll(scanLines(relativePath, readFileLines(file)));
            } catch (IOException e) {
                recordUnreadable(relativePath, e, stats, warnings);
            }
        }

        log.info("Found {} source findings in {} files", findings.size(), files.size());

        return new ScanResult(getId(), true, null, findings, List.of(), null, null, warnings, List.of(), stats.build());
    }

    /**
     * Applies every detector to the lines of one file.
     *
     * @param relativePath file path relative to the root
     * @param rawLines raw file lines
     * @return findings in line order, then detector order
     */
    public List<Finding> scanLines(String relativePath, List<String> rawLines) {
        SourceFile file = new SourceFile(relativePath, codeLines(rawLines), String.join("\n", rawLines));
        List<Finding> findings = new ArrayList<>();

        for (int i = 0; i < file.lines().size(); i++) {
            if (file.lines().get(i).isBlank()) {
                continue;
            }
            for (LineDetector detector : library.detectors()) {
                detector.detect(file, i).ifPresent(findings::add);
            }
        }

        return findings;
    }
}
