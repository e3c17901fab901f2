package com.migrationanalyzer.core.scanner;

import com.migrationanalyzer.core.config.AnalyzerConfig;
import com.migrationanalyzer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Context provided to scanners during execution.
 *
 * <p>Contains the analyzed root and the effective configuration. File discovery honours the
 * configured excluded directories and maximum depth, and returns files in a deterministic order.
 *
 * @param rootPath project root directory
 * @param config effective analyzer configuration
 */
public record ScanContext(
    Path rootPath,
    AnalyzerConfig config
) {
    private static final Logger log = LoggerFactory.getLogger(ScanContext.class);

    /**
     * Compact constructor with validation.
     */
    public ScanContext {
        Objects.requireNonNull(rootPath, "rootPath must not be null");
        if (config == null) {
            config = AnalyzerConfig.defaults();
        }
    }

    /**
     * Finds files whose name matches any of the given glob patterns.
     *
     * <p>Example patterns: {@code pom.xml}, {@code *.java}.
     *
     * @param fileNamePatterns file name glob patterns
     * @return matching files, shallower first, then by relative path
     */
    public List<Path> findFiles(String... fileNamePatterns) {
        return findFiles(Set.of(fileNamePatterns));
    }

    /**
     * Finds files whose name matches any of the given glob patterns.
     *
     * @param fileNamePatterns file name glob patterns
     * @return matching files, shallower first, then by relative path
     */
    public List<Path> findFiles(Set<String> fileNamePatterns) {
        try {
            return FileUtils.findFiles(rootPath, fileNamePatterns,
                config.excludedDirectories(), config.maxDepth());
        } catch (IOException e) {
            log.warn("Failed to walk {}: {}", rootPath, e.getMessage());
            return List.of();
        }
    }

    /**
     * Returns the path of a file relative to the root, with forward slashes.
     *
     * @param file file below the root
     * @return relative path string
     */
    public String relativize(Path file) {
        return FileUtils.relativePath(rootPath, file);
    }
}
