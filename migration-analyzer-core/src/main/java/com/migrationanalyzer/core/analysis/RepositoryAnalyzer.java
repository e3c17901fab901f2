package com.migrationanalyzer.core.analysis;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.migrationanalyzer.core.config.AnalyzerConfig;
import com.migrationanalyzer.core.model.AnalysisReport;
import com.migrationanalyzer.core.model.Finding;
import com.migrationanalyzer.core.model.ManifestReport;
import com.migrationanalyzer.core.scanner.ScanContext;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.Scanner;
import com.migrationanalyzer.core.scanner.impl.manifest.GradleManifestScanner;
import com.migrationanalyzer.core.scanner.impl.manifest.MavenManifestScanner;
import com.migrationanalyzer.core.scanner.impl.source.SourcePatternScanner;

/**
 * Entry point of the analysis.
 *
 * <p>Orchestrates the pipeline for one checked-out repository:
 * <ol>
 *   <li>Validate the root directory</li>
 *   <li>Run every scanner that applies, in parallel or in priority order</li>
 *   <li>Join the results into an {@link AnalysisReport} with the {@link ReportAggregator}</li>
 * </ol>
 *
 * <p>Scanners are discovered via {@link ServiceLoader} unless given explicitly. They only read
 * the tree, so parallel and sequential runs produce identical reports. A scanner that throws is
 * logged and recorded as a failed result; the report is still produced.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RepositoryAnalyzer analyzer = new RepositoryAnalyzer(ConfigLoader.load(configPath));
 * AnalysisReport report = analyzer.analyze(Path.of("/checkouts/legacy-app"));
 * }</pre>
 */
public class RepositoryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RepositoryAnalyzer.class);

    private final AnalyzerConfig config;
    private final List<Scanner> scanners;

    public RepositoryAnalyzer() {
        this(AnalyzerConfig.defaults());
    }

    public RepositoryAnalyzer(AnalyzerConfig config) {
        this(config, discoverScanners());
    }

    /**
     * Creates an analyzer with an explicit scanner set.
     *
     * @param config analyzer configuration, null for defaults
     * @param scanners scanners to run
     */
    public RepositoryAnalyzer(AnalyzerConfig config, List<Scanner> scanners) {
        this.config = config == null ? AnalyzerConfig.defaults() : config;
        List<Scanner> sorted = new ArrayList<>(Objects.requireNonNull(scanners, "scanners must not be null"));
        sorted.sort(Comparator.comparingInt(Scanner::getPriority).thenComparing(Scanner::getId));
        this.scanners = List.copyOf(sorted);
    }

    /**
     * Analyzes a repository.
     *
     * @param root checked-out repository root
     * @return the analysis report
     * @throws RepositoryAccessException if the root is missing, not a directory or not readable
     */
    public AnalysisReport analyze(Path root) {
        ScanContext context = createContext(root, config);
        log.info("Analyzing repository: {}", context.rootPath());

        Map<String, ScanResult> results = config.parallel()
            ? runParallel(scanners, context)
            : runSequential(scanners, context);

        return new ReportAggregator(config).aggregate(results);
    }

    /**
     * Parses the Maven and Gradle manifests without classifying them.
     *
     * @param root checked-out repository root
     * @return manifest summaries, {@code found = false} for absent ecosystems
     * @throws RepositoryAccessException if the root is not accessible
     */
    public ManifestReport parseManifests(Path root) {
        ScanContext context = createContext(root, config);
        ScanResult maven = runScanner(scannerOrDefault(MavenManifestScanner.SCANNER_ID, new MavenManifestScanner()),
            context);
        ScanResult gradle = runScanner(scannerOrDefault(GradleManifestScanner.SCANNER_ID, new GradleManifestScanner()),
            context);
        return new ManifestReport(maven.manifest(), gradle.manifest());
    }

    /**
     * Scans at most {@code fileCap} Java files for source anti-patterns.
     *
     * @param root checked-out repository root
     * @param fileCap maximum number of files to read
     * @return findings in file, line and detector order
     * @throws RepositoryAccessException if the root is not accessible
     * @throws IllegalArgumentException if {@code fileCap} is negative
     */
    public List<Finding> scanSource(Path root, int fileCap) {
        ScanContext context = createContext(root, config.withFileCap(fileCap));
        Scanner scanner = scannerOrDefault(SourcePatternScanner.SCANNER_ID, new SourcePatternScanner());
        return runScanner(scanner, context).findings();
    }

    private Map<String, ScanResult> runSequential(List<Scanner> toRun, ScanContext context) {
        Map<String, ScanResult> results = new LinkedHashMap<>();
        for (Scanner scanner : toRun) {
            results.put(scanner.getId(), runScanner(scanner, context));
        }
        return results;
    }

    private Map<String, ScanResult> runParallel(List<Scanner> toRun, ScanContext context) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, toRun.size()));
        try {
            List<CompletableFuture<ScanResult>> futures = new ArrayList<>();
            for (Scanner scanner : toRun) {
                futures.add(CompletableFuture.supplyAsync(() -> runScanner(scanner, context), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            Map<String, ScanResult> results = new LinkedHashMap<>();
            for (int i = 0; i < toRun.size(); i++) {
                results.put(toRun.get(i).getId(), futures.get(i).join());
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Runs one scanner, converting any exception into a failed result.
     */
    private ScanResult runScanner(Scanner scanner, ScanContext context) {
        try {
            if (!scanner.appliesTo(context)) {
                log.debug("Scanner {} does not apply to this project", scanner.getId());
                return ScanResult.empty(scanner.getId());
            }
            log.info("Running scanner: {} ({})", scanner.getDisplayName(), scanner.getId());
            ScanResult result = scanner.scan(context);
            if (result.statistics().hasFailures()) {
                log.debug("Scanner {} statistics: {}", scanner.getId(), result.statistics().getSummary());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Scanner {} failed: {}", scanner.getId(), e.getMessage(), e);
            return ScanResult.failed(scanner.getId(), List.of(String.valueOf(e.getMessage())));
        }
    }

    private Scanner scannerOrDefault(String scannerId, Scanner fallback) {
        return scanners.stream()
            .filter(scanner -> scanner.getId().equals(scannerId))
            .findFirst()
            .orElse(fallback);
    }

    private static ScanContext createContext(Path root, AnalyzerConfig config) {
        if (root == null) {
            throw new RepositoryAccessException(Path.of(""), "Repository root must not be null");
        }
        Path absolute = root.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new RepositoryAccessException(absolute, "Repository root does not exist");
        }
        if (!Files.isDirectory(absolute)) {
            throw new RepositoryAccessException(absolute, "Repository root is not a directory");
        }
        if (!Files.isReadable(absolute)) {
            throw new RepositoryAccessException(absolute, "Repository root is not readable");
        }
        return new ScanContext(absolute, config);
    }

    /**
     * Discovers all scanners registered in {@code META-INF/services}.
     */
    private static List<Scanner> discoverScanners() {
        ServiceLoader<Scanner> loader = ServiceLoader.load(Scanner.class);
        List<Scanner> discovered = new ArrayList<>();
        loader.forEach(discovered::add);
        log.debug("Discovered {} scanners", discovered.size());
        return discovered;
    }

    public List<Scanner> getScanners() {
        return scanners;
    }
}
