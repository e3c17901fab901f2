package com.migrationanalyzer.core.scanner.impl.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.migrationanalyzer.core.scanner.ScanContext;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.ScanStatistics;
import com.migrationanalyzer.core.scanner.base.AbstractRegexScanner;
import com.migrationanalyzer.core.scanner.base.SourceLine;

/**
 * Infers the minimum Java language level a code base already relies on.
 *
 * <p>Reads a sample of source files and reports the highest level implied by the language
 * features found. Used when a manifest declares no version, and to flag manifests that declare a
 * level lower than the sources need.
 *
 * <table>
 *   <caption>Feature levels</caption>
 *   <tr><th>Feature</th><th>Level</th></tr>
 *   <tr><td>sealed types</td><td>17</td></tr>
 *   <tr><td>records, instanceof patterns</td><td>16</td></tr>
 *   <tr><td>text blocks</td><td>15</td></tr>
 *   <tr><td>switch arrows</td><td>14</td></tr>
 *   <tr><td>{@code var}</td><td>10</td></tr>
 *   <tr><td>{@code module-info.java}</td><td>9</td></tr>
 *   <tr><td>lambdas, method references, streams</td><td>8</td></tr>
 *   <tr><td>diamond, try-with-resources</td><td>7</td></tr>
 * </table>
 */
public class LanguageLevelDetector extends AbstractRegexScanner {

    /**
     * Number of source files sampled.
     */
    public static final int SAMPLE_SIZE = 20;

    public static final String SCANNER_ID = "language-level";
    private static final String DISPLAY_NAME = "Language Level Detector";
    private static final String JAVA_FILE_PATTERN = "*.java";
    private static final String MODULE_INFO = "module-info.java";
    private static final int PRIORITY = 60;
    private static final int MODULE_LEVEL = 9;

    private static final List<FeatureLevel> FEATURES = List.of(
        new FeatureLevel(17, Pattern.compile("\\bsealed\\s+(?:interface|class|abstract)\\b|\\bnon-sealed\\b|\\bpermits\\s+\\w+")),
        new FeatureLevel(16, Pattern.compile("\\brecord\\s+\\w+\\s*(?:<[^>]*>)?\\s*\\(|\\binstanceof\\s+[\\w.<>]+\\s+\\w+\\s*[)&|]")),
        new FeatureLevel(15, Pattern.compile("\"\"\"")),
        new FeatureLevel(14, Pattern.compile("\\bcase\\s+[^:]+->|\\bdefault\\s*->")),
        new FeatureLevel(10, Pattern.compile("(?:^|[\\s(])var\\s+\\w+\\s*[=:]")),
        new FeatureLevel(8, Pattern.compile("->|\\w::\\w|\\.stream\\(\\)")),
        new FeatureLevel(7, Pattern.compile("<>|\\btry\\s*\\("))
    );

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
        ScanStatistics.Builder stats = new ScanStatistics.Builder();
        List<Path> files = capFiles(context.findFiles(JAVA_FILE_PATTERN),
            Math.min(SAMPLE_SIZE, context.config().fileCap()), stats);

        List<String> warnings = new ArrayList<>();
        Integer level = null;

        for (Path file : files) {
            stats.incrementFilesScanned();
            int fileLevel;
            if (MODULE_INFO.equals(file.getFileName().toString())) {
                fileLevel = MODULE_LEVEL;
            } else {
                try {
                    fileLevel = levelOf(readFileLines(file));
                } catch (IOException e) {
                    recordUnreadable(context.relativize(file), e, stats, warnings);
                    continue;
                }
            }
            if (fileLevel > 0 && (level == null || fileLevel > level)) {
                level = fileLevel;
            }
        }

        log.debug("Detected source level {} from {} files", level, files.size());
        return new ScanResult(getId(), true, null, List.of(), List.of(), null, level, warnings, List.of(), stats.build());
    }

    /**
     * Returns the highest feature level used by one file.
     *
     * @param rawLines raw file lines
     * @return feature level, or 0 if no versioned feature is used
     */
    public int levelOf(List<String> rawLines) {
        int level = 0;
        for (SourceLine line : codeLines(rawLines)) {
            for (FeatureLevel feature : FEATURES) {
                if (feature.level() <= level) {
                    break;
                }
                if (matches(feature.pattern(), line.text())) {
                    level = feature.level();
                    break;
                }
            }
        }
        return level;
    }

    private record FeatureLevel(int level, Pattern pattern) {
    }
}
