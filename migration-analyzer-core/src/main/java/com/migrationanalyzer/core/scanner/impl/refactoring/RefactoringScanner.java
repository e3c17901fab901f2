package com.migrationanalyzer.core.scanner.impl.refactoring;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.migrationanalyzer.core.config.AnalysisThresholds;
import com.migrationanalyzer.core.model.RefactorOpportunity;
import com.migrationanalyzer.core.model.RefactorType;
import com.migrationanalyzer.core.scanner.ScanContext;
import com.migrationanalyzer.core.scanner.ScanResult;
import com.migrationanalyzer.core.scanner.ScanStatistics;
import com.migrationanalyzer.core.scanner.base.AbstractRegexScanner;
import com.migrationanalyzer.core.scanner.base.SourceLine;

/**
 * Scanner for structural refactoring candidates in Java files.
 *
 * <p>Uses the same capped file list as the source pattern scanner. Emits:
 * <ul>
 *   <li>{@code long_method} - method bodies longer than {@code longMethodLines}</li>
 *   <li>{@code god_class} - classes declaring more than {@code godClassPublicMethods} public methods</li>
 *   <li>{@code duplicate_code} - blocks of {@code duplicateBlockLines} normalized lines found in
 *       two or more places</li>
 * </ul>
 *
 * <p>Per-file opportunities come in file order, then line order; duplicates follow at the end.
 */
public class RefactoringScanner extends AbstractRegexScanner {

    public static final String SCANNER_ID = "refactoring";
    private static final String DISPLAY_NAME = "Refactoring Opportunity Scanner";
    private static final String JAVA_FILE_PATTERN = "*.java";
    private static final int PRIORITY = 100;

    private static final String LONG_METHOD_SUGGESTION =
        "Extract smaller methods with a single responsibility before migrating";
    private static final String GOD_CLASS_SUGGESTION =
        "Split the class by responsibility; migrate the parts independently";
    private static final String DUPLICATE_SUGGESTION =
        "Extract the duplicated block into a shared method so it is migrated once";

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
        log.info("Scanning Java sources for refactoring opportunities in: {}", context.rootPath());

        AnalysisThresholds thresholds = context.config().thresholds();
        ScanStatistics.Builder stats = new ScanStatistics.Builder();
        List<Path> files = capFiles(context.findFiles(JAVA_FILE_PATTERN), context.config().fileCap(), stats);

        List<RefactorOpportunity> opportunities = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        DuplicateBlockFinder duplicates = new DuplicateBlockFinder(thresholds.duplicateBlockLines());

        for (Path file : files) {
            String relativePath = context.relativize(file);
            stats.incrementFilesScanned();
            try {
                List<SourceLine> lines = codeLines(readFileLines(file));
                opportunities.addAll(structuralOpportunities(relativePath, lines, thresholds));
                duplicates.addFile(relativePath, lines);
            } catch (IOException e) {
                recordUnreadable(relativePath, e, stats, warnings);
            }
        }

        for (DuplicateBlockFinder.Duplicate duplicate : duplicates.findDuplicates()) {
            opportunities.add(toOpportunity(duplicate));
        }

        log.info("Found {} refactoring opportunities in {} files", opportunities.size(), files.size());

        return new ScanResult(getId(), true, null, List.of(), opportunities, null, null, warnings, List.of(),
            stats.build());
    }

    /**
     * Finds long methods and god classes in one file.
     *
     * @param relativePath file path relative to the root
     * @param lines non-comment lines of the file
     * @param thresholds size thresholds
     * @return opportunities in line order
     */
    public List<RefactorOpportunity> structuralOpportunities(String relativePath, List<SourceLine> lines,
                                                             AnalysisThresholds thresholds) {
        BraceStructure structure = BraceStructure.analyze(lines);
        List<RefactorOpportunity> result = new ArrayList<>();

        for (BraceStructure.ClassSpan type : structure.classes()) {
            if (type.publicMethods() > thresholds.godClassPublicMethods()) {
                result.add(new RefactorOpportunity(RefactorType.GOD_CLASS, relativePath, type.line(),
                    "Class " + type.name() + " declares " + type.publicMethods() + " public methods",
                    GOD_CLASS_SUGGESTION));
            }
        }
        for (BraceStructure.MethodSpan method : structure.methods()) {
            if (method.length() > thresholds.longMethodLines()) {
                result.add(new RefactorOpportunity(RefactorType.LONG_METHOD, relativePath, method.startLine(),
                    "Method " + method.name() + " spans " + method.length() + " lines",
                    LONG_METHOD_SUGGESTION));
            }
        }

        result.sort((a, b) -> Integer.compare(a.lineNumber(), b.lineNumber()));
        return result;
    }

    private RefactorOpportunity toOpportunity(DuplicateBlockFinder.Duplicate duplicate) {
        DuplicateBlockFinder.Location first = duplicate.locations().get(0);
        String places = duplicate.locations().stream()
            .map(location -> location.file() + ":" + location.lineNumber())
            .collect(Collectors.joining(", "));
        String details = "Block of " + duplicate.normalizedLines() + " lines duplicated in "
            + duplicate.locations().size() + " places: " + places;
        return new RefactorOpportunity(RefactorType.DUPLICATE_CODE, first.file(), first.lineNumber(), details,
            DUPLICATE_SUGGESTION);
    }
}
