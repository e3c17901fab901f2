package com.migrationanalyzer.core.scanner.impl.source;

import com.migrationanalyzer.core.model.Finding;
import com.migrationanalyzer.core.model.FindingCategory;
import com.migrationanalyzer.core.model.Severity;

import java.util.Optional;

/**
 * A line-level source pattern.
 *
 * <p>Implementations are immutable. A detector triggers at most once per line; the finding is
 * always attributed to the line being tested, even when the detector looks at neighbouring
 * lines.
 *
 * @see SubstringDetector
 * @see RegexDetector
 * @see NextLineRegexDetector
 */
public interface LineDetector {

    String ruleId();

    FindingCategory category();

    Severity severity();

    String suggestion();

    /**
     * Tests one code line.
     *
     * @param file file being scanned
     * @param index index of the line in {@link SourceFile#lines()}
     * @return matched text, or null if the detector does not trigger
     */
    String match(SourceFile file, int index);

    /**
     * Tests one code line and builds the finding.
     *
     * @param file file being scanned
     * @param index index of the line in {@link SourceFile#lines()}
     * @return finding, if the detector triggers
     */
    default Optional<Finding> detect(SourceFile file, int index) {
        String matched = match(file, index);
        if (matched == null) {
            return Optional.empty();
        }
        return Optional.of(new Finding(ruleId(), category(), file.relativePath(),
            file.lines().get(index).lineNumber(), severity(), matched.trim(), suggestion()));
    }
}
