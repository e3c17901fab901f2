package com.migrationanalyzer.core.scanner.impl.source;

import com.migrationanalyzer.core.model.FindingCategory;
import com.migrationanalyzer.core.model.Severity;

import java.util.Objects;

/**
 * Triggers when a line contains a fixed text.
 *
 * @param ruleId rule identifier
 * @param category finding category
 * @param severity finding severity
 * @param needle text to look for, case-sensitive
 * @param suggestion remediation advice
 */
public record SubstringDetector(
    String ruleId,
    FindingCategory category,
    Severity severity,
    String needle,
    String suggestion
) implements LineDetector {

    public SubstringDetector {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(needle, "needle must not be null");
    }

    @Override
    public String match(SourceFile file, int index) {
        String text = file.lines().get(index).text();
        return text.contains(needle) ? text : null;
    }
}
