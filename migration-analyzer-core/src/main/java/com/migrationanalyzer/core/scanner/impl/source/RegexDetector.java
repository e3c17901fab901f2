package com.migrationanalyzer.core.scanner.impl.source;

import com.migrationanalyzer.core.model.FindingCategory;
import com.migrationanalyzer.core.model.Severity;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Triggers when a regular expression matches a line.
 *
 * <p>Two optional guards suppress a match: an exclusion pattern found on the same or the
 * previous line (for example an explicit null check before a getter chain), and a text found
 * anywhere in the file (for example {@code serialVersionUID} for a Serializable class).
 *
 * @param ruleId rule identifier
 * @param category finding category
 * @param severity finding severity
 * @param pattern pattern searched in the line
 * @param exclude pattern that suppresses the match on this or the previous line, may be null
 * @param unlessFileContains text that suppresses every match in the file, may be null
 * @param suggestion remediation advice
 */
public record RegexDetector(
    String ruleId,
    FindingCategory category,
    Severity severity,
    Pattern pattern,
    Pattern exclude,
    String unlessFileContains,
    String suggestion
) implements LineDetector {

    public RegexDetector {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    /**
     * Creates a detector without guards.
     */
    public static RegexDetector of(String ruleId, FindingCategory category, Severity severity,
                                   String regex, String suggestion) {
        return new RegexDetector(ruleId, category, severity, Pattern.compile(regex), null, null, suggestion);
    }

    @Override
    public String match(SourceFile file, int index) {
        String text = file.lines().get(index).text();
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        if (exclude != null && (exclude.matcher(text).find() || exclude.matcher(file.previousText(index)).find())) {
            return null;
        }
        if (unlessFileContains != null && file.content().contains(unlessFileContains)) {
            return null;
        }
        return matcher.group();
    }
}
