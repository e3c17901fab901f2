package com.migrationanalyzer.core.scanner.impl.source;

import com.migrationanalyzer.core.model.FindingCategory;
import com.migrationanalyzer.core.model.Severity;
import com.migrationanalyzer.core.scanner.base.SourceLine;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Triggers when a line matches an opening pattern and the next non-blank line matches a
 * closing pattern. The finding is attributed to the opening line.
 *
 * <p>Catches constructs split over two lines, such as
 * <pre>{@code
 * } catch (IOException e) {
 * }
 * }</pre>
 *
 * @param ruleId rule identifier
 * @param category finding category
 * @param severity finding severity
 * @param opening pattern for the line being tested
 * @param closing pattern for the next non-blank line
 * @param suggestion remediation advice
 */
public record NextLineRegexDetector(
    String ruleId,
    FindingCategory category,
    Severity severity,
    Pattern opening,
    Pattern closing,
    String suggestion
) implements LineDetector {

    public NextLineRegexDetector {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(opening, "opening must not be null");
        Objects.requireNonNull(closing, "closing must not be null");
    }

    @Override
    public String match(SourceFile file, int index) {
        Matcher matcher = opening.matcher(file.lines().get(index).text());
        if (!matcher.find()) {
            return null;
        }
        Optional<SourceLine> next = file.nextNonBlank(index);
        if (next.isEmpty() || !closing.matcher(next.get().text()).find()) {
            return null;
        }
        return matcher.group().trim() + " " + next.get().trimmed();
    }
}
