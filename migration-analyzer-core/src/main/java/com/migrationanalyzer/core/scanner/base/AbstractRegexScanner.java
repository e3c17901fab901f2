package com.migrationanalyzer.core.scanner.base;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for scanners that read source and build files line by line with
 * regular expressions.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Comment stripping for C-style languages (Java, Groovy, Kotlin build scripts)</li>
 *   <li>Match extraction with numbered groups</li>
 *   <li>String literal utilities</li>
 * </ul>
 *
 * <h3>When to Use This Base Class</h3>
 * <p>Use AbstractRegexScanner when a line-level heuristic is enough and a full parser would be
 * overkill, or when the input (a Gradle script) has no practical parser available on the JVM.
 *
 * @see AbstractScanner
 */
public abstract class AbstractRegexScanner extends AbstractScanner {

    /**
     * Constructor that initializes the logger from AbstractScanner.
     */
    protected AbstractRegexScanner() {
        super();
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher if found, null otherwise
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Extracts a numbered group from a matcher.
     *
     * @param matcher matcher with results
     * @param groupIndex index of the capture group (1-based)
     * @return captured text, or null if group not found
     */
    protected String extractGroup(Matcher matcher, int groupIndex) {
        try {
            return matcher.group(groupIndex);
        } catch (IndexOutOfBoundsException | IllegalStateException e) {
            return null;
        }
    }

    // ==================== Line-by-Line Processing ====================

    /**
     * Returns the lines that are not comments, keeping their original 1-based line numbers.
     *
     * <p>Line comments ({@code //}), Javadoc continuation lines ({@code *}) and block comments
     * spanning several lines are dropped. A block comment opened after code on the same line is
     * not tracked.
     *
     * @param lines raw file lines
     * @return code lines in file order
     */
    protected List<SourceLine> codeLines(List<String> lines) {
        List<SourceLine> code = new ArrayList<>(lines.size());
        boolean inBlockComment = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.trim();

            if (inBlockComment) {
                if (trimmed.contains("*/")) {
                    inBlockComment = false;
                }
                continue;
            }
            if (trimmed.startsWith("/*")) {
                inBlockComment = !trimmed.substring(2).contains("*/");
                continue;
            }
            if (isComment(trimmed)) {
                continue;
            }
            code.add(new SourceLine(i + 1, line));
        }

        return code;
    }

    // ==================== String Utilities ====================

    /**
     * Trims whitespace and removes surrounding quotes from a string.
     *
     * @param text text to clean
     * @return cleaned text
     */
    protected String cleanQuotes(String text) {
        if (text == null) {
            return "";
        }

        String trimmed = text.trim();

        // Remove surrounding single or double quotes
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }

        return trimmed;
    }

    /**
     * Checks if a line is a single-line comment in Java, Groovy or Kotlin.
     *
     * @param line line of code to check
     * @return true if line appears to be a comment
     */
    protected boolean isComment(String line) {
        if (line == null) {
            return false;
        }

        String trimmed = line.trim();
        return trimmed.startsWith("//")
            || trimmed.startsWith("/*")
            || trimmed.startsWith("*");
    }
}
