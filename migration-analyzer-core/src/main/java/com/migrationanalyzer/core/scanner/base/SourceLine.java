package com.migrationanalyzer.core.scanner.base;

/**
 * A non-comment line of a source or build file.
 *
 * @param lineNumber 1-based line number in the original file
 * @param text raw line text
 */
public record SourceLine(int lineNumber, String text) {

    /**
     * Returns the line text without leading and trailing whitespace.
     *
     * @return trimmed text
     */
    public String trimmed() {
        return text.trim();
    }

    /**
     * Returns true if the line holds only whitespace.
     *
     * @return true for blank lines
     */
    public boolean isBlank() {
        return text.isBlank();
    }
}
