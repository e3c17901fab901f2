package com.migrationanalyzer.core.scanner.impl.source;

import com.migrationanalyzer.core.scanner.base.SourceLine;

import java.util.List;
import java.util.Optional;

/**
 * Code lines of one source file, as seen by the line detectors.
 *
 * @param relativePath path relative to the analyzed root
 * @param lines non-comment lines in file order
 * @param content full raw content, for file-level guards
 */
public record SourceFile(String relativePath, List<SourceLine> lines, String content) {

    public SourceFile {
        lines = List.copyOf(lines);
        if (content == null) {
            content = "";
        }
    }

    /**
     * Returns the text of the code line before {@code index}, or an empty string.
     *
     * @param index index into {@link #lines()}
     * @return previous line text
     */
    public String previousText(int index) {
        return index > 0 ? lines.get(index - 1).text() : "";
    }

    /**
     * Returns the first non-blank code line after {@code index}.
     *
     * @param index index into {@link #lines()}
     * @return next non-blank line, if any
     */
    public Optional<SourceLine> nextNonBlank(int index) {
        for (int i = index + 1; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                return Optional.of(lines.get(i));
            }
        }
        return Optional.empty();
    }
}
