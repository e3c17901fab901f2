package com.migrationanalyzer.core.scanner.impl.refactoring;

import com.migrationanalyzer.core.scanner.base.SourceLine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds blocks of normalized lines that occur in more than one place.
 *
 * <p>Lines are trimmed and whitespace-collapsed; trivial lines (braces, imports, package
 * declarations, lone annotations) are dropped. Every run of {@code windowSize} consecutive
 * remaining lines is a window. Windows with the same text form a group; a group with two or
 * more locations is a duplicate. When a duplicated region is longer than one window, only its
 * first window is reported, with the full extent.
 *
 * <p>Files must be added in a deterministic order; groups are reported in order of first
 * appearance.
 */
public class DuplicateBlockFinder {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> TRIVIAL_LINES = Set.of(
        "{", "}", "};", "});", ")", ");", "{}", "else {", "} else {", "try {", "return;", "break;",
        "@Override", "default:");

    private final int windowSize;
    private final Map<String, List<Location>> groups = new LinkedHashMap<>();
    private final Map<WindowRef, String> windowKeys = new HashMap<>();

    /**
     * Creates a finder.
     *
     * @param windowSize number of normalized lines per window, at least 2
     */
    public DuplicateBlockFinder(int windowSize) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be at least 2, was " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /**
     * Adds the code lines of one file.
     *
     * @param relativePath file path relative to the root
     * @param lines non-comment lines in file order
     */
    public void addFile(String relativePath, List<SourceLine> lines) {
        List<SourceLine> normalized = new ArrayList<>();
        for (SourceLine line : lines) {
            String text = normalize(line.text());
            if (!isTrivial(text)) {
                normalized.add(new SourceLine(line.lineNumber(), text));
            }
        }

        for (int start = 0; start + windowSize <= normalized.size(); start++) {
            StringBuilder key = new StringBuilder();
            for (int i = start; i < start + windowSize; i++) {
                key.append(normalized.get(i).text()).append('\n');
            }
            String windowKey = key.toString();
            List<Location> locations = groups.computeIfAbsent(windowKey, k -> new ArrayList<>());
            if (overlapsLast(locations, relativePath, start)) {
                continue;
            }
            locations.add(new Location(relativePath, start, normalized.get(start).lineNumber()));
            windowKeys.put(new WindowRef(relativePath, start), windowKey);
        }
    }

    /**
     * Returns the duplicate groups found so far.
     *
     * @return duplicates in order of first appearance
     */
    public List<Duplicate> findDuplicates() {
        List<Duplicate> duplicates = new ArrayList<>();
        for (List<Location> locations : groups.values()) {
            if (locations.size() < 2 || extendsPrecedingGroup(locations)) {
                continue;
            }
            duplicates.add(new Duplicate(List.copyOf(locations), windowSize + followingWindows(locations)));
        }
        return duplicates;
    }

    private boolean overlapsLast(List<Location> locations, String relativePath, int start) {
        if (locations.isEmpty()) {
            return false;
        }
        Location last = locations.get(locations.size() - 1);
        return last.file().equals(relativePath) && start < last.windowIndex() + windowSize;
    }

    /**
     * A group extends a preceding one when every location's previous window belongs to one
     * common group of the same size.
     */
    private boolean extendsPrecedingGroup(List<Location> locations) {
        return shiftedGroupKey(locations, -1) != null;
    }

    private int followingWindows(List<Location> locations) {
        int extra = 0;
        List<Location> current = locations;
        while (true) {
            String nextKey = shiftedGroupKey(current, 1);
            if (nextKey == null) {
                return extra;
            }
            current = groups.get(nextKey);
            extra++;
        }
    }

    private String shiftedGroupKey(List<Location> locations, int offset) {
        String commonKey = null;
        for (Location location : locations) {
            String key = windowKeys.get(new WindowRef(location.file(), location.windowIndex() + offset));
            if (key == null || (commonKey != null && !commonKey.equals(key))) {
                return null;
            }
            commonKey = key;
        }
        List<Location> shifted = groups.get(commonKey);
        if (shifted == null || shifted.size() != locations.size()) {
            return null;
        }
        for (Location location : locations) {
            if (shifted.stream().noneMatch(s -> s.file().equals(location.file())
                && s.windowIndex() == location.windowIndex() + offset)) {
                return null;
            }
        }
        return commonKey;
    }

    static String normalize(String text) {
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }

    private static boolean isTrivial(String text) {
        return text.isEmpty()
            || TRIVIAL_LINES.contains(text)
            || text.startsWith("import ")
            || text.startsWith("package ")
            || (text.startsWith("@") && !text.contains(" "));
    }

    /**
     * Start of a window in one file.
     *
     * @param file file path relative to the root
     * @param windowIndex index of the first normalized line
     * @param lineNumber 1-based line number of the first normalized line
     */
    public record Location(String file, int windowIndex, int lineNumber) {
    }

    /**
     * A duplicated block.
     *
     * @param locations every place the block occurs, in discovery order
     * @param normalizedLines length of the duplicated region in normalized lines
     */
    public record Duplicate(List<Location> locations, int normalizedLines) {
    }

    private record WindowRef(String file, int windowIndex) {
    }
}
