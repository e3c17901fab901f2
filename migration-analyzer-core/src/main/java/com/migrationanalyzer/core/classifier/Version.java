package com.migrationanalyzer.core.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric view of a declared artifact version.
 *
 * <p>Only the leading dotted number run is compared ({@code 5.3.18.RELEASE} is {@code 5.3.18});
 * missing components count as zero. A pre-release qualifier (alpha, beta, milestone, release
 * candidate, snapshot) orders a version before the release with the same numbers.
 *
 * @param parts numeric components, at least one
 * @param preRelease whether the version carries a pre-release qualifier
 */
public record Version(List<Integer> parts, boolean preRelease) implements Comparable<Version> {

    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^[vV]?(\\d+(?:\\.\\d+)*)(.*)$");
    private static final Pattern PRE_RELEASE = Pattern.compile(
        "(?i)[.\\-_]?(alpha|beta|milestone|m\\d|rc|cr|snapshot|preview|ea).*");

    public Version {
        parts = List.copyOf(parts);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("parts must not be empty");
        }
    }

    /**
     * Parses a declared version.
     *
     * @param text declared version, may be null or a placeholder
     * @return parsed version, or empty if the text does not start with a number
     */
    public static Optional<Version> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = NUMERIC_PREFIX.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        List<Integer> parts = new ArrayList<>();
        for (String part : matcher.group(1).split("\\.")) {
            try {
                parts.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                // overlong component, e.g. a timestamp
                return Optional.empty();
            }
        }
        String qualifier = matcher.group(2).toLowerCase(Locale.ROOT);
        return Optional.of(new Version(parts, PRE_RELEASE.matcher(qualifier).matches()));
    }

    /**
     * Returns the major version component.
     *
     * @return first numeric component
     */
    public int major() {
        return parts.get(0);
    }

    /**
     * Checks whether this version orders strictly before another.
     *
     * @param other version to compare with
     * @return true if this version is lower
     */
    public boolean isBefore(Version other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Version other) {
        int length = Math.max(parts.size(), other.parts.size());
        for (int i = 0; i < length; i++) {
            int left = i < parts.size() ? parts.get(i) : 0;
            int right = i < other.parts.size() ? other.parts.get(i) : 0;
            if (left != right) {
                return Integer.compare(left, right);
            }
        }
        if (preRelease != other.preRelease) {
            return preRelease ? -1 : 1;
        }
        return 0;
    }
}
