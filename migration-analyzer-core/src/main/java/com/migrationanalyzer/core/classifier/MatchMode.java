package com.migrationanalyzer.core.classifier;

import java.util.Locale;

/**
 * How a {@link VulnerabilityRule} compares its match text with an artifact id.
 * All modes ignore case.
 */
public enum MatchMode {
    /** The artifact id contains the match text. */
    CONTAINS,

    /** The artifact id starts with the match text. */
    PREFIX,

    /** The artifact id equals the match text. */
    EXACT;

    /**
     * Tests an artifact id against a match text.
     *
     * @param artifactId artifact id of the dependency
     * @param matchText rule match text
     * @return true if the artifact matches
     */
    public boolean matches(String artifactId, String matchText) {
        if (artifactId == null || matchText == null) {
            return false;
        }
        String artifact = artifactId.toLowerCase(Locale.ROOT);
        String text = matchText.toLowerCase(Locale.ROOT);
        return switch (this) {
            case CONTAINS -> artifact.contains(text);
            case PREFIX -> artifact.startsWith(text);
            case EXACT -> artifact.equals(text);
        };
    }
}
