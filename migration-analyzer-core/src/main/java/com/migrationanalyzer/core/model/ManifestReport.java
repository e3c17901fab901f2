package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Manifest parsing result for both supported ecosystems.
 *
 * @param maven Maven summary
 * @param gradle Gradle summary
 */
public record ManifestReport(
    @JsonProperty("maven") ManifestSummary maven,
    @JsonProperty("gradle") ManifestSummary gradle
) {
    public ManifestReport {
        if (maven == null) {
            maven = ManifestSummary.notFound();
        }
        if (gradle == null) {
            gradle = ManifestSummary.notFound();
        }
    }

    /**
     * Maven dependencies followed by Gradle dependencies.
     *
     * @return all dependencies in report order
     */
    public List<Dependency> allDependencies() {
        List<Dependency> all = new ArrayList<>(maven.dependencies());
        all.addAll(gradle.dependencies());
        return List.copyOf(all);
    }

    /**
     * Returns true if neither a Maven nor a Gradle manifest exists.
     *
     * @return true when no manifest was found
     */
    public boolean noManifestFound() {
        return !maven.found() && !gradle.found();
    }
}
