package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parsed content of all manifests of one ecosystem.
 *
 * <p>{@code found} is true as soon as one manifest file exists, even if it could not be parsed;
 * parse problems are reported in {@code warnings}.</p>
 *
 * @param found whether any manifest of this ecosystem exists
 * @param languageVersion declared Java version, nullable
 * @param dependencies declared dependencies in manifest order
 * @param buildPlugins declared build plugins
 * @param manifestFiles manifest paths relative to the root
 * @param warnings parse and read warnings
 */
public record ManifestSummary(
    @JsonProperty("found") boolean found,
    @JsonProperty("language_version") String languageVersion,
    @JsonProperty("dependencies") List<Dependency> dependencies,
    @JsonProperty("build_plugins") List<BuildPlugin> buildPlugins,
    @JsonProperty("manifest_files") List<String> manifestFiles,
    @JsonProperty("warnings") List<String> warnings
) {
    public ManifestSummary {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        buildPlugins = buildPlugins == null ? List.of() : List.copyOf(buildPlugins);
        manifestFiles = manifestFiles == null ? List.of() : List.copyOf(manifestFiles);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Summary for an ecosystem with no manifest in the tree.
     *
     * @return summary with {@code found = false}
     */
    public static ManifestSummary notFound() {
        return new ManifestSummary(false, null, List.of(), List.of(), List.of(), List.of());
    }

    /**
     * Returns a copy with the dependency list replaced, e.g. after classification.
     *
     * @param classified replacement dependencies
     * @return updated summary
     */
    public ManifestSummary withDependencies(List<Dependency> classified) {
        return new ManifestSummary(found, languageVersion, classified, buildPlugins, manifestFiles, warnings);
    }
}
