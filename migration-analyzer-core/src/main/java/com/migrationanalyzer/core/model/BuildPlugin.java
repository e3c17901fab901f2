package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Build plugin declared in a manifest.
 *
 * @param groupId Maven plugin group, null for Gradle plugin ids
 * @param artifactId Maven plugin artifact or Gradle plugin id
 * @param version declared version, nullable
 */
public record BuildPlugin(
    @JsonProperty("group_id") String groupId,
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("version") String version
) {
    public BuildPlugin {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
    }
}
