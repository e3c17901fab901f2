package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One declared library reference from a build manifest.
 *
 * <p>Dependencies are created once per manifest entry and never merged: the same coordinate
 * declared in two build files yields two records, each scoped to its {@code sourceFile}.
 * Classification produces a new record via {@link #withVerdict(Severity, boolean, String)}.</p>
 *
 * @param coordinate {@code groupId:artifactId}, or the alias for version catalog references
 * @param groupId dependency group (empty for catalog aliases)
 * @param artifactId dependency artifact (the alias for catalog references)
 * @param declaredVersion version as declared, unresolved placeholders kept; null when unknown
 * @param scope Maven scope or mapped Gradle configuration
 * @param ecosystem manifest ecosystem
 * @param sourceFile manifest path relative to the analyzed root
 * @param outdated true if behind a known version or vulnerable
 * @param severity classification verdict
 * @param note human-readable reason, nullable
 */
public record Dependency(
    @JsonProperty("coordinate") String coordinate,
    @JsonProperty("group_id") String groupId,
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("declared_version") String declaredVersion,
    @JsonProperty("scope") String scope,
    @JsonProperty("ecosystem") Ecosystem ecosystem,
    @JsonProperty("source_file") String sourceFile,
    @JsonProperty("is_outdated") boolean outdated,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("note") String note
) {
    /**
     * Compact constructor with validation.
     */
    public Dependency {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
        Objects.requireNonNull(ecosystem, "ecosystem must not be null");
        if (groupId == null) {
            groupId = "";
        }
        if (coordinate == null) {
            coordinate = groupId.isEmpty() ? artifactId : groupId + ":" + artifactId;
        }
        if (scope == null) {
            scope = "compile";
        }
        if (severity == null) {
            severity = Severity.OK;
        }
    }

    /**
     * Creates an unclassified dependency as produced by the manifest parsers.
     *
     * @param groupId group id
     * @param artifactId artifact id
     * @param declaredVersion declared version, nullable
     * @param scope scope, nullable
     * @param ecosystem ecosystem
     * @param sourceFile manifest path relative to the root
     * @param note parse note, nullable
     * @return new dependency with severity OK
     */
    public static Dependency declared(String groupId, String artifactId, String declaredVersion,
                                      String scope, Ecosystem ecosystem, String sourceFile, String note) {
        return new Dependency(null, groupId, artifactId, declaredVersion, scope, ecosystem,
            sourceFile, false, Severity.OK, note);
    }

    /**
     * Returns a copy carrying the given classification verdict.
     *
     * @param newSeverity verdict severity
     * @param newOutdated outdated flag
     * @param newNote note, nullable
     * @return classified copy
     */
    public Dependency withVerdict(Severity newSeverity, boolean newOutdated, String newNote) {
        return new Dependency(coordinate, groupId, artifactId, declaredVersion, scope, ecosystem,
            sourceFile, newOutdated, newSeverity, newNote);
    }
}
