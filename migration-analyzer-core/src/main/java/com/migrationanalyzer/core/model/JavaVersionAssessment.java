package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Java version upgrade recommendation.
 *
 * @param declaredVersion version declared in the manifests, normalized (e.g. "8"), nullable
 * @param detectedSourceLevel minimum level implied by language features in sources, nullable
 * @param recommendedTarget recommended LTS target version
 * @param severity urgency of the upgrade
 * @param reason explanation
 */
public record JavaVersionAssessment(
    @JsonProperty("declared_version") String declaredVersion,
    @JsonProperty("detected_source_level") String detectedSourceLevel,
    @JsonProperty("recommended_target") String recommendedTarget,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("reason") String reason
) {
}
