package com.migrationanalyzer.core.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.migrationanalyzer.core.model.Dependency;
import com.migrationanalyzer.core.model.Severity;

import java.util.Objects;
import java.util.Optional;

/**
 * Known vulnerable artifact.
 *
 * <p>A rule applies when the artifact id matches and the declared version is either unknown,
 * unparseable, or lower than {@code fixedIn}. Unknown versions count as vulnerable: a missed
 * CRITICAL costs more than a false alarm.
 *
 * <p>Rules can be declared in {@code migration-analyzer.yaml} under {@code vulnerabilities:}.
 *
 * @param match artifact id text to match
 * @param mode match mode, CONTAINS when omitted
 * @param cveId advisory identifier
 * @param description short description of the issue
 * @param severity verdict severity, HIGH when omitted
 * @param fixedIn first fixed version, or null if every version is affected
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VulnerabilityRule(
    @JsonProperty("match") String match,
    @JsonProperty("mode") MatchMode mode,
    @JsonProperty("cveId") String cveId,
    @JsonProperty("description") String description,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("fixedIn") String fixedIn
) {
    public VulnerabilityRule {
        Objects.requireNonNull(match, "match must not be null");
        if (mode == null) {
            mode = MatchMode.CONTAINS;
        }
        if (cveId == null) {
            cveId = "UNKNOWN-CVE";
        }
        if (description == null) {
            description = "Known vulnerable component";
        }
        if (severity == null) {
            severity = Severity.HIGH;
        }
    }

    /**
     * Checks whether this rule applies to a dependency.
     *
     * @param dependency declared dependency
     * @return true if the artifact matches and the version is not known to be fixed
     */
    public boolean appliesTo(Dependency dependency) {
        if (!mode.matches(dependency.artifactId(), match)) {
            return false;
        }
        Optional<Version> fixed = Version.parse(fixedIn);
        if (fixed.isEmpty()) {
            return true;
        }
        return Version.parse(dependency.declaredVersion())
            .map(declared -> declared.isBefore(fixed.get()))
            .orElse(true);
    }

    /**
     * Builds the verdict note for a matched dependency.
     *
     * @return note in the form {@code CVE: description (fixed in X)}
     */
    public String note() {
        String note = cveId + ": " + description;
        return fixedIn == null ? note : note + " (fixed in " + fixedIn + ")";
    }
}
