package com.migrationanalyzer.core.analysis;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.migrationanalyzer.core.model.JavaVersionAssessment;
import com.migrationanalyzer.core.model.Severity;

/**
 * Recommends a Java LTS upgrade target from the declared and detected Java versions.
 *
 * <p>The declared version wins when present; {@code 1.x} versions are normalized to {@code x}.
 * Without a declared version the minimum level implied by source features is used.
 */
public class JavaVersionAdvisor {

    /**
     * Current LTS release recommended as migration target.
     */
    public static final int TARGET_LTS = 21;

    private static final Pattern VERSION_NUMBER = Pattern.compile("^(?:1\\.)?(\\d+)");

    /**
     * Assesses the Java version of a repository.
     *
     * @param declaredVersion version from the build manifests, nullable
     * @param detectedSourceLevel minimum level implied by source features, nullable
     * @return recommendation
     */
    public JavaVersionAssessment assess(String declaredVersion, Integer detectedSourceLevel) {
        Integer declared = normalize(declaredVersion);
        String declaredText = declared == null ? null : String.valueOf(declared);
        String detectedText = detectedSourceLevel == null ? null : String.valueOf(detectedSourceLevel);

        if (declared != null) {
            return recommend(declared, declaredText, detectedText, "Declared Java version " + declared);
        }
        if (detectedSourceLevel != null) {
            return recommend(detectedSourceLevel, null, detectedText,
                "No Java version declared; sources use features of Java " + detectedSourceLevel + " or later");
        }
        return new JavaVersionAssessment(null, null, String.valueOf(TARGET_LTS), Severity.LOW,
            "Java version is unknown: no version declared in the manifests and no version-specific "
                + "language features detected");
    }

    private JavaVersionAssessment recommend(int version, String declared, String detected, String prefix) {
        String target = String.valueOf(TARGET_LTS);
        if (version >= TARGET_LTS) {
            return new JavaVersionAssessment(declared, detected, String.valueOf(version), Severity.OK,
                prefix + " is already on a current LTS release");
        }
        if (version <= 11) {
            return new JavaVersionAssessment(declared, detected, target, Severity.HIGH,
                prefix + " is out of free support; upgrade to Java " + TARGET_LTS + " LTS");
        }
        if (version <= 17) {
            return new JavaVersionAssessment(declared, detected, target, Severity.MEDIUM,
                prefix + " should move to Java " + TARGET_LTS + " LTS");
        }
        return new JavaVersionAssessment(declared, detected, target, Severity.LOW,
            prefix + " is a non-LTS release; move to Java " + TARGET_LTS + " LTS");
    }

    /**
     * Normalizes a version string such as {@code 1.8}, {@code 11} or {@code 17.0.2} to its
     * feature release number.
     *
     * @param version version text, nullable
     * @return feature release, or null if not parseable
     */
    public static Integer normalize(String version) {
        if (version == null) {
            return null;
        }
        Matcher matcher = VERSION_NUMBER.matcher(version.trim());
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
