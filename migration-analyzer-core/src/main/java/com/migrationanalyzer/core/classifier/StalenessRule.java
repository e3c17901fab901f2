package com.migrationanalyzer.core.classifier;

import com.migrationanalyzer.core.model.Dependency;

import java.util.Objects;

/**
 * Latest known version of an artifact or a whole group.
 *
 * @param key {@code group:artifact}, or {@code group:*} for every artifact of a group
 * @param latestVersion latest known release
 */
public record StalenessRule(String key, String latestVersion) {

    private static final String GROUP_WILDCARD = ":*";

    public StalenessRule {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(latestVersion, "latestVersion must not be null");
    }

    /**
     * Returns true if the key covers a whole group.
     *
     * @return true for {@code group:*} keys
     */
    public boolean isGroupWide() {
        return key.endsWith(GROUP_WILDCARD);
    }

    /**
     * Checks whether this rule covers a dependency.
     *
     * @param dependency declared dependency
     * @return true if the coordinate or the group matches the key
     */
    public boolean covers(Dependency dependency) {
        if (isGroupWide()) {
            String group = key.substring(0, key.length() - GROUP_WILDCARD.length());
            return group.equals(dependency.groupId());
        }
        return key.equals(dependency.groupId() + ":" + dependency.artifactId());
    }
}
