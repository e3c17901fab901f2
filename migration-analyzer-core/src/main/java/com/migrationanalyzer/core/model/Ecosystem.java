package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Build ecosystem a dependency was declared in.
 */
public enum Ecosystem {
    MAVEN("maven"),
    GRADLE("gradle");

    private final String id;

    Ecosystem(String id) {
        this.id = id;
    }

    /**
     * Returns the lowercase identifier used in reports.
     *
     * @return ecosystem id
     */
    @JsonValue
    public String id() {
        return id;
    }
}
