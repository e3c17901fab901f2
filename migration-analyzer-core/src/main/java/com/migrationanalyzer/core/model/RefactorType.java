package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of refactoring opportunity.
 */
public enum RefactorType {
    LONG_METHOD("long_method"),
    GOD_CLASS("god_class"),
    DEPRECATED_API("deprecated_api"),
    DUPLICATE_CODE("duplicate_code");

    private final String id;

    RefactorType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
