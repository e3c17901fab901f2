package com.migrationanalyzer.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a source finding.
 *
 * @since 1.0.0
 */
public enum FindingCategory {
    DEPRECATED_API("deprecated_api"),
    NULL_SAFETY("null_safety"),
    EXCEPTION_HANDLING("exception_handling"),
    THREAD_SAFETY("thread_safety"),
    STRING_COMPARISON("string_comparison"),
    HARDCODED_VALUE("hardcoded_value"),
    SERIALIZATION("serialization"),
    TEST_COVERAGE("test_coverage");

    private final String id;

    FindingCategory(String id) {
        this.id = id;
    }

    /**
     * Returns the snake_case identifier used in reports.
     *
     * @return category id
     */
    @JsonValue
    public String id() {
        return id;
    }
}
