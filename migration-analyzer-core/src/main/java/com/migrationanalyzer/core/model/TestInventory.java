package com.migrationanalyzer.core.model;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Raw test inventory of a source tree, before the coverage estimate is derived.
 *
 * @param testFileCount number of test source files
 * @param sourceFileCount number of non-test Java source files
 * @param importFrameworks test frameworks seen in test file imports
 */
public record TestInventory(
    int testFileCount,
    int sourceFileCount,
    SortedSet<String> importFrameworks
) {
    public TestInventory {
        testFileCount = Math.max(0, testFileCount);
        sourceFileCount = Math.max(0, sourceFileCount);
        importFrameworks = importFrameworks == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(importFrameworks));
    }

    public static TestInventory empty() {
        return new TestInventory(0, 0, null);
    }
}
