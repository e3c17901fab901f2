package com.migrationanalyzer.core.analysis;

import java.nio.file.Path;

/**
 * Thrown when the repository root cannot be analyzed at all: it does not exist, is not a
 * directory, or is not readable.
 *
 * <p>Problems with individual files never raise this exception; they are reported as warnings.
 */
public class RepositoryAccessException extends RuntimeException {

    private final transient Path root;

    public RepositoryAccessException(Path root, String message) {
        super(message + ": " + root);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
