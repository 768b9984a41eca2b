package com.eups.dependencyview.model;

/**
 * Fatal outcomes of a resolution run and the process exit code each one maps to.
 */
public enum FailureKind {

    /**
     * The root package or one of its dependencies is missing from the index.
     */
    UNKNOWN_PACKAGE(2),

    /**
     * The index or a manifest could not be retrieved.
     */
    FETCH_FAILED(3);

    private final int exitCode;

    FailureKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
