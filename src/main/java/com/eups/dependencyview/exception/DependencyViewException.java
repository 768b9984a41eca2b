package com.eups.dependencyview.exception;

/**
 * Base type for failures that abort a dependency resolution run.
 */
public class DependencyViewException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DependencyViewException(String message) {
        super(message);
    }

    public DependencyViewException(String message, Throwable cause) {
        super(message, cause);
    }
}
