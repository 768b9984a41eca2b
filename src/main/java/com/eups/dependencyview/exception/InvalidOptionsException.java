package com.eups.dependencyview.exception;

import java.util.List;

/**
 * Collects every problem found in the command-line options so they can be reported together.
 */
public class InvalidOptionsException extends DependencyViewException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public InvalidOptionsException(List<String> problems) {
        super("Invalid options: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
