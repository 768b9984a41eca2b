package com.eups.dependencyview;

import com.eups.dependencyview.cli.DependencyViewCommand;
import picocli.CommandLine;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Main entry point for the EUPS dependency viewer.
 * Prints the dependency graph of a package to standard output, ready to pipe into Graphviz.
 */
public class DependencyViewApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DependencyViewCommand())
                .setOut(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true))
                .execute(args);
        System.exit(exitCode);
    }
}
