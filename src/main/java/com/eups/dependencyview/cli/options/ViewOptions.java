package com.eups.dependencyview.cli.options;

import com.eups.dependencyview.model.RepositoryLayout;
import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * Holds all CLI options for the dependency view command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ViewOptions {

    @Parameters(index = "0", arity = "0..1", paramLabel = "<pkg_name>", description = "Package to resolve, as listed in the repository index")
    private String packageName;

    @Option(names = { "--base-url", "-u" }, defaultValue = RepositoryLayout.DEFAULT_BASE_URL, description = "Root URL of the package repository (default: ${DEFAULT-VALUE})")
    private String baseUrl;

    @Option(names = { "--title", "-t" }, description = "Graph title (default: \"Dependencies for <pkg_name>\")")
    private String title;

    @Option(names = { "--output", "-o" }, description = "Write the graph to this file instead of standard output")
    private Path outputFile;

    @Option(names = { "--connect-timeout-ms" }, defaultValue = "10000", description = "Connect timeout per fetch in milliseconds, 0 for none (default: ${DEFAULT-VALUE})")
    private long connectTimeoutMs;

    @Option(names = { "--read-timeout-ms" }, defaultValue = "30000", description = "Read timeout per fetch in milliseconds, 0 for none (default: ${DEFAULT-VALUE})")
    private long readTimeoutMs;

    @Option(names = { "--verbose", "-v" }, description = "Report skipped index lines and a resolution summary")
    private boolean verbose;
}
