package com.eups.dependencyview.cli;

import com.eups.dependencyview.cli.options.ViewOptions;
import com.eups.dependencyview.cli.options.ViewOptionsValidator;
import com.eups.dependencyview.cli.output.ViewResultsPrinter;
import com.eups.dependencyview.exception.InvalidOptionsException;
import com.eups.dependencyview.fetch.DocumentFetcher;
import com.eups.dependencyview.fetch.HttpDocumentFetcher;
import com.eups.dependencyview.model.FailureKind;
import com.eups.dependencyview.util.FileWriteUtil;
import com.eups.dependencyview.view.DependencyViewGenerator;
import com.eups.dependencyview.view.DependencyViewResult;
import com.eups.dependencyview.view.ViewConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * CLI command that prints the dependency graph of one package in Graphviz DOT format.
 *
 * Exit codes: 0 success, 1 missing package name, invalid options or unwritable output file,
 * 2 package not in the index, 3 a document could not be fetched.
 */
@Command(
        name = "dependency-view",
        mixinStandardHelpOptions = true,
        version = "eups-dependency-view 1.0.0",
        exitCodeOnInvalidInput = DependencyViewCommand.EXIT_USAGE,
        description = "Resolves the dependency tree of a package from an EUPS distribution server and prints it as a Graphviz DOT graph.",
        footer = "%nExample:%n  dependency-view afw | dot -Tpng -o afw.png"
)
public class DependencyViewCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DependencyViewCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_WRITE_FAILED = 1;

    @Spec
    private CommandSpec spec;

    @Mixin
    private ViewOptions options;

    private final Function<ViewConfig, DocumentFetcher> fetcherFactory;
    private final ViewOptionsValidator validator = new ViewOptionsValidator();
    private final ViewResultsPrinter printer = new ViewResultsPrinter();

    public DependencyViewCommand() {
        this(config -> new HttpDocumentFetcher(config.toFetcherSettings()));
    }

    public DependencyViewCommand(Function<ViewConfig, DocumentFetcher> fetcherFactory) {
        this.fetcherFactory = fetcherFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        if (options.getPackageName() == null) {
            spec.commandLine().usage(out);
            out.flush();
            return EXIT_USAGE;
        }

        ViewConfig config;
        try {
            config = validator.validate(options);
        } catch (InvalidOptionsException e) {
            e.getProblems().forEach(problem -> log.error("{}", problem));
            return EXIT_USAGE;
        }

        printer.printBanner(config);

        DependencyViewGenerator generator = new DependencyViewGenerator(config, fetcherFactory.apply(config));
        DependencyViewResult result = generator.generate();

        if (!result.isSuccess()) {
            if (result.getFailureKind() == FailureKind.UNKNOWN_PACKAGE) {
                out.println(result.getErrorMessage());
                out.flush();
            } else {
                printer.printFailure(result);
            }
            return result.getFailureKind().getExitCode();
        }

        if (config.getOutputFile() != null) {
            try {
                FileWriteUtil.writeUtf8(config.getOutputFile(), result.getGraph());
            } catch (IOException e) {
                log.error("Failed to write graph to {}", config.getOutputFile(), e);
                return EXIT_WRITE_FAILED;
            }
        } else {
            out.print(result.getGraph());
            out.flush();
        }

        printer.printSuccess(config, result);
        return EXIT_OK;
    }
}
