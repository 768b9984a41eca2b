package com.eups.dependencyview.cli.output;

import com.eups.dependencyview.view.DependencyViewResult;
import com.eups.dependencyview.view.ViewConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible only for the diagnostic output of the command. Everything goes through the
 * logger, which writes to standard error; standard output is reserved for the graph.
 */
public class ViewResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ViewResultsPrinter.class);

    public void printBanner(ViewConfig config) {
        log.info("=================================================");
        log.info("EUPS Dependency View");
        log.info("=================================================");
        log.info("Package: {}", config.getPackageName());
        log.info("Repository: {}", config.getBaseUrl());
        log.info("Index: {}", config.getIndexUrl());
        log.info("Output: {}", config.getOutputFile() != null ? config.getOutputFile().toAbsolutePath() : "standard output");
        log.info("Timeouts: connect {} ms, read {} ms", config.getConnectTimeoutMs(), config.getReadTimeoutMs());
        log.info("=================================================");
    }

    public void printSuccess(ViewConfig config, DependencyViewResult result) {
        if (!config.isVerbose()) {
            log.info("Resolved {}: {} nodes, {} edges", result.getRootPackage(), result.getNodeCount(), result.getEdgeCount());
            return;
        }

        log.info("");
        log.info("=================================================");
        log.info("RESOLUTION SUCCESSFUL");
        log.info("=================================================");
        log.info("Root Package: {}", result.getRootPackage());
        log.info("Indexed Packages: {}", result.getIndexedPackages());
        log.info("Skipped Index Lines: {}", result.getSkippedIndexLines() != null ? result.getSkippedIndexLines().size() : 0);
        log.info("Manifests Fetched: {}", result.getManifestsFetched());
        log.info("Graph Nodes: {}", result.getNodeCount());
        log.info("Graph Edges: {}", result.getEdgeCount());
        if (config.getOutputFile() != null) {
            log.info("Graph written to: {}", config.getOutputFile().toAbsolutePath());
        }
        log.info("=================================================");
    }

    public void printFailure(DependencyViewResult result) {
        log.error("Resolution failed ({}): {}", result.getFailureKind(), result.getErrorMessage());
    }
}
