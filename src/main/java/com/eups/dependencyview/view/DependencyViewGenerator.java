package com.eups.dependencyview.view;

import com.eups.dependencyview.exception.DocumentFetchException;
import com.eups.dependencyview.exception.PackageLookupException;
import com.eups.dependencyview.fetch.DocumentFetcher;
import com.eups.dependencyview.model.DependencyNode;
import com.eups.dependencyview.model.FailureKind;
import com.eups.dependencyview.model.PackageIndex;
import com.eups.dependencyview.parser.IndexParser;
import com.eups.dependencyview.render.DotGraphRenderer;
import com.eups.dependencyview.resolver.CoordinateLookup;
import com.eups.dependencyview.resolver.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Runs the whole pipeline for one package: fetch and parse the index, check the package is
 * listed, resolve its dependency tree and render it as DOT.
 *
 * Any lookup or fetch failure ends the run with a failed result and no graph.
 */
public class DependencyViewGenerator {
    private static final Logger log = LoggerFactory.getLogger(DependencyViewGenerator.class);

    private final ViewConfig config;
    private final DocumentFetcher fetcher;
    private final IndexParser indexParser;
    private final DotGraphRenderer renderer;

    public DependencyViewGenerator(ViewConfig config, DocumentFetcher fetcher) {
        this.config = config;
        this.fetcher = fetcher;
        this.indexParser = new IndexParser(config.isVerbose());
        this.renderer = new DotGraphRenderer();
    }

    public DependencyViewResult generate() {
        String packageName = config.getPackageName();
        String indexUrl = config.getIndexUrl();

        try {
            log.info("Step 1: Fetching package index {}", indexUrl);
            PackageIndex index = indexParser.parse(fetcher.fetch(indexUrl));
            log.info("Index lists {} packages", index.size());

            CoordinateLookup lookup = new CoordinateLookup(index, config.getBaseUrl());
            if (!lookup.isKnown(packageName)) {
                log.debug("{} is not listed in {}", packageName, indexUrl);
                return DependencyViewResult.failure(FailureKind.UNKNOWN_PACKAGE,
                        new PackageLookupException(packageName, indexUrl).getMessage());
            }

            log.info("Step 2: Resolving dependencies of {}", packageName);
            DependencyResolver resolver = new DependencyResolver(lookup, fetcher);
            DependencyNode tree = resolver.resolve(packageName);

            log.info("Step 3: Rendering graph");
            String graph = renderer.render(tree, config.getEffectiveTitle());

            int nodeCount = countNodes(tree);
            return DependencyViewResult.builder()
                    .success(true)
                    .rootPackage(packageName)
                    .indexUrl(indexUrl)
                    .tree(tree)
                    .graph(graph)
                    .indexedPackages(index.size())
                    .skippedIndexLines(index.getSkippedLines())
                    .manifestsFetched(resolver.getManifestsFetched())
                    .nodeCount(nodeCount)
                    .edgeCount(nodeCount - 1)
                    .build();

        } catch (PackageLookupException e) {
            log.warn("Dependency {} of the {} tree is not listed in {}", e.getPackageName(), packageName, e.getIndexUrl());
            return DependencyViewResult.failure(FailureKind.UNKNOWN_PACKAGE, e.getMessage());
        } catch (DocumentFetchException e) {
            log.debug("Resolution of {} aborted", packageName, e);
            return DependencyViewResult.failure(FailureKind.FETCH_FAILED, e.getMessage());
        }
    }

    private static int countNodes(DependencyNode root) {
        int count = 0;
        Deque<DependencyNode> pending = new ArrayDeque<>(List.of(root));
        while (!pending.isEmpty()) {
            DependencyNode node = pending.pop();
            count++;
            node.getChildren().forEach(pending::push);
        }
        return count;
    }
}
