package com.eups.dependencyview.resolver;

import com.eups.dependencyview.fetch.DocumentFetcher;
import com.eups.dependencyview.model.DependencyNode;
import com.eups.dependencyview.model.PackageCoordinate;
import com.eups.dependencyview.model.RepositoryLayout;
import com.eups.dependencyview.parser.ManifestParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the dependency tree of a package by fetching manifests depth-first in declaration order.
 *
 * <p>Every declared dependency becomes a child node, so every edge is present. A package is
 * fetched and expanded only the first time it is reached; later occurrences stay childless.
 * The visited set lives for one {@link #resolve} call.
 *
 * <p>Traversal uses an explicit stack so dependency depth is not limited by the call stack.
 * Fetches are issued in the same order as a recursive expansion would issue them.
 */
public class DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final CoordinateLookup lookup;
    private final DocumentFetcher fetcher;
    private final ManifestParser manifestParser;

    private int manifestsFetched;

    public DependencyResolver(CoordinateLookup lookup, DocumentFetcher fetcher) {
        this(lookup, fetcher, new ManifestParser());
    }

    public DependencyResolver(CoordinateLookup lookup, DocumentFetcher fetcher, ManifestParser manifestParser) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.manifestParser = Objects.requireNonNull(manifestParser, "manifestParser");
    }

    /**
     * Looks the package up first, so an unknown name fails before anything is fetched.
     */
    public DependencyNode resolve(String packageName) {
        return resolve(lookup.lookup(packageName));
    }

    public DependencyNode resolve(PackageCoordinate root) {
        Objects.requireNonNull(root, "root");
        manifestsFetched = 0;

        Set<String> visited = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        DependencyNode rootNode = new DependencyNode(root);
        stack.push(expand(rootNode, visited));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.hasNext()) {
                stack.pop();
                continue;
            }

            DependencyNode child = frame.next();
            if (visited.contains(child.getName())) {
                log.debug("{} already expanded, linking {} -> {} without children",
                        child.getName(), frame.node.getName(), child.getName());
                continue;
            }
            stack.push(expand(child, visited));
        }

        log.info("Resolved {}: {} manifests fetched, {} distinct packages",
                root.getName(), manifestsFetched, visited.size());
        return rootNode;
    }

    /**
     * Number of manifests fetched by the most recent {@link #resolve} call.
     */
    public int getManifestsFetched() {
        return manifestsFetched;
    }

    private Frame expand(DependencyNode node, Set<String> visited) {
        String url = RepositoryLayout.manifestUrl(node.getCoordinate());
        log.debug("Fetching manifest of {}: {}", node.getName(), url);

        List<String> manifest = fetcher.fetch(url);
        manifestsFetched++;

        for (String dependency : manifestParser.parse(manifest)) {
            node.addChild(new DependencyNode(lookup.lookup(dependency)));
        }
        visited.add(node.getName());

        return new Frame(node);
    }

    /**
     * A node whose children are being walked, with the position of the next child.
     */
    private static final class Frame {
        private final DependencyNode node;
        private int nextChild;

        private Frame(DependencyNode node) {
            this.node = node;
        }

        private boolean hasNext() {
            return nextChild < node.getChildren().size();
        }

        private DependencyNode next() {
            return node.getChildren().get(nextChild++);
        }
    }
}
