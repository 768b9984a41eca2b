package com.eups.dependencyview.view;

import com.eups.dependencyview.fetch.InMemoryDocumentFetcher;
import com.eups.dependencyview.model.DependencyNode;
import com.eups.dependencyview.model.FailureKind;
import org.junit.jupiter.api.Test;

import static com.eups.dependencyview.fetch.InMemoryDocumentFetcher.BASE_URL;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end runs of the generator against an in-memory repository.
 */
class DependencyViewGeneratorTest {

    private final InMemoryDocumentFetcher fetcher = new InMemoryDocumentFetcher();

    private DependencyViewResult generate(String packageName) {
        ViewConfig config = ViewConfig.builder()
                .packageName(packageName)
                .baseUrl(BASE_URL)
                .build();
        return new DependencyViewGenerator(config, fetcher).generate();
    }

    @Test
    void testSingleDependencyEndToEnd() {
        fetcher.index("EUPS distribution", "afw generic 1.0 ", "foo generic 2.0 ")
                .manifest("afw", "1.0", ">merge pkg=foo", ">self")
                .manifest("foo", "2.0", ">self");

        DependencyViewResult result = generate("afw");

        assertThat(result.isSuccess()).isTrue();
        DependencyNode tree = result.getTree();
        assertThat(tree.getName()).isEqualTo("afw");
        assertThat(tree.getChildren()).extracting(DependencyNode::getName).containsExactly("foo");
        assertThat(tree.getChildren().get(0).getChildren()).isEmpty();

        assertThat(result.getGraph()).isEqualTo("""
                digraph "Dependencies for afw" {
                 graph [rankdir = "BT"];
                  "afw" [label = "{<head> afw | <end>}"
                     shape = "record"];
                  "foo" [label = "{<head> foo | <end>}"
                     shape = "record"];
                  "afw":head -> "foo":end [id = 0];
                }
                """);
        assertThat(result.getNodeCount()).isEqualTo(2);
        assertThat(result.getEdgeCount()).isEqualTo(1);
        assertThat(result.getManifestsFetched()).isEqualTo(2);
        assertThat(result.getIndexedPackages()).isEqualTo(2);
    }

    @Test
    void testDiamondCounts() {
        fetcher.index("a generic 1", "b generic 1", "c generic 1", "d generic 1")
                .manifest("a", "1", ">merge pkg=b", ">merge pkg=c")
                .manifest("b", "1", ">merge pkg=d")
                .manifest("c", "1", ">merge pkg=d")
                .manifest("d", "1");

        DependencyViewResult result = generate("a");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getNodeCount()).isEqualTo(5);
        assertThat(result.getEdgeCount()).isEqualTo(4);
        assertThat(result.getManifestsFetched()).isEqualTo(4);
    }

    @Test
    void testUnknownRootFetchesOnlyTheIndex() {
        fetcher.index("afw generic 1.0");

        DependencyViewResult result = generate("nope");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureKind()).isEqualTo(FailureKind.UNKNOWN_PACKAGE);
        assertThat(result.getErrorMessage()).isEqualTo("Error: \"nope\" is not in " + BASE_URL + "/current.list.");
        assertThat(result.getGraph()).isNull();
        assertThat(fetcher.getRequested()).containsExactly(BASE_URL + "/current.list");
    }

    @Test
    void testIndexFetchFailure() {
        DependencyViewResult result = generate("afw");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureKind()).isEqualTo(FailureKind.FETCH_FAILED);
        assertThat(result.getErrorMessage()).contains("current.list");
    }

    @Test
    void testManifestFetchFailureLeavesNoGraph() {
        fetcher.index("afw generic 1.0", "foo generic 2.0")
                .manifest("afw", "1.0", ">merge pkg=foo");

        DependencyViewResult result = generate("afw");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureKind()).isEqualTo(FailureKind.FETCH_FAILED);
        assertThat(result.getTree()).isNull();
        assertThat(result.getGraph()).isNull();
    }

    @Test
    void testSkippedIndexLinesAreReported() {
        fetcher.index("EUPS distribution", "afw generic 1.0", "garbage", "# comment")
                .manifest("afw", "1.0");

        DependencyViewResult result = generate("afw");

        assertThat(result.getSkippedIndexLines()).containsExactly("garbage");
    }
}
