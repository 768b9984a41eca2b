package com.eups.dependencyview.view;

import com.eups.dependencyview.model.DependencyNode;
import com.eups.dependencyview.model.FailureKind;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of one dependency view run.
 */
@Data
@Builder
public class DependencyViewResult {
    private boolean success;
    private FailureKind failureKind;
    private String errorMessage;

    private String rootPackage;
    private String indexUrl;
    private DependencyNode tree;
    private String graph;

    private int indexedPackages;
    private List<String> skippedIndexLines;
    private int manifestsFetched;
    private int nodeCount;
    private int edgeCount;

    public static DependencyViewResult failure(FailureKind kind, String errorMessage) {
        return DependencyViewResult.builder()
                .success(false)
                .failureKind(kind)
                .errorMessage(errorMessage)
                .build();
    }
}
