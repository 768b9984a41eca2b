package com.eups.dependencyview.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One position in the resolved dependency tree.
 *
 * A package reachable along several paths appears once per path; only its first occurrence
 * in depth-first order carries children.
 */
public class DependencyNode {

    private final PackageCoordinate coordinate;
    private final List<DependencyNode> children = new ArrayList<>();

    public DependencyNode(PackageCoordinate coordinate) {
        this.coordinate = Objects.requireNonNull(coordinate, "coordinate");
    }

    public PackageCoordinate getCoordinate() {
        return coordinate;
    }

    public String getName() {
        return coordinate.getName();
    }

    /**
     * Direct dependencies in manifest order.
     */
    public List<DependencyNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(DependencyNode child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    @Override
    public String toString() {
        return "DependencyNode(" + coordinate.getName() + " " + coordinate.getVersion()
                + ", children=" + children.size() + ")";
    }
}
