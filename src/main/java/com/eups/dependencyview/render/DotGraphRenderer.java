package com.eups.dependencyview.render;

import com.eups.dependencyview.model.DependencyNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders a dependency tree as a Graphviz DOT digraph, dependencies drawn below their dependents.
 *
 * Output order: the root's declaration, then for every node in depth-first order its children's
 * declarations followed by one edge per child. Repeated packages are declared again wherever they
 * occur; Graphviz merges declarations that share a name.
 */
public class DotGraphRenderer {

    public static final String DEFAULT_TITLE = "Created by dependency-view";

    private static final String NODE_TEMPLATE = "  \"%s\" [label = \"{<head> %s | <end>}\"\n     shape = \"record\"];\n";
    private static final String EDGE_TEMPLATE = "  \"%s\":head -> \"%s\":end [id = 0];\n";

    public String render(DependencyNode root) {
        return render(root, DEFAULT_TITLE);
    }

    public String render(DependencyNode root, String title) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(title).append("\" {\n");
        dot.append(" graph [rankdir = \"BT\"];\n");

        appendNode(dot, root);

        Deque<DependencyNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            DependencyNode node = pending.pop();
            List<DependencyNode> children = node.getChildren();

            for (DependencyNode child : children) {
                appendNode(dot, child);
                dot.append(String.format(EDGE_TEMPLATE, node.getName(), child.getName()));
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }

        dot.append("}\n");
        return dot.toString();
    }

    private static void appendNode(StringBuilder dot, DependencyNode node) {
        dot.append(String.format(NODE_TEMPLATE, node.getName(), node.getName()));
    }
}
