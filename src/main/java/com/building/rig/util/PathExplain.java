package com.building.rig.util;

import com.building.rig.api.RuleEdge;
import com.building.rig.api.RuleNode;
import com.building.rig.engine.GraphModel;
import com.building.rig.score.Hop;
import com.building.rig.score.PathScorer;
import com.building.rig.tree.PathStructure;
import com.building.rig.tree.PathTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Diagnostic utility for inspecting nodes, path trees and hop metrics.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging and the path-forest
 * text report. Allocates strings freely.
 */
public final class PathExplain {
    private static final String SEPARATOR = "========================================================";

    private final GraphModel graph;

    public PathExplain(GraphModel graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeId) {
        RuleNode node = graph.node(nodeId);
        if (node == null)
            return "Node: " + nodeId + " (undeclared)\n";
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Label: ").append(node.label()).append('\n')
                .append("  Type: ").append(node.type().wireName()).append('\n')
                .append("  Centrality: ").append(node.centrality()).append('\n')
                .append("  Sources (").append(node.sources().size()).append("): ")
                .append(String.join(", ", node.sources())).append('\n')
                .append("  Targets (").append(node.targets().size()).append("): ")
                .append(String.join(", ", node.targets())).append('\n');
        return sb.toString();
    }

    /**
     * Renders independent path trees, one block per tree, children drawn with
     * box connectors.
     */
    public String renderTrees(String target, List<PathTree> trees) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("### Path Trees: From each start to target ").append(target).append(" ###\n")
                .append(SEPARATOR).append("\n\n");
        for (int i = 0; i < trees.size(); i++) {
            PathTree tree = trees.get(i);
            int root = tree.root();
            sb.append("--- Path Tree ").append(i + 1).append(" ---\n")
                    .append(tree.nodeId(root)).append('\n');
            renderBranches(tree, root, sb);
            sb.append('\n').append(SEPARATOR).append("\n\n");
        }
        return sb.toString();
    }

    // Pre-order on an explicit stack.
    private static void renderBranches(PathTree tree, int root, StringBuilder sb) {
        Deque<Line> stack = new ArrayDeque<>();
        pushChildren(tree, root, "", stack);
        while (!stack.isEmpty()) {
            Line l = stack.pop();
            sb.append(l.prefix()).append(l.last() ? "└── " : "├── ").append(tree.nodeId(l.idx())).append('\n');
            pushChildren(tree, l.idx(), l.prefix() + (l.last() ? "    " : "│   "), stack);
        }
    }

    private static void pushChildren(PathTree tree, int idx, String prefix, Deque<Line> stack) {
        int n = tree.childCount(idx);
        for (int c = n - 1; c >= 0; c--)
            stack.push(new Line(tree.child(idx, c), prefix, c == n - 1));
    }

    private record Line(int idx, String prefix, boolean last) {
    }

    /**
     * Lists every hop of a path with the cost and stealth of its edge; values
     * the edge does not carry are left blank.
     */
    public String explainHops(PathStructure path) {
        StringBuilder sb = new StringBuilder(256);
        for (Hop hop : PathScorer.extractHops(path)) {
            RuleEdge e = graph.edge(hop.source(), hop.target());
            sb.append(hop).append("\tcost=").append(format(e == null ? null : e.cost()))
                    .append("\tstealth=").append(format(e == null ? null : e.stealth())).append('\n');
        }
        return sb.toString();
    }

    static String format(Double v) {
        if (v == null)
            return "";
        if (v == Math.rint(v) && !Double.isInfinite(v))
            return Long.toString(v.longValue());
        return v.toString();
    }
}
