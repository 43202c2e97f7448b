package com.building.rig.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Prefix-shared merge of node-id sequences.
 *
 * <p>
 * Entries live in an arena addressed by int index. Each entry holds a node id
 * and the ordered indices of its children; sequences that agree on a prefix
 * share the entries for that prefix. There is one root per distinct first
 * element, in order of first appearance.
 *
 * <p>
 * Filled by {@code ForestBuilder}; read-only afterwards by convention.
 */
public final class PathForest {
    private final List<String> nodeIds = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();
    private final List<Integer> roots = new ArrayList<>();

    /** Appends a new root entry and returns its index. */
    public int addRoot(String nodeId) {
        int idx = append(nodeId);
        roots.add(idx);
        return idx;
    }

    /** Appends a new child under {@code parent} and returns its index. */
    public int addChild(int parent, String nodeId) {
        int idx = append(nodeId);
        children.get(parent).add(idx);
        return idx;
    }

    private int append(String nodeId) {
        nodeIds.add(nodeId);
        children.add(new ArrayList<>(2));
        return nodeIds.size() - 1;
    }

    /** Index of the root with the given id, or -1. */
    public int findRoot(String nodeId) {
        for (int r : roots)
            if (nodeIds.get(r).equals(nodeId))
                return r;
        return -1;
    }

    /** Index of the child of {@code parent} with the given id, or -1. */
    public int findChild(int parent, String nodeId) {
        for (int c : children.get(parent))
            if (nodeIds.get(c).equals(nodeId))
                return c;
        return -1;
    }

    public int rootCount() {
        return roots.size();
    }

    public int root(int i) {
        return roots.get(i);
    }

    /** Total number of entries across all trees. */
    public int size() {
        return nodeIds.size();
    }

    public String nodeId(int idx) {
        return nodeIds.get(idx);
    }

    public int childCount(int idx) {
        return children.get(idx).size();
    }

    public int child(int idx, int i) {
        return children.get(idx).get(i);
    }

    /**
     * Renders the subtree at {@code idx} as {@code id(child, child, ...)}; a leaf
     * renders as its bare id. Same notation as {@link PathTree#toString()}.
     */
    public String render(int idx) {
        StringBuilder sb = new StringBuilder(64);
        Deque<Object> work = new ArrayDeque<>();
        work.push(idx);
        while (!work.isEmpty()) {
            Object next = work.pop();
            if (next instanceof String s) {
                sb.append(s);
                continue;
            }
            int i = (Integer) next;
            sb.append(nodeIds.get(i));
            List<Integer> kids = children.get(i);
            if (kids.isEmpty())
                continue;
            work.push(")");
            for (int k = kids.size() - 1; k >= 0; k--) {
                work.push(kids.get(k));
                if (k > 0)
                    work.push(", ");
            }
            work.push("(");
        }
        return sb.toString();
    }
}
