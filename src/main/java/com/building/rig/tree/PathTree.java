package com.building.rig.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * One independent causal chain, or AND-joined bundle of chains, ending at a
 * target node.
 *
 * <p>
 * Every entry is one of three tagged kinds:
 * <ul>
 * <li>{@link Kind#LEAF} - a node with nothing further</li>
 * <li>{@link Kind#CHAIN} - a node with exactly one continuation</li>
 * <li>{@link Kind#AND_JOIN} - an AND gate whose branches must all hold
 * together</li>
 * </ul>
 * Entries are stored in an append-only {@link Arena} and addressed by int
 * index. A tree is a view of one arena from a root index; trees produced by the
 * same split share the arena and any common subtrees. Entries never change once
 * appended, so sharing is safe.
 */
public final class PathTree {

    public enum Kind {
        LEAF, CHAIN, AND_JOIN
    }

    private final Arena arena;
    private final int root;

    PathTree(Arena arena, int root) {
        this.arena = arena;
        this.root = root;
    }

    public int root() {
        return root;
    }

    public Kind kind(int idx) {
        return arena.kinds.get(idx);
    }

    public String nodeId(int idx) {
        return arena.nodeIds.get(idx);
    }

    /** Number of continuations: 0 for a leaf, 1 for a chain, the branch count for an AND join. */
    public int childCount(int idx) {
        return arena.children.get(idx).length;
    }

    public int child(int idx, int i) {
        return arena.children.get(idx)[i];
    }

    /** The single continuation of a {@link Kind#CHAIN} entry. */
    public int next(int idx) {
        if (kind(idx) != Kind.CHAIN)
            throw new IllegalStateException(nodeId(idx) + " is " + kind(idx) + ", not CHAIN");
        return child(idx, 0);
    }

    /** Number of entries reachable from the root, the root included. */
    public int nodeCount() {
        int count = 0;
        int[] stack = new int[16];
        int top = 0;
        stack[top++] = root;
        while (top > 0) {
            int idx = stack[--top];
            count++;
            for (int c : arena.children.get(idx)) {
                if (top == stack.length)
                    stack = Arrays.copyOf(stack, top * 2);
                stack[top++] = c;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PathTree other))
            return false;
        return sameShape(this, root, other, other.root);
    }

    private static boolean sameShape(PathTree a, int ia, PathTree b, int ib) {
        Deque<int[]> pairs = new ArrayDeque<>();
        pairs.push(new int[] { ia, ib });
        while (!pairs.isEmpty()) {
            int[] p = pairs.pop();
            if (a.kind(p[0]) != b.kind(p[1]) || !a.nodeId(p[0]).equals(b.nodeId(p[1])))
                return false;
            int n = a.childCount(p[0]);
            if (n != b.childCount(p[1]))
                return false;
            for (int i = 0; i < n; i++)
                pairs.push(new int[] { a.child(p[0], i), b.child(p[1], i) });
        }
        return true;
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /**
     * Renders the tree as {@code id(child, child, ...)}; leaves render as their
     * bare id.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64);
        // Pending output: Integer entries still to render, String punctuation
        Deque<Object> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            Object next = work.pop();
            if (next instanceof String s) {
                sb.append(s);
                continue;
            }
            int idx = (Integer) next;
            sb.append(nodeId(idx));
            int n = childCount(idx);
            if (n == 0)
                continue;
            work.push(")");
            for (int i = n - 1; i >= 0; i--) {
                work.push(child(idx, i));
                if (i > 0)
                    work.push(", ");
            }
            work.push("(");
        }
        return sb.toString();
    }

    public static Arena arena() {
        return new Arena();
    }

    /** Append-only storage for path-tree entries. */
    public static final class Arena {
        private final List<Kind> kinds = new ArrayList<>();
        private final List<String> nodeIds = new ArrayList<>();
        private final List<int[]> children = new ArrayList<>();

        private Arena() {
        }

        public int leaf(String nodeId) {
            return append(Kind.LEAF, nodeId, new int[0]);
        }

        public int chain(String nodeId, int next) {
            return append(Kind.CHAIN, nodeId, new int[] { checked(next) });
        }

        public int andJoin(String nodeId, List<Integer> branches) {
            int[] b = new int[branches.size()];
            for (int i = 0; i < b.length; i++)
                b[i] = checked(branches.get(i));
            return append(Kind.AND_JOIN, nodeId, b);
        }

        public PathTree tree(int root) {
            return new PathTree(this, checked(root));
        }

        public int size() {
            return kinds.size();
        }

        private int checked(int idx) {
            if (idx < 0 || idx >= kinds.size())
                throw new IndexOutOfBoundsException("No arena entry " + idx);
            return idx;
        }

        private int append(Kind kind, String nodeId, int[] next) {
            kinds.add(kind);
            nodeIds.add(nodeId);
            children.add(next);
            return kinds.size() - 1;
        }
    }
}
