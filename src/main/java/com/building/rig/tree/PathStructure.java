package com.building.rig.tree;

import com.building.rig.tree.PathElement.BranchGroup;
import com.building.rig.tree.PathElement.Step;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Ordered, nested form of a {@link PathTree}, the input to path scoring.
 *
 * <p>
 * Conversion works on the target-rooted tree: a leaf becomes {@code [id]}, a
 * chain {@code [id] + rest}, an AND join {@code [id, [branch, branch, ...]]}.
 * The result is then reversed element-wise at every level, branch groups
 * included. Since the tree is rooted at the target, the reversal puts the
 * elements in causal order: {@code [[['P2', 'Q'], ['P1']], 'G', 'T']} reads
 * "P2 then Q, together with P1, feed G, which reaches T". Scoring looks edges
 * up by literal adjacency in this order.
 *
 * <p>
 * Every walk over the nesting runs on an explicit stack; neither chain length
 * nor AND nesting depth is bounded by the thread's call stack.
 */
public final class PathStructure {
    private final List<PathElement> elements;

    public PathStructure(List<PathElement> elements) {
        this.elements = List.copyOf(elements);
    }

    public static PathStructure of(PathElement... elements) {
        return new PathStructure(List.of(elements));
    }

    /** Converts a target-rooted tree and applies the nested reversal. */
    public static PathStructure fromTree(PathTree tree) {
        return new PathStructure(reverseNested(convert(tree)));
    }

    /**
     * A run of chain entries becomes one flat sequence; only AND joins open a
     * nested level, so the branch runs below a join are converted first.
     */
    private static List<PathElement> convert(PathTree tree) {
        Map<Integer, List<PathElement>> converted = new HashMap<>();
        Deque<Run> stack = new ArrayDeque<>();
        stack.push(new Run(tree.root(), false));
        while (!stack.isEmpty()) {
            Run r = stack.pop();
            int end = runEnd(tree, r.start());
            if (!r.expanded() && tree.kind(end) == PathTree.Kind.AND_JOIN) {
                stack.push(new Run(r.start(), true));
                for (int i = tree.childCount(end) - 1; i >= 0; i--)
                    stack.push(new Run(tree.child(end, i), false));
                continue;
            }
            List<PathElement> out = new ArrayList<>();
            for (int idx = r.start(); ; idx = tree.next(idx)) {
                out.add(new Step(tree.nodeId(idx)));
                if (idx == end)
                    break;
            }
            if (tree.kind(end) == PathTree.Kind.AND_JOIN) {
                List<List<PathElement>> branches = new ArrayList<>(tree.childCount(end));
                for (int i = 0; i < tree.childCount(end); i++)
                    branches.add(converted.get(tree.child(end, i)));
                out.add(new BranchGroup(branches));
            }
            converted.put(r.start(), out);
        }
        return converted.get(tree.root());
    }

    private static int runEnd(PathTree tree, int start) {
        int idx = start;
        while (tree.kind(idx) == PathTree.Kind.CHAIN)
            idx = tree.next(idx);
        return idx;
    }

    private record Run(int start, boolean expanded) {
    }

    /** Reverses a sequence and every branch group nested in it, at any depth. */
    public static List<PathElement> reverseNested(List<PathElement> sequence) {
        Map<List<PathElement>, List<PathElement>> reversed = new IdentityHashMap<>();
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(sequence, false));
        while (!stack.isEmpty()) {
            Pending p = stack.pop();
            if (!p.expanded()) {
                stack.push(new Pending(p.sequence(), true));
                for (PathElement e : p.sequence())
                    if (e instanceof BranchGroup g)
                        for (List<PathElement> branch : g.branches())
                            stack.push(new Pending(branch, false));
                continue;
            }
            List<PathElement> seq = p.sequence();
            List<PathElement> out = new ArrayList<>(seq.size());
            for (int i = seq.size() - 1; i >= 0; i--) {
                PathElement e = seq.get(i);
                if (e instanceof BranchGroup g) {
                    List<List<PathElement>> branches = new ArrayList<>(g.branches().size());
                    for (int b = g.branches().size() - 1; b >= 0; b--)
                        branches.add(reversed.get(g.branches().get(b)));
                    out.add(new BranchGroup(branches));
                } else {
                    out.add(e);
                }
            }
            reversed.put(seq, out);
        }
        return reversed.get(sequence);
    }

    private record Pending(List<PathElement> sequence, boolean expanded) {
    }

    public List<PathElement> elements() {
        return elements;
    }

    /** Every node id in the structure, in reading order, repeats included. */
    public List<String> nodeIds() {
        List<String> ids = new ArrayList<>();
        Deque<Iterator<PathElement>> stack = new ArrayDeque<>();
        stack.push(elements.iterator());
        while (!stack.isEmpty()) {
            Iterator<PathElement> it = stack.peek();
            if (!it.hasNext()) {
                stack.pop();
                continue;
            }
            PathElement e = it.next();
            if (e instanceof Step s) {
                ids.add(s.nodeId());
            } else if (e instanceof BranchGroup g) {
                for (int b = g.branches().size() - 1; b >= 0; b--)
                    stack.push(g.branches().get(b).iterator());
            }
        }
        return Collections.unmodifiableList(ids);
    }

    /**
     * Number of nodes read along the structure, where a branch group counts as
     * its longest branch.
     */
    public int longestChainSize() {
        Map<List<PathElement>, Integer> sizes = new IdentityHashMap<>();
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(elements, false));
        while (!stack.isEmpty()) {
            Pending p = stack.pop();
            if (!p.expanded()) {
                stack.push(new Pending(p.sequence(), true));
                for (PathElement e : p.sequence())
                    if (e instanceof BranchGroup g)
                        for (List<PathElement> branch : g.branches())
                            stack.push(new Pending(branch, false));
                continue;
            }
            int total = 0;
            for (PathElement e : p.sequence()) {
                if (e instanceof BranchGroup g) {
                    int longest = 0;
                    for (List<PathElement> branch : g.branches())
                        longest = Math.max(longest, sizes.get(branch));
                    total += longest;
                } else {
                    total++;
                }
            }
            sizes.put(p.sequence(), total);
        }
        return sizes.get(elements);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PathStructure other && elements.equals(other.elements));
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    /** Renders in list notation, e.g. {@code [[['A', 'B'], ['C']], 'D']}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64);
        // Pending output: sequences and elements still to render, String punctuation
        Deque<Object> work = new ArrayDeque<>();
        work.push(elements);
        while (!work.isEmpty()) {
            Object next = work.pop();
            if (next instanceof String text) {
                sb.append(text);
            } else if (next instanceof Step step) {
                sb.append('\'').append(step.nodeId()).append('\'');
            } else if (next instanceof BranchGroup g) {
                pushBracketed(work, g.branches());
            } else if (next instanceof List<?> seq) {
                pushBracketed(work, seq);
            }
        }
        return sb.toString();
    }

    private static void pushBracketed(Deque<Object> work, List<?> items) {
        work.push("]");
        for (int i = items.size() - 1; i >= 0; i--) {
            work.push(items.get(i));
            if (i > 0)
                work.push(", ");
        }
        work.push("[");
    }
}
