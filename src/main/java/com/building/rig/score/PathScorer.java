package com.building.rig.score;

import com.building.rig.api.NodeType;
import com.building.rig.api.RuleEdge;
import com.building.rig.engine.GraphModel;
import com.building.rig.tree.PathElement;
import com.building.rig.tree.PathElement.BranchGroup;
import com.building.rig.tree.PathElement.Step;
import com.building.rig.tree.PathStructure;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Computes cost, stealth, length and criticality of path structures against
 * the edge and node tables of a {@link GraphModel}.
 *
 * <p>
 * Cost and stealth are aggregated over the flat hop list, so every AND
 * branch contributes its own hops next to the shared spine. Hops without an
 * edge record, and edges without the attribute, are left out of the
 * aggregate rather than counted as zero.
 *
 * <p>
 * Stealth is the mean over all such hops of the structure, not the minimum
 * over per-branch means. A node never forms a hop with itself.
 */
public final class PathScorer {
    private static final int STEALTH_SCALE = 3;

    private final GraphModel graph;

    public PathScorer(GraphModel graph) {
        this.graph = graph;
    }

    public PathScore analyze(PathStructure path) {
        List<Hop> hops = extractHops(path);
        return new PathScore(path.toString(), cost(hops), stealth(hops), length(path), criticality(path));
    }

    public List<PathScore> analyzeAll(List<PathStructure> paths) {
        List<PathScore> scores = new ArrayList<>(paths.size());
        for (PathStructure p : paths)
            scores.add(analyze(p));
        return scores;
    }

    /**
     * Flattens a structure into adjacent pairs. The element before a branch
     * group connects to the first node of every branch; the last node of every
     * branch connects to the element after the group. Nested groups follow the
     * same rule. All fan-out hops of a group come before the hops inside its
     * branches.
     */
    public static List<Hop> extractHops(PathStructure path) {
        List<Hop> hops = new ArrayList<>();
        Deque<Cursor> stack = new ArrayDeque<>();
        stack.push(new Cursor(path.elements(), List.of()));
        List<String> returned = null;
        while (!stack.isEmpty()) {
            Cursor c = stack.peek();
            if (c.group != null) {
                if (returned != null) {
                    c.ends.addAll(returned);
                    returned = null;
                }
                if (c.branch < c.group.branches().size()) {
                    stack.push(new Cursor(c.group.branches().get(c.branch++), List.of()));
                } else {
                    c.prev = c.ends;
                    c.group = null;
                    c.ends = null;
                    c.pos++;
                }
                continue;
            }
            if (c.pos == c.sequence.size()) {
                stack.pop();
                returned = c.prev;
                continue;
            }
            PathElement e = c.sequence.get(c.pos);
            if (e instanceof Step s) {
                link(c.prev, s.nodeId(), hops);
                c.prev = List.of(s.nodeId());
                c.pos++;
            } else if (e instanceof BranchGroup g) {
                for (List<PathElement> branch : g.branches())
                    for (String first : firstNodes(branch))
                        link(c.prev, first, hops);
                c.group = g;
                c.branch = 0;
                c.ends = new ArrayList<>();
            }
        }
        return hops;
    }

    private static void link(List<String> from, String to, List<Hop> hops) {
        for (String p : from)
            if (!p.equals(to))
                hops.add(new Hop(p, to));
    }

    private static List<String> firstNodes(List<PathElement> sequence) {
        List<String> firsts = new ArrayList<>();
        Deque<List<PathElement>> stack = new ArrayDeque<>();
        stack.push(sequence);
        while (!stack.isEmpty()) {
            List<PathElement> seq = stack.pop();
            if (seq.isEmpty())
                continue;
            if (seq.get(0) instanceof Step s) {
                firsts.add(s.nodeId());
            } else {
                List<List<PathElement>> branches = ((BranchGroup) seq.get(0)).branches();
                for (int b = branches.size() - 1; b >= 0; b--)
                    stack.push(branches.get(b));
            }
        }
        return firsts;
    }

    /**
     * Walk state over one sequence. While {@code group} is set, the cursor is
     * waiting on the branches of the group at {@code pos}.
     */
    private static final class Cursor {
        final List<PathElement> sequence;
        int pos;
        List<String> prev;
        BranchGroup group;
        int branch;
        List<String> ends;

        Cursor(List<PathElement> sequence, List<String> prev) {
            this.sequence = sequence;
            this.prev = prev;
        }
    }

    double cost(List<Hop> hops) {
        double total = 0;
        for (Hop h : hops) {
            RuleEdge e = graph.edge(h.source(), h.target());
            if (e != null && e.hasCost())
                total += e.cost();
        }
        return total;
    }

    Double stealth(List<Hop> hops) {
        double sum = 0;
        int n = 0;
        for (Hop h : hops) {
            RuleEdge e = graph.edge(h.source(), h.target());
            if (e != null && e.hasStealth()) {
                sum += e.stealth();
                n++;
            }
        }
        if (n == 0)
            return null;
        return BigDecimal.valueOf(sum / n).setScale(STEALTH_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Node count, where a branch group counts as its longest branch, minus the
     * gate nodes anywhere in the structure, minus one to turn nodes into hops.
     */
    int length(PathStructure path) {
        int gates = 0;
        for (String id : path.nodeIds()) {
            NodeType t = graph.typeOf(id);
            if (t != null && t.isGate())
                gates++;
        }
        return path.longestChainSize() - gates - 1;
    }

    Double criticality(PathStructure path) {
        Double max = null;
        for (String id : path.nodeIds()) {
            Double c = graph.centralityOf(id);
            if (c != null && (max == null || c > max))
                max = c;
        }
        return max;
    }
}
