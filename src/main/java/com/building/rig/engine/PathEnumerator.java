package com.building.rig.engine;

import com.building.rig.api.NodeType;
import com.building.rig.api.RuleEdge;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Reverse depth-first search from a target node over the predecessor relation.
 *
 * <p>
 * Branching rules:
 * <ul>
 * <li><b>OR:</b> a node with several predecessors yields one independent
 * branch per predecessor. A node with a single ordinary predecessor simply
 * continues.</li>
 * <li><b>AND:</b> a node whose sole predecessor is an AND gate takes the gate
 * into the path, then continues into each of the gate's inputs. Every input
 * branch shares the same gate-to-target suffix.</li>
 * <li><b>Cycles:</b> reaching a node already on the current branch ends the
 * branch where it stands. The cycle itself is not reported.</li>
 * </ul>
 *
 * <p>
 * The search runs on an explicit work stack, so deep graphs do not exhaust
 * the thread's call stack. Branches come out in the order a recursive search
 * visiting predecessors in edge order would produce them.
 */
@Log4j2
public final class PathEnumerator {
    private final GraphModel graph;
    private final Map<String, List<String>> predecessors;

    public PathEnumerator(GraphModel graph) {
        this.graph = graph;
        this.predecessors = buildPredecessorMap(graph.edges());
    }

    private static Map<String, List<String>> buildPredecessorMap(Collection<RuleEdge> edges) {
        Map<String, List<String>> map = new HashMap<>();
        for (RuleEdge e : edges)
            map.computeIfAbsent(e.target(), k -> new ArrayList<>(2)).add(e.source());
        return map;
    }

    /** Direct predecessors of {@code id} in edge order; empty for sources and unknown ids. */
    public List<String> predecessors(String id) {
        return Collections.unmodifiableList(predecessors.getOrDefault(id, List.of()));
    }

    /**
     * Finds every branch that reaches {@code target}, each ordered from its
     * first cause to the target.
     *
     * @return the branches, or an empty list if the target is not a declared node.
     */
    public List<List<String>> findPaths(String target) {
        return search(target, true);
    }

    /**
     * Same branches as {@link #findPaths(String)}, each ordered from the target
     * back to its first cause. This is the orientation the forest is built from.
     */
    public List<List<String>> findBackwardPaths(String target) {
        return search(target, false);
    }

    private List<List<String>> search(String target, boolean causalOrder) {
        if (!graph.contains(target)) {
            log.warn("Target node '{}' does not exist in graph {}", target, graph.name());
            return List.of();
        }
        log.info("Starting reverse path search from target node '{}'", target);

        List<List<String>> found = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(target, null));
        int truncated = 0;

        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            if (Link.contains(f.path(), f.node())) {
                // Revisit on this branch: keep what was walked, go no further
                truncated++;
                found.add(f.path().toList(causalOrder));
                continue;
            }
            Link path = new Link(f.node(), f.path());
            List<String> preds = predecessors.getOrDefault(f.node(), List.of());

            if (preds.isEmpty()) {
                found.add(path.toList(causalOrder));
            } else if (preds.size() == 1 && graph.typeOf(preds.get(0)) == NodeType.AND_GATE) {
                String gate = preds.get(0);
                Link withGate = new Link(gate, path);
                List<String> inputs = predecessors.getOrDefault(gate, List.of());
                if (inputs.isEmpty())
                    found.add(withGate.toList(causalOrder));
                else
                    pushAll(stack, inputs, withGate);
            } else {
                pushAll(stack, preds, path);
            }
        }

        if (truncated > 0)
            log.warn("{} branches to '{}' were truncated at a cycle", truncated, target);
        log.info("Search complete. Found {} raw path branches.", found.size());
        return found;
    }

    // Reverse push keeps the first predecessor on top, matching recursive visiting order.
    private static void pushAll(Deque<Frame> stack, List<String> nodes, Link path) {
        for (int i = nodes.size() - 1; i >= 0; i--)
            stack.push(new Frame(nodes.get(i), path));
    }

    private record Frame(String node, Link path) {
    }

    /**
     * Immutable branch under construction. The head is the node furthest from
     * the target; following {@code next} walks towards the target. Sibling
     * branches share their common tail.
     */
    private record Link(String node, Link next, int depth) {
        Link(String node, Link next) {
            this(node, next, next == null ? 1 : next.depth + 1);
        }

        static boolean contains(Link path, String node) {
            for (Link l = path; l != null; l = l.next)
                if (l.node.equals(node))
                    return true;
            return false;
        }

        List<String> toList(boolean causalOrder) {
            String[] ids = new String[depth];
            int i = 0;
            for (Link l = this; l != null; l = l.next)
                ids[i++] = l.node;
            List<String> list = Arrays.asList(ids);
            if (!causalOrder)
                Collections.reverse(list);
            return List.copyOf(list);
        }
    }
}
