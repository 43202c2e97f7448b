package com.building.rig.api;

import java.util.List;

/**
 * A declared node of the rule interaction graph.
 *
 * @param id         Unique identifier.
 * @param label      Display label.
 * @param type       Node kind.
 * @param targets    Ids this node has an outgoing edge to, in edge order.
 * @param sources    Ids this node has an incoming edge from, in edge order.
 * @param centrality Normalized betweenness centrality; always 0 for AND gates
 *                   and channels.
 */
public record RuleNode(String id, String label, NodeType type, List<String> targets, List<String> sources,
        double centrality) {

    public RuleNode {
        targets = List.copyOf(targets);
        sources = List.copyOf(sources);
    }
}
