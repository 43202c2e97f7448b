package com.building.rig.engine;

import com.building.rig.api.NodeType;

import java.util.Collection;
import java.util.Map;

import org.jgrapht.Graph;
import org.jgrapht.alg.scoring.BetweennessCentrality;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Normalized betweenness centrality over the declared graph with every AND
 * gate removed.
 *
 * <p>
 * Gates are dropped from the underlying graph, not just from the result: an
 * AND gate sits on every path through its rule and would otherwise absorb the
 * criticality of the decision points around it. Edges that touch an AND gate
 * or an undeclared node vanish with it. Scores are normalized by
 * {@code (n-1)(n-2)} for directed graphs.
 */
final class BetweennessScores {
    private BetweennessScores() {
    }

    /**
     * @param nodeTypes declared node ids and their types
     * @param edges     ordered (source, target) pairs
     * @return score per vertex of the AND-free subgraph
     */
    static Map<String, Double> compute(Map<String, NodeType> nodeTypes, Collection<String[]> edges) {
        Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (var entry : nodeTypes.entrySet()) {
            if (entry.getValue() != NodeType.AND_GATE)
                graph.addVertex(entry.getKey());
        }
        for (String[] edge : edges) {
            if (graph.containsVertex(edge[0]) && graph.containsVertex(edge[1]))
                graph.addEdge(edge[0], edge[1]);
        }
        return new BetweennessCentrality<>(graph, true).getScores();
    }
}
