package com.building.rig.engine;

import com.building.rig.api.GraphParseException;
import com.building.rig.api.NodeType;
import com.building.rig.api.RuleEdge;
import com.building.rig.api.RuleNode;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Typed, immutable store of the nodes and edges of a rule interaction graph.
 *
 * <p>
 * Built once through {@link Builder} from node and edge declarations. At build
 * time every edge is typed and weighted by {@link EdgeRules}, the per-node
 * neighbour lists are derived, and betweenness centrality is computed for
 * triggers, actions and OR gates.
 *
 * <p>
 * Edges may reference ids that were never declared. Such ids have no
 * {@link RuleNode}, take no part in centrality, and are typed as unknown by
 * the edge rules, but the edges themselves are kept so path search can walk
 * through them.
 *
 * <p>
 * Thread Safety: immutable after {@link Builder#build()}; safe to share.
 */
public final class GraphModel {
    private static final Logger log = LogManager.getLogger(GraphModel.class);

    private final String name;
    private final Map<String, RuleNode> nodes;
    private final Map<EdgeKey, RuleEdge> edges;

    private GraphModel(String name, Map<String, RuleNode> nodes, Map<EdgeKey, RuleEdge> edges) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableMap(edges);
    }

    public String name() {
        return name;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /** Declared nodes in declaration order. */
    public Collection<RuleNode> nodes() {
        return nodes.values();
    }

    /** Edges in first-declaration order. */
    public Collection<RuleEdge> edges() {
        return edges.values();
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @return the declared node, or null if the id was never declared.
     */
    public RuleNode node(String id) {
        return nodes.get(id);
    }

    /**
     * @return the node type, or null for undeclared ids.
     */
    public NodeType typeOf(String id) {
        RuleNode n = nodes.get(id);
        return n == null ? null : n.type();
    }

    /**
     * @return the centrality of a declared node, or null for undeclared ids.
     */
    public Double centralityOf(String id) {
        RuleNode n = nodes.get(id);
        return n == null ? null : n.centrality();
    }

    /**
     * @return the edge for the ordered pair, or null if there is none.
     */
    public RuleEdge edge(String source, String target) {
        return edges.get(new EdgeKey(source, target));
    }

    public static Builder builder() {
        return builder("graph");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private record EdgeKey(String source, String target) {
    }

    private record NodeDecl(String id, String label, NodeType type) {
    }

    /**
     * Collects declarations and compiles them into a {@link GraphModel}.
     * Repeated edges between the same ordered pair collapse into the first one.
     */
    public static final class Builder {
        private final String name;
        private final Map<String, NodeDecl> nodeDecls = new LinkedHashMap<>();
        // Value is null for edges to be classified by EdgeRules at build time.
        private final Map<EdgeKey, RuleEdge> edgeDecls = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder addNode(String id, String label, NodeType type) {
            if (id == null || id.isEmpty())
                throw new GraphParseException("Node declaration without id");
            if (type == null)
                throw new GraphParseException("Node " + id + " declared without type");
            if (nodeDecls.containsKey(id))
                throw new GraphParseException("Duplicate node: " + id);
            nodeDecls.put(id, new NodeDecl(id, label == null ? id : label, type));
            return this;
        }

        /** Adds an edge whose type and weights are derived from its endpoints. */
        public Builder addEdge(String source, String target) {
            EdgeKey key = edgeKey(source, target);
            if (!edgeDecls.containsKey(key))
                edgeDecls.put(key, null);
            return this;
        }

        /** Adds an edge with explicit type and weights, as read back from a document. */
        public Builder addEdge(RuleEdge edge) {
            if (edge.type() == null)
                throw new GraphParseException("Edge " + edge.source() + " -> " + edge.target() + " without type");
            edgeDecls.putIfAbsent(edgeKey(edge.source(), edge.target()), edge);
            return this;
        }

        private static EdgeKey edgeKey(String source, String target) {
            if (source == null || source.isEmpty() || target == null || target.isEmpty())
                throw new GraphParseException("Edge declaration without endpoint: " + source + " -> " + target);
            return new EdgeKey(source, target);
        }

        public GraphModel build() {
            Map<String, NodeType> types = new LinkedHashMap<>(nodeDecls.size() * 2);
            Map<String, Set<String>> targets = new HashMap<>(nodeDecls.size() * 2);
            Map<String, Set<String>> sources = new HashMap<>(nodeDecls.size() * 2);
            for (NodeDecl d : nodeDecls.values()) {
                types.put(d.id(), d.type());
                targets.put(d.id(), new LinkedHashSet<>());
                sources.put(d.id(), new LinkedHashSet<>());
            }

            // 1. Type and weight edges, derive neighbour lists
            Map<EdgeKey, RuleEdge> edges = new LinkedHashMap<>(edgeDecls.size() * 2);
            List<String[]> pairs = new ArrayList<>(edgeDecls.size());
            int undeclared = 0;
            for (var entry : edgeDecls.entrySet()) {
                EdgeKey k = entry.getKey();
                RuleEdge e = entry.getValue() != null ? entry.getValue()
                        : EdgeRules.classify(k.source(), k.target(), types.get(k.source()), types.get(k.target()));
                edges.put(k, e);
                pairs.add(new String[] { k.source(), k.target() });
                if (targets.containsKey(k.source()))
                    targets.get(k.source()).add(k.target());
                else
                    undeclared++;
                if (sources.containsKey(k.target()))
                    sources.get(k.target()).add(k.source());
                else
                    undeclared++;
            }
            if (undeclared > 0)
                log.debug("Graph {}: {} edge endpoints reference undeclared nodes", name, undeclared);

            // 2. Centrality over the AND-free subgraph
            Map<String, Double> scores = BetweennessScores.compute(types, pairs);

            // 3. Freeze nodes
            Map<String, RuleNode> nodes = new LinkedHashMap<>(nodeDecls.size() * 2);
            for (NodeDecl d : nodeDecls.values()) {
                double c = d.type().carriesCentrality() ? scores.getOrDefault(d.id(), 0.0) : 0.0;
                nodes.put(d.id(), new RuleNode(d.id(), d.label(), d.type(),
                        new ArrayList<>(targets.get(d.id())), new ArrayList<>(sources.get(d.id())), c));
            }
            return new GraphModel(name, nodes, edges);
        }
    }
}
