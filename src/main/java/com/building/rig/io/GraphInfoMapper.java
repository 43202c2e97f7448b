package com.building.rig.io;

import com.building.rig.api.EdgeType;
import com.building.rig.api.GraphParseException;
import com.building.rig.api.NodeType;
import com.building.rig.api.RuleEdge;
import com.building.rig.api.RuleNode;
import com.building.rig.engine.GraphModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts between {@link GraphModel} and the graph-info JSON document.
 *
 * <p>
 * Reading takes edge types and weights from the document as written, so hand
 * edited costs survive a round trip. Centrality in the document is ignored on
 * read and recomputed from the structure.
 */
public final class GraphInfoMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphInfoMapper() {
        // Utility class
    }

    public static GraphInfo toDocument(GraphModel graph) {
        GraphInfo doc = new GraphInfo();
        for (RuleNode n : graph.nodes()) {
            GraphInfo.NodeInfo ni = new GraphInfo.NodeInfo();
            ni.setId(n.id());
            ni.setLabel(n.label());
            ni.setType(n.type().wireName());
            ni.setTargets(n.targets());
            ni.setSources(n.sources());
            ni.setCentrality(n.centrality());
            doc.getNodes().add(ni);
        }
        for (RuleEdge e : graph.edges()) {
            GraphInfo.EdgeInfo ei = new GraphInfo.EdgeInfo();
            ei.setSource(e.source());
            ei.setTarget(e.target());
            ei.setType(e.type().wireName());
            ei.setCost(e.cost());
            ei.setStealth(e.stealth());
            doc.getEdges().add(ei);
        }
        return doc;
    }

    public static String toJson(GraphModel graph) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(graph));
    }

    public static void write(GraphModel graph, Path path) throws IOException {
        Files.writeString(path, toJson(graph));
    }

    /** Reads a document file; the graph is named after the file. */
    public static GraphModel read(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        String name = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        return fromJson(Files.readString(path), name);
    }

    public static GraphModel fromJson(String json) {
        return fromJson(json, "graph");
    }

    public static GraphModel fromJson(String json, String graphName) {
        GraphInfo doc;
        try {
            doc = MAPPER.readValue(json, GraphInfo.class);
        } catch (JsonProcessingException e) {
            throw new GraphParseException("Invalid graph-info document: " + e.getOriginalMessage(), e);
        }
        return fromDocument(doc, graphName);
    }

    public static GraphModel fromDocument(GraphInfo doc, String graphName) {
        if (doc == null)
            throw new GraphParseException("Empty graph-info document");
        GraphModel.Builder builder = GraphModel.builder(graphName);
        try {
            if (doc.getNodes() != null)
                for (GraphInfo.NodeInfo ni : doc.getNodes())
                    builder.addNode(ni.getId(), ni.getLabel(), NodeType.fromString(ni.getType()));
            if (doc.getEdges() != null)
                for (GraphInfo.EdgeInfo ei : doc.getEdges()) {
                    if (ei.getType() == null)
                        builder.addEdge(ei.getSource(), ei.getTarget());
                    else
                        builder.addEdge(new RuleEdge(ei.getSource(), ei.getTarget(),
                                EdgeType.fromString(ei.getType()), ei.getCost(), ei.getStealth()));
                }
        } catch (GraphParseException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new GraphParseException(e.getMessage(), e);
        }
        return builder.build();
    }
}
