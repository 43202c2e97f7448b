package com.building.rig.io;

import com.building.rig.api.EdgeType;
import com.building.rig.api.GraphParseException;
import com.building.rig.api.NodeType;
import com.building.rig.api.RuleEdge;
import com.building.rig.engine.GraphModel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class GraphInfoMapperTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static GraphModel sample() {
        return GraphModel.builder("sample")
                .addNode("A", "Action_Rule_1:heater.on()", NodeType.ACTION)
                .addNode("CH", "temperature [Physical]", NodeType.PHYSICAL_CHANNEL)
                .addNode("T", "Trigger", NodeType.TRIGGER)
                .addNode("G", "AND", NodeType.AND_GATE)
                .addNode("B", "Action_Rule_2", NodeType.ACTION)
                .addEdge("A", "CH")
                .addEdge("CH", "T")
                .addEdge("T", "G")
                .addEdge("G", "B")
                .build();
    }

    @Test
    public void testDocumentShape() throws Exception {
        JsonNode root = new ObjectMapper().readTree(GraphInfoMapper.toJson(sample()));

        JsonNode nodes = root.get("nodes");
        assertEquals(5, nodes.size());
        JsonNode t = nodes.get(2);
        assertEquals("T", t.get("ID").asText());
        assertEquals("Trigger", t.get("Label").asText());
        assertEquals("trigger", t.get("Type").asText());
        assertEquals("G", t.get("Target").get(0).asText());
        assertEquals("CH", t.get("Source").get(0).asText());
        assertTrue(t.has("centrality"));
        assertEquals("AND", nodes.get(3).get("Type").asText());
        assertEquals("physical_channel", nodes.get(1).get("Type").asText());

        JsonNode edges = root.get("edges");
        assertEquals(4, edges.size());
        JsonNode physical = edges.get(0);
        assertEquals("physical_implicit", physical.get("type").asText());
        assertEquals(5.0, physical.get("cost").asDouble(), 1e-9);
        JsonNode gateInput = edges.get(2);
        assertEquals("explicit", gateInput.get("type").asText());
        assertTrue(gateInput.get("cost").isNull());
        assertTrue(gateInput.get("stealth").isNull());
    }

    @Test
    public void testRoundTrip() throws Exception {
        GraphModel original = sample();
        GraphModel copy = GraphInfoMapper.fromJson(GraphInfoMapper.toJson(original), "copy");

        assertEquals("copy", copy.name());
        assertEquals(original.nodeCount(), copy.nodeCount());
        assertEquals(original.edgeCount(), copy.edgeCount());
        assertEquals(List.copyOf(original.nodes()), List.copyOf(copy.nodes()));
        assertEquals(List.copyOf(original.edges()), List.copyOf(copy.edges()));
    }

    @Test
    public void testEditedWeightsSurviveRead() {
        String json = "{\"nodes\":["
                + "{\"ID\":\"A\",\"Label\":\"A\",\"Type\":\"action\"},"
                + "{\"ID\":\"B\",\"Label\":\"B\",\"Type\":\"trigger\",\"centrality\":0.9}],"
                + "\"edges\":[{\"source\":\"A\",\"target\":\"B\",\"type\":\"system_implicit\",\"cost\":9.5,\"stealth\":null}]}";
        GraphModel g = GraphInfoMapper.fromJson(json, "edited");

        RuleEdge e = g.edge("A", "B");
        assertEquals(EdgeType.SYSTEM_IMPLICIT, e.type());
        assertEquals(9.5, e.cost(), 1e-9);
        assertNull(e.stealth());
        // Centrality is recomputed, not read
        assertEquals(0.0, g.centralityOf("B"), 1e-9);
    }

    @Test
    public void testUntypedEdgeIsClassified() {
        String json = "{\"nodes\":[{\"ID\":\"A\",\"Type\":\"action\"},"
                + "{\"ID\":\"CH\",\"Type\":\"system_channel\"}],"
                + "\"edges\":[{\"source\":\"A\",\"target\":\"CH\"}]}";
        GraphModel g = GraphInfoMapper.fromJson(json, "g");

        assertEquals(EdgeType.SYSTEM_IMPLICIT, g.edge("A", "CH").type());
        assertEquals("A", g.node("A").label());
    }

    @Test(expected = GraphParseException.class)
    public void testUnknownNodeType() {
        GraphInfoMapper.fromJson("{\"nodes\":[{\"ID\":\"A\",\"Type\":\"robot\"}]}", "g");
    }

    @Test(expected = GraphParseException.class)
    public void testMalformedJson() {
        GraphInfoMapper.fromJson("{\"nodes\": [");
    }

    @Test
    public void testWriteAndRead() throws Exception {
        Path file = tmp.getRoot().toPath().resolve("house.json");
        GraphInfoMapper.write(sample(), file);
        GraphModel g = GraphInfoMapper.read(file);

        assertEquals("house", g.name());
        assertEquals(5, g.nodeCount());
        assertEquals(NodeType.AND_GATE, g.typeOf("G"));
    }
}
