package com.building.rig.score;

import com.building.rig.api.EdgeType;
import com.building.rig.api.NodeType;
import com.building.rig.api.RuleEdge;
import com.building.rig.engine.GraphModel;
import com.building.rig.tree.PathStructure;
import org.junit.Test;

import java.util.List;

import static com.building.rig.tree.PathElement.group;
import static com.building.rig.tree.PathElement.step;
import static org.junit.Assert.*;

public class PathScorerTest {

    private static final double EPS = 1e-9;

    private static GraphModel linearGraph() {
        return GraphModel.builder()
                .addNode("A", "A", NodeType.ACTION)
                .addNode("B", "B", NodeType.TRIGGER)
                .addNode("T", "T", NodeType.ACTION)
                .addEdge(new RuleEdge("A", "B", EdgeType.PHYSICAL_IMPLICIT, 5.0, 3.0))
                .addEdge(new RuleEdge("B", "T", EdgeType.SYSTEM_IMPLICIT, 3.0, 2.0))
                .build();
    }

    /** T <- G(AND) <- {Ta <- P1, Tb <- Q <- P2}, weights from the rule table. */
    private static GraphModel andGraph() {
        return GraphModel.builder()
                .addNode("P1", "P1", NodeType.ACTION)
                .addNode("P2", "P2", NodeType.ACTION)
                .addNode("Q", "Q", NodeType.ACTION)
                .addNode("Ta", "Ta", NodeType.TRIGGER)
                .addNode("Tb", "Tb", NodeType.TRIGGER)
                .addNode("G", "AND", NodeType.AND_GATE)
                .addNode("T", "T", NodeType.ACTION)
                .addEdge("P1", "Ta")
                .addEdge("P2", "Q")
                .addEdge("Q", "Tb")
                .addEdge("Ta", "G")
                .addEdge("Tb", "G")
                .addEdge("G", "T")
                .build();
    }

    private static PathStructure andPath() {
        return PathStructure.of(
                group(List.of(step("P2"), step("Q"), step("Tb")), List.of(step("P1"), step("Ta"))),
                step("G"),
                step("T"));
    }

    @Test
    public void testLinearPath() {
        PathStructure path = PathStructure.of(step("A"), step("B"), step("T"));
        assertEquals(List.of(new Hop("A", "B"), new Hop("B", "T")), PathScorer.extractHops(path));

        PathScore score = new PathScorer(linearGraph()).analyze(path);
        assertEquals("['A', 'B', 'T']", score.path());
        assertEquals(8.0, score.totalCost(), EPS);
        assertEquals(2.5, score.averageStealth(), EPS);
        assertEquals(2, score.length());
        // B sits between A and T: 1 / ((3 - 1) * (3 - 2))
        assertEquals(0.5, score.criticality(), EPS);
    }

    @Test
    public void testAndPathHops() {
        List<Hop> hops = PathScorer.extractHops(andPath());
        assertEquals(List.of(
                new Hop("P2", "Q"),
                new Hop("Q", "Tb"),
                new Hop("P1", "Ta"),
                new Hop("Tb", "G"),
                new Hop("Ta", "G"),
                new Hop("G", "T")), hops);
    }

    @Test
    public void testAndPathScore() {
        PathScore score = new PathScorer(andGraph()).analyze(andPath());

        // Three branch hops plus the gate output; gate inputs carry no weight
        assertEquals(4.0, score.totalCost(), EPS);
        assertEquals(1.0, score.averageStealth(), EPS);
        // Longest branch 3 + G + T - one gate - 1
        assertEquals(3, score.length());
    }

    @Test
    public void testBranchOrderDoesNotChangeMetrics() {
        PathStructure swapped = PathStructure.of(
                group(List.of(step("P1"), step("Ta")), List.of(step("P2"), step("Q"), step("Tb"))),
                step("G"),
                step("T"));
        PathScorer scorer = new PathScorer(andGraph());
        PathScore a = scorer.analyze(andPath());
        PathScore b = scorer.analyze(swapped);

        assertEquals(a.totalCost(), b.totalCost(), EPS);
        assertEquals(a.averageStealth(), b.averageStealth(), EPS);
        assertEquals(a.length(), b.length());
        assertEquals(a.criticality(), b.criticality(), EPS);
    }

    @Test
    public void testNestedGroupHops() {
        PathStructure path = PathStructure.of(
                step("S"),
                group(List.of(step("A"), group(List.of(step("X")), List.of(step("Y")))), List.of(step("B"))),
                step("T"));

        assertEquals(List.of(
                new Hop("S", "A"),
                new Hop("S", "B"),
                new Hop("A", "X"),
                new Hop("A", "Y"),
                new Hop("X", "T"),
                new Hop("Y", "T"),
                new Hop("B", "T")), PathScorer.extractHops(path));
    }

    @Test
    public void testMissingWeightsAreSkipped() {
        GraphModel g = GraphModel.builder()
                .addNode("A", "A", NodeType.TRIGGER)
                .addNode("G", "AND", NodeType.AND_GATE)
                .addEdge("A", "G")
                .build();
        PathScore score = new PathScorer(g).analyze(PathStructure.of(step("A"), step("G")));

        assertEquals(0.0, score.totalCost(), EPS);
        assertNull(score.averageStealth());
        assertEquals(0, score.length());
    }

    @Test
    public void testStealthRoundedToThreeDecimals() {
        GraphModel g = GraphModel.builder()
                .addNode("A", "A", NodeType.ACTION)
                .addNode("B", "B", NodeType.TRIGGER)
                .addNode("C", "C", NodeType.ACTION)
                .addNode("D", "D", NodeType.TRIGGER)
                .addEdge(new RuleEdge("A", "B", EdgeType.EXPLICIT, 1.0, 1.0))
                .addEdge(new RuleEdge("B", "C", EdgeType.EXPLICIT, 1.0, 1.0))
                .addEdge(new RuleEdge("C", "D", EdgeType.EXPLICIT, 1.0, 2.0))
                .build();
        PathScore score = new PathScorer(g).analyze(PathStructure.of(step("A"), step("B"), step("C"), step("D")));

        assertEquals(1.333, score.averageStealth(), EPS);
        assertEquals(3.0, score.totalCost(), EPS);
    }

    @Test
    public void testUndeclaredNodesHaveNoCriticality() {
        GraphModel g = GraphModel.builder().build();
        PathScore score = new PathScorer(g).analyze(PathStructure.of(step("X"), step("Y")));

        assertNull(score.criticality());
        assertEquals(0.0, score.totalCost(), EPS);
        assertEquals(1, score.length());
    }

    @Test
    public void testAnalyzeAllKeepsOrder() {
        PathScorer scorer = new PathScorer(linearGraph());
        List<PathScore> scores = scorer.analyzeAll(List.of(
                PathStructure.of(step("B"), step("T")),
                PathStructure.of(step("A"), step("B"))));

        assertEquals(2, scores.size());
        assertEquals(3.0, scores.get(0).totalCost(), EPS);
        assertEquals(5.0, scores.get(1).totalCost(), EPS);
    }
}
