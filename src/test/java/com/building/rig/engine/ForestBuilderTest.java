package com.building.rig.engine;

import com.building.rig.tree.PathForest;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ForestBuilderTest {

    private final ForestBuilder builder = new ForestBuilder();

    @Test
    public void testEmptyInput() {
        PathForest f = builder.buildForest(List.of());
        assertEquals(0, f.rootCount());
        assertEquals(0, f.size());
    }

    @Test
    public void testSharedPrefix() {
        PathForest f = builder.buildForest(List.of(
                List.of("T", "B", "C"),
                List.of("T", "B", "D"),
                List.of("T", "E")));

        assertEquals(1, f.rootCount());
        assertEquals("T(B(C, D), E)", f.render(f.root(0)));
        assertEquals(5, f.size());
    }

    @Test
    public void testOneRootPerFirstElement() {
        PathForest f = builder.buildForest(List.of(
                List.of("A", "B"),
                List.of("X", "Y"),
                List.of("A", "C")));

        assertEquals(2, f.rootCount());
        assertEquals("A(B, C)", f.render(f.root(0)));
        assertEquals("X(Y)", f.render(f.root(1)));
        assertEquals(f.root(1), f.findRoot("X"));
        assertEquals(-1, f.findRoot("B"));
    }

    @Test
    public void testIdenticalPathsMerge() {
        PathForest f = builder.buildForest(List.of(List.of("A", "B"), List.of("A", "B")));
        assertEquals(2, f.size());
        assertEquals("A(B)", f.render(f.root(0)));
    }

    @Test
    public void testEmptyPathSkipped() {
        PathForest f = builder.buildForest(List.of(List.of(), List.of("A")));
        assertEquals(1, f.rootCount());
        assertEquals("A", f.render(f.root(0)));
    }

    @Test
    public void testChildrenInFirstAppearanceOrder() {
        PathForest f = builder.buildForest(List.of(
                List.of("T", "Z"),
                List.of("T", "A"),
                List.of("T", "Z", "Q")));

        int root = f.root(0);
        assertEquals(2, f.childCount(root));
        assertEquals("Z", f.nodeId(f.child(root, 0)));
        assertEquals("A", f.nodeId(f.child(root, 1)));
        assertEquals(f.child(root, 0), f.findChild(root, "Z"));
        assertEquals("T(Z(Q), A)", f.render(root));
    }
}
