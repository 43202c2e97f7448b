package com.building.rig.tree;

import org.junit.Test;

import java.util.List;

import static com.building.rig.tree.PathElement.group;
import static com.building.rig.tree.PathElement.step;
import static org.junit.Assert.*;

public class PathStructureTest {

    @Test
    public void testLeafTree() {
        PathTree.Arena arena = PathTree.arena();
        PathStructure s = PathStructure.fromTree(arena.tree(arena.leaf("T")));
        assertEquals(PathStructure.of(step("T")), s);
        assertEquals("['T']", s.toString());
    }

    @Test
    public void testChainIsReversedToCausalOrder() {
        PathTree.Arena arena = PathTree.arena();
        int root = arena.chain("T", arena.chain("B", arena.leaf("A")));
        PathStructure s = PathStructure.fromTree(arena.tree(root));

        assertEquals(PathStructure.of(step("A"), step("B"), step("T")), s);
        assertEquals(List.of("A", "B", "T"), s.nodeIds());
    }

    @Test
    public void testAndJoinReversal() {
        // T <- G <- {Ta <- P1, Tb <- Q <- P2}
        PathTree.Arena arena = PathTree.arena();
        int a = arena.chain("Ta", arena.leaf("P1"));
        int b = arena.chain("Tb", arena.chain("Q", arena.leaf("P2")));
        int root = arena.chain("T", arena.andJoin("G", List.of(a, b)));
        PathStructure s = PathStructure.fromTree(arena.tree(root));

        PathStructure expected = PathStructure.of(
                group(List.of(step("P2"), step("Q"), step("Tb")), List.of(step("P1"), step("Ta"))),
                step("G"),
                step("T"));
        assertEquals(expected, s);
        assertEquals("[[['P2', 'Q', 'Tb'], ['P1', 'Ta']], 'G', 'T']", s.toString());
        assertEquals(List.of("P2", "Q", "Tb", "P1", "Ta", "G", "T"), s.nodeIds());
    }

    @Test
    public void testReverseNestedIsInvolution() {
        List<PathElement> seq = List.of(
                step("T"),
                step("G"),
                group(List.of(step("Ta"), step("P1")), List.of(step("Tb"), group(List.of(step("X")), List.of(step("Y"))))));

        List<PathElement> reversed = PathStructure.reverseNested(seq);
        assertEquals(step("T"), reversed.get(2));
        assertEquals(seq, PathStructure.reverseNested(reversed));
    }

    @Test
    public void testElementsAreImmutable() {
        PathStructure s = PathStructure.of(step("A"));
        try {
            s.elements().add(step("B"));
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException expected) {
            assertEquals(1, s.elements().size());
        }
    }

    @Test
    public void testLongestChainSize() {
        PathStructure s = PathStructure.of(
                group(List.of(step("P2"), step("Q"), step("Tb")), List.of(step("P1"), step("Ta"))),
                step("G"),
                step("T"));
        assertEquals(5, s.longestChainSize());
        assertEquals(1, PathStructure.of(step("T")).longestChainSize());
    }
}
