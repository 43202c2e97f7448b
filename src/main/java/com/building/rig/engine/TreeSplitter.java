package com.building.rig.engine;

import com.building.rig.api.NodeType;
import com.building.rig.tree.PathForest;
import com.building.rig.tree.PathTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decomposes merged trees into independent {@link PathTree}s.
 *
 * <p>
 * An ordinary node with several children is an OR point: each alternative
 * below it becomes its own tree, still rooted at that node. An AND gate keeps
 * every split result of every child as one branch list, since all of them have
 * to hold together. A tree without OR points comes back as exactly one tree of
 * the same shape.
 *
 * <p>
 * Entries are visited children-first on an explicit stack, so the depth of a
 * tree is not limited by the thread's call stack.
 */
public final class TreeSplitter {
    private static final Logger log = LogManager.getLogger(TreeSplitter.class);

    private final GraphModel graph;

    public TreeSplitter(GraphModel graph) {
        this.graph = graph;
    }

    /** Splits every tree of the forest; results share one arena. */
    public List<PathTree> splitAll(PathForest forest) {
        PathTree.Arena arena = PathTree.arena();
        List<PathTree> trees = new ArrayList<>();
        for (int r = 0; r < forest.rootCount(); r++)
            for (int root : split(forest, forest.root(r), arena))
                trees.add(arena.tree(root));
        log.info("Structure split into {} independent path trees", trees.size());
        return trees;
    }

    /** Splits the forest tree rooted at {@code rootIdx}. */
    public List<PathTree> split(PathForest forest, int rootIdx) {
        PathTree.Arena arena = PathTree.arena();
        List<PathTree> trees = new ArrayList<>();
        for (int root : split(forest, rootIdx, arena))
            trees.add(arena.tree(root));
        return trees;
    }

    private List<Integer> split(PathForest forest, int rootIdx, PathTree.Arena arena) {
        Map<Integer, List<Integer>> finished = new HashMap<>();
        Deque<Visit> stack = new ArrayDeque<>();
        stack.push(new Visit(rootIdx, false));
        while (!stack.isEmpty()) {
            Visit v = stack.pop();
            int n = forest.childCount(v.idx());
            if (!v.expanded() && n > 0) {
                stack.push(new Visit(v.idx(), true));
                for (int i = n - 1; i >= 0; i--)
                    stack.push(new Visit(forest.child(v.idx(), i), false));
                continue;
            }
            finished.put(v.idx(), splitEntry(forest, v.idx(), finished, arena));
        }
        return finished.get(rootIdx);
    }

    // All children of idx are already in finished.
    private List<Integer> splitEntry(PathForest forest, int idx, Map<Integer, List<Integer>> finished,
            PathTree.Arena arena) {
        String id = forest.nodeId(idx);
        int n = forest.childCount(idx);
        if (n == 0)
            return List.of(arena.leaf(id));

        List<Integer> parts = new ArrayList<>();
        for (int i = 0; i < n; i++)
            parts.addAll(finished.remove(forest.child(idx, i)));

        if (graph.typeOf(id) == NodeType.AND_GATE)
            return List.of(arena.andJoin(id, parts));

        List<Integer> alternatives = new ArrayList<>(parts.size());
        for (int part : parts)
            alternatives.add(arena.chain(id, part));
        return alternatives;
    }

    private record Visit(int idx, boolean expanded) {
    }
}
