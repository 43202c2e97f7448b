package com.building.rig.engine;

import com.building.rig.tree.PathForest;

import java.util.List;

/**
 * Merges node-id sequences into a {@link PathForest}: one tree per distinct
 * first element, with equal prefixes stored once.
 *
 * <p>
 * Fed with target-first branches from {@link PathEnumerator}, all branches
 * share the target as their first element, so the forest holds a single tree
 * in which OR alternatives and AND inputs appear as sibling children.
 */
public final class ForestBuilder {

    public PathForest buildForest(List<List<String>> paths) {
        PathForest forest = new PathForest();
        for (List<String> path : paths) {
            if (path.isEmpty())
                continue;
            int current = forest.findRoot(path.get(0));
            if (current < 0)
                current = forest.addRoot(path.get(0));
            for (int i = 1; i < path.size(); i++) {
                String id = path.get(i);
                int child = forest.findChild(current, id);
                current = child >= 0 ? child : forest.addChild(current, id);
            }
        }
        return forest;
    }
}
