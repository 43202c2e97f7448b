package com.building.rig.tree;

import java.util.List;

/**
 * Element of a {@link PathStructure}: either a single node or a group of AND
 * branches that all feed the element that follows the group.
 */
public interface PathElement {

    static Step step(String nodeId) {
        return new Step(nodeId);
    }

    @SafeVarargs
    static BranchGroup group(List<PathElement>... branches) {
        return new BranchGroup(List.of(branches));
    }

    record Step(String nodeId) implements PathElement {
    }

    record BranchGroup(List<List<PathElement>> branches) implements PathElement {
        public BranchGroup {
            branches = branches.stream().map(List::copyOf).toList();
        }
    }
}
