package com.building.rig.engine;

import com.building.rig.api.EdgeType;
import com.building.rig.api.NodeType;
import com.building.rig.api.RuleEdge;

/**
 * Rule table assigning type, cost and stealth to an edge from the types of
 * its endpoints.
 *
 * <p>
 * Rules, first match wins:
 * <ol>
 * <li>source is an AND gate: explicit, default explicit weights</li>
 * <li>target is an AND gate: explicit, no cost, no stealth</li>
 * <li>either endpoint is a physical channel: physical implicit</li>
 * <li>either endpoint is a system channel: system implicit</li>
 * <li>otherwise explicit</li>
 * </ol>
 * Rule 2 leaves gate inputs unweighted while rule 1 weights gate outputs; the
 * asymmetry is part of the scoring contract and existing reports depend on it.
 * Undeclared endpoints have a {@code null} type and match no typed rule.
 */
public final class EdgeRules {
    private EdgeRules() {
        // Utility class
    }

    public static RuleEdge classify(String source, String target, NodeType sourceType, NodeType targetType) {
        if (sourceType == NodeType.AND_GATE)
            return weighted(source, target, EdgeType.EXPLICIT);
        if (targetType == NodeType.AND_GATE)
            return new RuleEdge(source, target, EdgeType.EXPLICIT, null, null);
        if (sourceType == NodeType.PHYSICAL_CHANNEL || targetType == NodeType.PHYSICAL_CHANNEL)
            return weighted(source, target, EdgeType.PHYSICAL_IMPLICIT);
        if (sourceType == NodeType.SYSTEM_CHANNEL || targetType == NodeType.SYSTEM_CHANNEL)
            return weighted(source, target, EdgeType.SYSTEM_IMPLICIT);
        return weighted(source, target, EdgeType.EXPLICIT);
    }

    private static RuleEdge weighted(String source, String target, EdgeType type) {
        return new RuleEdge(source, target, type, type.defaultCost(), type.defaultStealth());
    }
}
