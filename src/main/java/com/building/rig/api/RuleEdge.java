package com.building.rig.api;

/**
 * A directed interaction between two nodes. At most one edge exists per
 * ordered (source, target) pair.
 *
 * <p>
 * {@code cost} and {@code stealth} are {@code null} when the edge carries no
 * value; aggregations skip such edges instead of counting them as zero.
 */
public record RuleEdge(String source, String target, EdgeType type, Double cost, Double stealth) {

    public boolean hasCost() {
        return cost != null;
    }

    public boolean hasStealth() {
        return stealth != null;
    }
}
