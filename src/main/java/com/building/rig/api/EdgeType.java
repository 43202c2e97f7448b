package com.building.rig.api;

/**
 * Kind of an interaction edge, with the default adversarial cost and stealth
 * an edge of that kind is given when the graph is built.
 */
public enum EdgeType {
    EXPLICIT("explicit", 1, 1),
    PHYSICAL_IMPLICIT("physical_implicit", 5, 3),
    SYSTEM_IMPLICIT("system_implicit", 3, 2);

    private final String wireName;
    private final double defaultCost;
    private final double defaultStealth;

    EdgeType(String wireName, double defaultCost, double defaultStealth) {
        this.wireName = wireName;
        this.defaultCost = defaultCost;
        this.defaultStealth = defaultStealth;
    }

    public String wireName() {
        return wireName;
    }

    public double defaultCost() {
        return defaultCost;
    }

    public double defaultStealth() {
        return defaultStealth;
    }

    public static EdgeType fromString(String text) {
        if (text == null)
            throw new IllegalArgumentException("Missing edge type");
        for (EdgeType t : values()) {
            if (t.wireName.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown EdgeType: " + text);
    }
}
