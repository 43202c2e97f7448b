package com.building.rig.api;

/**
 * Kind of a node in a rule interaction graph.
 *
 * <p>
 * The type is fixed when the node is declared and never re-derived from the
 * shape of its id at use sites. Each constant carries the wire name used by
 * the graph-info document.
 */
public enum NodeType {
    TRIGGER("trigger"),
    ACTION("action"),
    AND_GATE("AND"),
    OR_GATE("OR"),
    PHYSICAL_CHANNEL("physical_channel"),
    SYSTEM_CHANNEL("system_channel"),
    GENERIC_CHANNEL("channel");

    // Gate nodes that are neither AND nor OR are written as "logic" by older tooling.
    private static final String GENERIC_LOGIC = "logic";

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** True for AND and OR gates (logic placeholders that are not rule elements). */
    public boolean isGate() {
        return this == AND_GATE || this == OR_GATE;
    }

    public boolean isChannel() {
        return this == PHYSICAL_CHANNEL || this == SYSTEM_CHANNEL || this == GENERIC_CHANNEL;
    }

    /**
     * Whether betweenness centrality is computed for nodes of this type.
     * AND gates and channels are always pinned to zero.
     */
    public boolean carriesCentrality() {
        return this != AND_GATE && !isChannel();
    }

    /**
     * Resolves a wire name or constant name, case-insensitively.
     *
     * @throws IllegalArgumentException if the text names no type.
     */
    public static NodeType fromString(String text) {
        if (text == null)
            throw new IllegalArgumentException("Missing node type");
        if (GENERIC_LOGIC.equalsIgnoreCase(text))
            return OR_GATE;
        for (NodeType t : values()) {
            if (t.wireName.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }
}
