package com.building.rig.score;

/** A single directed adjacent pair extracted from a path structure. */
public record Hop(String source, String target) {

    @Override
    public String toString() {
        return source + "--->" + target;
    }
}
