package com.building.rig.score;

/**
 * Metrics of one path structure.
 *
 * @param path           List-notation rendering of the structure.
 * @param totalCost      Sum of defined hop costs.
 * @param averageStealth Mean of defined hop stealth values, or null if none.
 * @param length         Hop count along the longest AND branch, gates excluded.
 * @param criticality    Highest node centrality on the path, or null if no
 *                       node on it is declared.
 */
public record PathScore(String path, double totalCost, Double averageStealth, int length, Double criticality) {
}
