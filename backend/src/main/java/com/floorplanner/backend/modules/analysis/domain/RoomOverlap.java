package com.floorplanner.backend.modules.analysis.domain;

/**
 * Two rooms whose rectangles share {@code overlapArea} square feet.
 */
public record RoomOverlap(String firstRoom, String secondRoom, double overlapArea) {
}
