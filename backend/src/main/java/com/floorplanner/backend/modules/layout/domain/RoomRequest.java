package com.floorplanner.backend.modules.layout.domain;

/**
 * A room still to be placed: requested area in square feet and placement priority (higher first).
 */
public record RoomRequest(String name, RoomType type, double area, int priority) {
}
