package com.floorplanner.backend.modules.layout.domain;

public record Placement(Room room, PlacementStrategy strategy) {
}
