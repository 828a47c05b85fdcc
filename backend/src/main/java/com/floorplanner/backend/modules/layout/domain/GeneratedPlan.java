package com.floorplanner.backend.modules.layout.domain;

import java.util.List;
import java.util.Map;

/**
 * A generated plan plus the strategy that positioned each room, keyed by room name.
 */
public record GeneratedPlan(FloorPlan floorPlan, Map<String, PlacementStrategy> strategies) {

    public GeneratedPlan {
        strategies = Map.copyOf(strategies);
    }

    public PlacementStrategy strategyOf(String roomName) {
        return strategies.getOrDefault(roomName, PlacementStrategy.PREFERRED_ORIENTATION);
    }

    public List<String> roomNamesPlacedBy(PlacementStrategy strategy) {
        return floorPlan.rooms().stream()
                .map(Room::name)
                .filter(name -> strategyOf(name) == strategy)
                .toList();
    }
}
