package com.floorplanner.backend.modules.layout.application;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.layout.domain.Room;

@Component
public class AdjacencyAnnotator {

    private final LayoutSettings settings;

    public AdjacencyAnnotator(LayoutSettings settings) {
        this.settings = settings;
    }

    /**
     * Records, per room, the names of rooms whose centre lies closer than the adjacency threshold.
     * Existing entries are kept and each room is updated from its own centre only.
     */
    public List<Room> annotate(List<Room> rooms) {
        List<Room> annotated = new ArrayList<>(rooms.size());
        for (int i = 0; i < rooms.size(); i++) {
            Room room = rooms.get(i);
            Set<String> neighbours = new LinkedHashSet<>(room.adjacentRoomNames());
            for (int j = 0; j < rooms.size(); j++) {
                if (i == j) {
                    continue;
                }
                Room other = rooms.get(j);
                if (room.distanceTo(other) < settings.adjacencyThreshold()) {
                    neighbours.add(other.name());
                }
            }
            annotated.add(room.withAdjacentRoomNames(neighbours));
        }
        return annotated;
    }
}
