package com.floorplanner.backend.modules.analysis.application;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.analysis.domain.RoomOverlap;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Room;

/**
 * Reports pairs of rooms whose rectangles overlap. Rooms that only share an edge do not count.
 */
@Component
public class GeometryInspector {

    public List<RoomOverlap> findOverlaps(FloorPlan plan) {
        List<Room> rooms = plan.rooms();
        List<RoomOverlap> overlaps = new ArrayList<>();
        for (int i = 0; i < rooms.size(); i++) {
            for (int j = i + 1; j < rooms.size(); j++) {
                double area = overlapArea(rooms.get(i), rooms.get(j));
                if (area > 0) {
                    overlaps.add(new RoomOverlap(rooms.get(i).name(), rooms.get(j).name(), area));
                }
            }
        }
        return overlaps;
    }

    static double overlapArea(Room first, Room second) {
        double overlapWidth = Math.min(first.x() + first.width(), second.x() + second.width())
                - Math.max(first.x(), second.x());
        double overlapHeight = Math.min(first.y() + first.height(), second.y() + second.height())
                - Math.max(first.y(), second.y());
        if (overlapWidth <= 0 || overlapHeight <= 0) {
            return 0;
        }
        return overlapWidth * overlapHeight;
    }
}
