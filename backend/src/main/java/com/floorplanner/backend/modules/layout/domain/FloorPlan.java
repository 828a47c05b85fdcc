package com.floorplanner.backend.modules.layout.domain;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A single-storey plan. {@code bedroomCount} and {@code bathroomCount} are the requested targets,
 * not counts derived from {@link #rooms()}.
 */
public record FloorPlan(
        double totalSqFt,
        List<Room> rooms,
        int bedroomCount,
        double bathroomCount,
        int floors,
        String style,
        double lotWidth,
        double lotDepth
) {

    public static final String DEFAULT_STYLE = "modern";

    private static final Set<RoomType> NON_LIVING_TYPES = EnumSet.of(RoomType.GARAGE, RoomType.STORAGE);

    public FloorPlan {
        rooms = rooms == null ? List.of() : List.copyOf(rooms);
        style = (style == null || style.isBlank()) ? DEFAULT_STYLE : style;
        floors = floors <= 0 ? 1 : floors;
    }

    public static FloorPlan of(double totalSqFt, int bedroomCount, double bathroomCount, String style, List<Room> rooms) {
        return new FloorPlan(totalSqFt, rooms, bedroomCount, bathroomCount, 1, style, 0, 0);
    }

    public double totalArea() {
        return rooms.stream().mapToDouble(Room::area).sum();
    }

    public double totalLivingArea() {
        return rooms.stream()
                .filter(room -> !NON_LIVING_TYPES.contains(room.roomType()))
                .mapToDouble(Room::area)
                .sum();
    }

    public double efficiencyRatio() {
        double total = totalArea();
        return total > 0 ? totalLivingArea() / total * 100 : 0;
    }

    public int roomCount() {
        return rooms.size();
    }

    public List<Room> roomsOfType(RoomType type) {
        return rooms.stream()
                .filter(room -> room.roomType() == type)
                .toList();
    }

    public long bedroomRoomCount() {
        return rooms.stream().filter(room -> room.roomType().isBedroom()).count();
    }

    public long bathroomRoomCount() {
        return rooms.stream().filter(room -> room.roomType().isBathroom()).count();
    }

    public FloorPlan withRooms(List<Room> newRooms) {
        return new FloorPlan(totalSqFt, newRooms, bedroomCount, bathroomCount, floors, style, lotWidth, lotDepth);
    }
}
