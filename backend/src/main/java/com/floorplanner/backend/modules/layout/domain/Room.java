package com.floorplanner.backend.modules.layout.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single axis-aligned room in feet, y pointing up. {@code area} is stored rather than derived
 * because grid snapping and imported plans can make it differ from {@code width * height}.
 */
public record Room(
        String name,
        RoomType roomType,
        double x,
        double y,
        double width,
        double height,
        double area,
        String color,
        Orientation orientation,
        int floorLevel,
        List<Door> doors,
        List<Window> windows,
        Set<String> adjacentRoomNames,
        int priority
) {

    public static final String DEFAULT_COLOR = "#ffffff";
    public static final int DEFAULT_PRIORITY = 5;

    public Room {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(roomType, "roomType");
        color = (color == null || color.isBlank()) ? DEFAULT_COLOR : color;
        doors = doors == null ? List.of() : List.copyOf(doors);
        windows = windows == null ? List.of() : List.copyOf(windows);
        adjacentRoomNames = adjacentRoomNames == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(adjacentRoomNames));
    }

    public static Room of(String name, RoomType roomType, double x, double y, double width, double height, double area) {
        return new Room(name, roomType, x, y, width, height, area, DEFAULT_COLOR, null, 1,
                List.of(), List.of(), Set.of(), DEFAULT_PRIORITY);
    }

    public double perimeter() {
        return 2 * (width + height);
    }

    public double aspectRatio() {
        return height > 0 ? width / height : 1.0;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    public double distanceTo(Room other) {
        return Math.hypot(centerX() - other.centerX(), centerY() - other.centerY());
    }

    public Room withDoors(List<Door> newDoors) {
        return new Room(name, roomType, x, y, width, height, area, color, orientation, floorLevel,
                newDoors, windows, adjacentRoomNames, priority);
    }

    public Room withWindows(List<Window> newWindows) {
        return new Room(name, roomType, x, y, width, height, area, color, orientation, floorLevel,
                doors, newWindows, adjacentRoomNames, priority);
    }

    public Room withAdjacentRoomNames(Set<String> names) {
        return new Room(name, roomType, x, y, width, height, area, color, orientation, floorLevel,
                doors, windows, names, priority);
    }
}
