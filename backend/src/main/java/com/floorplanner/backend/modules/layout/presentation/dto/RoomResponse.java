package com.floorplanner.backend.modules.layout.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.floorplanner.backend.modules.layout.domain.Orientation;
import com.floorplanner.backend.modules.layout.domain.Room;

public record RoomResponse(
        String name,
        String type,
        double x,
        double y,
        double width,
        double height,
        double area,
        String color,
        String orientation,
        @JsonProperty("floor_level") int floorLevel,
        List<DoorPayload> doors,
        List<WindowPayload> windows,
        @JsonProperty("adjacent_rooms") List<String> adjacentRooms,
        double perimeter,
        @JsonProperty("aspect_ratio") double aspectRatio
) {

    public static RoomResponse from(Room room) {
        Orientation orientation = room.orientation();
        return new RoomResponse(
                room.name(),
                room.roomType().code(),
                PlanNumbers.round2(room.x()),
                PlanNumbers.round2(room.y()),
                PlanNumbers.round2(room.width()),
                PlanNumbers.round2(room.height()),
                PlanNumbers.round2(room.area()),
                room.color(),
                orientation != null ? orientation.code() : null,
                room.floorLevel(),
                room.doors().stream().map(DoorPayload::from).toList(),
                room.windows().stream().map(WindowPayload::from).toList(),
                List.copyOf(room.adjacentRoomNames()),
                PlanNumbers.round2(room.perimeter()),
                PlanNumbers.round2(room.aspectRatio())
        );
    }
}
