package com.floorplanner.backend.modules.layout.presentation.dto;

import com.floorplanner.backend.modules.layout.domain.Door;

public record DoorPayload(double x, double y, double width, String type) {

    public static DoorPayload from(Door door) {
        return new DoorPayload(
                PlanNumbers.round2(door.x()),
                PlanNumbers.round2(door.y()),
                PlanNumbers.round2(door.width()),
                door.kind()
        );
    }

    public Door toDoor() {
        return new Door(x, y, width, type);
    }
}
