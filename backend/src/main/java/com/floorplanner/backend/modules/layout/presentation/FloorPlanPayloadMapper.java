package com.floorplanner.backend.modules.layout.presentation;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.global.error.ProblemException;
import com.floorplanner.backend.modules.layout.domain.Door;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Orientation;
import com.floorplanner.backend.modules.layout.domain.Room;
import com.floorplanner.backend.modules.layout.domain.RoomType;
import com.floorplanner.backend.modules.layout.domain.Window;
import com.floorplanner.backend.modules.layout.presentation.dto.DoorPayload;
import com.floorplanner.backend.modules.layout.presentation.dto.FloorPlanPayload;
import com.floorplanner.backend.modules.layout.presentation.dto.RoomPayload;
import com.floorplanner.backend.modules.layout.presentation.dto.WindowPayload;

/**
 * Rebuilds a {@link FloorPlan} from client input. Missing counts default to 0, a missing style to
 * modern, and an unknown orientation is dropped. An unknown room type is rejected.
 */
@Component
public class FloorPlanPayloadMapper {

    public FloorPlan toFloorPlan(FloorPlanPayload payload) {
        if (payload == null || payload.rooms() == null) {
            throw ProblemException.badRequest("plan_required", "Floor plan data is required");
        }
        List<Room> rooms = new ArrayList<>();
        for (RoomPayload roomPayload : payload.rooms()) {
            rooms.add(toRoom(roomPayload));
        }
        return new FloorPlan(
                orZero(payload.totalSqFt()),
                rooms,
                payload.bedrooms() != null ? payload.bedrooms() : 0,
                orZero(payload.bathrooms()),
                payload.floors() != null ? payload.floors() : 1,
                payload.style(),
                orZero(payload.lotWidth()),
                orZero(payload.lotDepth())
        );
    }

    Room toRoom(RoomPayload payload) {
        RoomType type = resolveType(payload.type());
        List<Door> doors = payload.doors() == null
                ? List.of()
                : payload.doors().stream().map(DoorPayload::toDoor).toList();
        List<Window> windows = payload.windows() == null
                ? List.of()
                : payload.windows().stream().map(WindowPayload::toWindow).toList();
        return new Room(
                payload.name(),
                type,
                payload.x(),
                payload.y(),
                payload.width(),
                payload.height(),
                payload.area(),
                payload.color(),
                Orientation.fromCodeOrNull(payload.orientation()),
                payload.floorLevel() != null ? payload.floorLevel() : 1,
                doors,
                windows,
                payload.adjacentRooms(),
                Room.DEFAULT_PRIORITY
        );
    }

    private static RoomType resolveType(String code) {
        if (code == null || code.isBlank()) {
            return RoomType.LIVING;
        }
        try {
            return RoomType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw ProblemException.badRequest("unknown_room_type", "Unknown room type: " + code);
        }
    }

    private static double orZero(Double value) {
        return value != null ? value : 0;
    }
}
