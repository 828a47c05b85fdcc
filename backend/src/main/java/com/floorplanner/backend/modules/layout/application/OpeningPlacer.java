package com.floorplanner.backend.modules.layout.application;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.layout.domain.Door;
import com.floorplanner.backend.modules.layout.domain.Room;
import com.floorplanner.backend.modules.layout.domain.RoomType;
import com.floorplanner.backend.modules.layout.domain.Window;

/**
 * Adds doors and windows by room type. Only bedrooms and the living room get openings here;
 * the compliance check still reports what other rooms are missing.
 */
@Component
public class OpeningPlacer {

    static final double ENTRY_DOOR_WIDTH = 3;
    static final double EGRESS_WINDOW_WIDTH = 4;
    static final double EGRESS_WINDOW_HEIGHT = 4.5;
    static final double PICTURE_WINDOW_WIDTH = 6;
    static final double CASEMENT_WINDOW_WIDTH = 4;
    static final double LIVING_WINDOW_HEIGHT = 5;

    public List<Room> addOpenings(List<Room> rooms) {
        return rooms.stream()
                .map(this::addOpenings)
                .toList();
    }

    Room addOpenings(Room room) {
        if (room.roomType().isBedroom()) {
            List<Door> doors = new ArrayList<>(room.doors());
            // entry centred on the south wall
            doors.add(new Door(room.x() + room.width() / 2, room.y(), ENTRY_DOOR_WIDTH, Door.ENTRY));

            List<Window> windows = new ArrayList<>(room.windows());
            // egress on the far (north) wall
            windows.add(new Window(room.x() + room.width() * 0.7, room.y() + room.height(),
                    EGRESS_WINDOW_WIDTH, EGRESS_WINDOW_HEIGHT, Window.EGRESS));
            return room.withDoors(doors).withWindows(windows);
        }
        if (room.roomType() == RoomType.LIVING) {
            List<Window> windows = new ArrayList<>(room.windows());
            windows.add(new Window(room.x() + room.width() / 3, room.y(),
                    PICTURE_WINDOW_WIDTH, LIVING_WINDOW_HEIGHT, Window.PICTURE));
            windows.add(new Window(room.x() + room.width() * 2 / 3, room.y(),
                    CASEMENT_WINDOW_WIDTH, LIVING_WINDOW_HEIGHT, Window.CASEMENT));
            return room.withWindows(windows);
        }
        return room;
    }
}
