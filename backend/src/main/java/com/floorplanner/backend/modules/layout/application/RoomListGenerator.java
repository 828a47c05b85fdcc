package com.floorplanner.backend.modules.layout.application;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.layout.domain.AllocationCategory;
import com.floorplanner.backend.modules.layout.domain.RoomRequest;
import com.floorplanner.backend.modules.layout.domain.RoomType;
import com.floorplanner.backend.modules.layout.domain.SpaceAllocation;
import com.floorplanner.backend.modules.layout.domain.SpecialRooms;

/**
 * Expands category budgets and special-room flags into the concrete rooms to place.
 */
@Component
public class RoomListGenerator {

    static final double DINING_MIN_AREA = 80;
    static final double MASTER_BEDROOM_FACTOR = 1.4;
    static final double SECONDARY_BEDROOM_FACTOR = 0.9;
    static final double MASTER_BATHROOM_FACTOR = 1.3;
    static final double OFFICE_AREA = 120;
    static final double LAUNDRY_AREA = 60;
    static final double GARAGE_AREA_PER_CAR = 200;
    static final double PRAYER_ROOM_AREA = 80;

    public List<RoomRequest> generate(
            SpaceAllocation allocation,
            int bedroomCount,
            double bathroomCount,
            SpecialRooms specialRooms
    ) {
        List<RoomRequest> rooms = new ArrayList<>();
        rooms.add(request("Living Room", RoomType.LIVING, allocation.area(AllocationCategory.LIVING)));
        rooms.add(request("Kitchen", RoomType.KITCHEN, allocation.area(AllocationCategory.KITCHEN)));

        double diningArea = allocation.area(AllocationCategory.DINING);
        if (diningArea > DINING_MIN_AREA) {
            rooms.add(request("Dining Room", RoomType.DINING, diningArea));
        }

        addBedrooms(rooms, allocation, bedroomCount);
        addBathrooms(rooms, allocation, bathroomCount);
        addSpecialRooms(rooms, specialRooms == null ? SpecialRooms.none() : specialRooms);
        return rooms;
    }

    private void addBedrooms(List<RoomRequest> rooms, SpaceAllocation allocation, int bedroomCount) {
        if (bedroomCount <= 0) {
            return;
        }
        double share = allocation.area(AllocationCategory.BEDROOMS) / bedroomCount;
        rooms.add(request("Master Bedroom", RoomType.MASTER_BEDROOM, share * MASTER_BEDROOM_FACTOR));
        for (int i = 1; i < bedroomCount; i++) {
            rooms.add(request("Bedroom " + (i + 1), RoomType.BEDROOM, share * SECONDARY_BEDROOM_FACTOR));
        }
    }

    private void addBathrooms(List<RoomRequest> rooms, SpaceAllocation allocation, double bathroomCount) {
        if (bathroomCount <= 0) {
            return;
        }
        double share = allocation.area(AllocationCategory.BATHROOMS) / bathroomCount;
        int fullBathrooms = (int) Math.floor(bathroomCount);
        double fraction = bathroomCount - fullBathrooms;

        for (int i = 0; i < fullBathrooms; i++) {
            if (i == 0) {
                rooms.add(request("Master Bathroom", RoomType.MASTER_BATHROOM, share * MASTER_BATHROOM_FACTOR));
            } else {
                rooms.add(request("Bathroom " + (i + 1), RoomType.BATHROOM, share));
            }
        }
        if (fraction > 0) {
            rooms.add(request("Half Bath", RoomType.BATHROOM, share * fraction));
        }
    }

    private void addSpecialRooms(List<RoomRequest> rooms, SpecialRooms specialRooms) {
        if (specialRooms.office()) {
            rooms.add(request("Home Office", RoomType.OFFICE, OFFICE_AREA));
        }
        if (specialRooms.laundry()) {
            rooms.add(request("Laundry Room", RoomType.LAUNDRY, LAUNDRY_AREA));
        }
        if (specialRooms.garage()) {
            int cars = specialRooms.garageCars();
            rooms.add(request(cars + "-Car Garage", RoomType.GARAGE, cars * GARAGE_AREA_PER_CAR));
        }
        if (specialRooms.temple()) {
            rooms.add(request("Prayer Room", RoomType.TEMPLE, PRAYER_ROOM_AREA));
        }
    }

    private static RoomRequest request(String name, RoomType type, double area) {
        return new RoomRequest(name, type, area, ArchitecturalKnowledge.placementPriority(type));
    }
}
