package com.floorplanner.backend.modules.layout.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.floorplanner.backend.modules.layout.domain.RoomRequest;
import com.floorplanner.backend.modules.layout.domain.RoomType;
import com.floorplanner.backend.modules.layout.domain.SpecialRooms;

class RoomListGeneratorTest {

    private final SpaceAllocationPlanner planner = new SpaceAllocationPlanner();
    private final RoomListGenerator generator = new RoomListGenerator();

    @Test
    @DisplayName("a 2000 sq ft modern plan with 3 bedrooms and 2 bathrooms lists eight rooms")
    void standardProgram() {
        List<RoomRequest> rooms = generator.generate(planner.allocate(2000, 3, 2, "modern"), 3, 2, SpecialRooms.none());

        assertThat(rooms).extracting(RoomRequest::name, RoomRequest::type, RoomRequest::priority)
                .containsExactly(
                        tuple("Living Room", RoomType.LIVING, 10),
                        tuple("Kitchen", RoomType.KITCHEN, 9),
                        tuple("Dining Room", RoomType.DINING, 7),
                        tuple("Master Bedroom", RoomType.MASTER_BEDROOM, 8),
                        tuple("Bedroom 2", RoomType.BEDROOM, 5),
                        tuple("Bedroom 3", RoomType.BEDROOM, 5),
                        tuple("Master Bathroom", RoomType.MASTER_BATHROOM, 7),
                        tuple("Bathroom 2", RoomType.BATHROOM, 4)
                );
        assertThat(rooms.get(0).area()).isCloseTo(500, within(1e-9));
        assertThat(rooms.get(3).area()).isCloseTo(280, within(1e-9));
        assertThat(rooms.get(4).area()).isCloseTo(180, within(1e-9));
        assertThat(rooms.get(6).area()).isCloseTo(130, within(1e-9));
        assertThat(rooms.get(7).area()).isCloseTo(100, within(1e-9));
    }

    @Test
    @DisplayName("dining is skipped when its budget is not above 80 sq ft")
    void smallDiningBudgetIsSkipped() {
        List<RoomRequest> rooms = generator.generate(planner.allocate(800, 1, 1, "modern"), 1, 1, SpecialRooms.none());

        assertThat(rooms).extracting(RoomRequest::type).doesNotContain(RoomType.DINING);
        assertThat(rooms).extracting(RoomRequest::name)
                .containsExactly("Living Room", "Kitchen", "Master Bedroom", "Master Bathroom");
    }

    @Test
    @DisplayName("a fractional bathroom count adds a half bath sized by the fraction")
    void fractionalBathroomAddsHalfBath() {
        List<RoomRequest> rooms = generator.generate(planner.allocate(2000, 3, 2.5, "modern"), 3, 2.5, SpecialRooms.none());

        List<RoomRequest> bathrooms = rooms.stream().filter(room -> room.type().isBathroom()).toList();
        assertThat(bathrooms).extracting(RoomRequest::name)
                .containsExactly("Master Bathroom", "Bathroom 2", "Half Bath");
        // 3 bathrooms budget is 10% + 3% of 2000, shared by 2.5 baths
        assertThat(bathrooms.get(0).area()).isCloseTo(104 * 1.3, within(1e-9));
        assertThat(bathrooms.get(1).area()).isCloseTo(104, within(1e-9));
        assertThat(bathrooms.get(2).area()).isCloseTo(52, within(1e-9));
    }

    @Test
    @DisplayName("special rooms are appended with fixed areas")
    void specialRooms() {
        SpecialRooms special = new SpecialRooms(true, true, true, 3, true);

        List<RoomRequest> rooms = generator.generate(planner.allocate(3000, 3, 2, "luxury"), 3, 2, special);

        assertThat(rooms.subList(rooms.size() - 4, rooms.size()))
                .extracting(RoomRequest::name, RoomRequest::type, RoomRequest::area, RoomRequest::priority)
                .containsExactly(
                        tuple("Home Office", RoomType.OFFICE, 120.0, 6),
                        tuple("Laundry Room", RoomType.LAUNDRY, 60.0, 3),
                        tuple("3-Car Garage", RoomType.GARAGE, 600.0, 6),
                        tuple("Prayer Room", RoomType.TEMPLE, 80.0, 5)
                );
    }

    @Test
    @DisplayName("garage car count is used as given")
    void garageKeepsRequestedCarCount() {
        SpecialRooms special = new SpecialRooms(false, false, true, 1, false);

        List<RoomRequest> rooms = generator.generate(planner.allocate(2000, 2, 1, "ranch"), 2, 1, special);

        assertThat(rooms).filteredOn(room -> room.type() == RoomType.GARAGE)
                .extracting(RoomRequest::name, RoomRequest::area)
                .containsExactly(tuple("1-Car Garage", 200.0));
    }

    @Test
    @DisplayName("a garage without cars is rejected")
    void garageRequiresAtLeastOneCar() {
        assertThatThrownBy(() -> new SpecialRooms(false, false, true, 0, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("garageCars");
    }

    @Test
    @DisplayName("a single bedroom is the master bedroom")
    void singleBedroom() {
        List<RoomRequest> rooms = generator.generate(planner.allocate(1000, 1, 1, "modern"), 1, 1, null);

        assertThat(rooms).filteredOn(room -> room.type().isBedroom())
                .extracting(RoomRequest::name)
                .containsExactly("Master Bedroom");
    }
}
