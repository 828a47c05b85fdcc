package com.floorplanner.backend.modules.layout.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import com.floorplanner.backend.global.error.ProblemException;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Orientation;
import com.floorplanner.backend.modules.layout.domain.Room;
import com.floorplanner.backend.modules.layout.domain.RoomType;
import com.floorplanner.backend.modules.layout.presentation.dto.DoorPayload;
import com.floorplanner.backend.modules.layout.presentation.dto.FloorPlanPayload;
import com.floorplanner.backend.modules.layout.presentation.dto.RoomPayload;
import com.floorplanner.backend.modules.layout.presentation.dto.WindowPayload;

class FloorPlanPayloadMapperTest {

    private final FloorPlanPayloadMapper mapper = new FloorPlanPayloadMapper();

    @Test
    @DisplayName("a submitted plan is rebuilt with its openings and orientation")
    void mapsPlan() {
        RoomPayload bedroom = new RoomPayload("Bedroom 2", "bedroom", 0.0, 0.0, 10.0, 12.0, 120.0, "#c8ffc8",
                "east", 1, List.of(new DoorPayload(5, 0, 3, "entry")),
                List.of(new WindowPayload(7, 12, 4, 4.5, "egress")), Set.of("Bathroom 2"));

        FloorPlan plan = mapper.toFloorPlan(new FloorPlanPayload(2000.0, 3, 2.0, 1, "ranch", null, null, List.of(bedroom)));

        Room room = plan.rooms().get(0);
        assertThat(plan.totalSqFt()).isEqualTo(2000);
        assertThat(plan.style()).isEqualTo("ranch");
        assertThat(room.roomType()).isEqualTo(RoomType.BEDROOM);
        assertThat(room.orientation()).isEqualTo(Orientation.EAST);
        assertThat(room.windows().get(0).isEgress()).isTrue();
        assertThat(room.doors()).hasSize(1);
        assertThat(room.adjacentRoomNames()).containsExactly("Bathroom 2");
    }

    @Test
    @DisplayName("missing counts default to zero and a missing room type to living")
    void defaults() {
        RoomPayload room = new RoomPayload("Great Room", null, 0.0, 0.0, 20.0, 15.0, 300.0, null,
                "sideways", null, null, null, null);

        FloorPlan plan = mapper.toFloorPlan(new FloorPlanPayload(null, null, null, null, null, null, null, List.of(room)));

        assertThat(plan.totalSqFt()).isZero();
        assertThat(plan.bedroomCount()).isZero();
        assertThat(plan.bathroomCount()).isZero();
        assertThat(plan.style()).isEqualTo("modern");
        assertThat(plan.rooms().get(0).roomType()).isEqualTo(RoomType.LIVING);
        assertThat(plan.rooms().get(0).orientation()).isNull();
        assertThat(plan.rooms().get(0).color()).isEqualTo(Room.DEFAULT_COLOR);
    }

    @Test
    @DisplayName("an unknown room type is a bad request")
    void unknownRoomType() {
        RoomPayload room = new RoomPayload("Ballroom", "ballroom", 0.0, 0.0, 40.0, 30.0, 1200.0, null,
                null, null, null, null, null);

        assertThatThrownBy(() -> mapper.toFloorPlan(new FloorPlanPayload(0.0, 0, 0.0, 1, null, null, null, List.of(room))))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("unknown_room_type");
                    assertThat(ex.getDetailMessage()).isEqualTo("Unknown room type: ballroom");
                });
    }

    @Test
    @DisplayName("a plan without rooms is a bad request")
    void missingRooms() {
        assertThatThrownBy(() -> mapper.toFloorPlan(new FloorPlanPayload(2000.0, 3, 2.0, 1, null, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("plan_required"));
    }
}
