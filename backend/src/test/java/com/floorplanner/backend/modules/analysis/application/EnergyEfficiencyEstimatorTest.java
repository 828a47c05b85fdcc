package com.floorplanner.backend.modules.analysis.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.floorplanner.backend.modules.analysis.domain.EnergyEfficiency;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Orientation;
import com.floorplanner.backend.modules.layout.domain.Room;
import com.floorplanner.backend.modules.layout.domain.RoomType;

class EnergyEfficiencyEstimatorTest {

    private final EnergyEfficiencyEstimator estimator = new EnergyEfficiencyEstimator();

    @Test
    @DisplayName("an empty plan cannot be graded")
    void emptyPlan() {
        EnergyEfficiency efficiency = estimator.estimate(FloorPlan.of(0, 0, 0, "modern", List.of()));

        assertThat(efficiency.score()).isZero();
        assertThat(efficiency.grade()).isEqualTo(EnergyEfficiency.NOT_APPLICABLE);
    }

    @Test
    @DisplayName("compact south-facing plans score an A")
    void compactSouthFacing() {
        EnergyEfficiency efficiency = estimator.estimate(FloorPlan.of(100, 0, 0, "modern", List.of(
                oriented("Living Room", RoomType.LIVING, 10, 10, Orientation.SOUTH))));

        assertThat(efficiency.compactness()).isEqualTo(100);
        assertThat(efficiency.orientation()).isEqualTo(100);
        assertThat(efficiency.score()).isEqualTo(100);
        assertThat(efficiency.grade()).isEqualTo("A");
        assertThat(efficiency.details()).isEqualTo(new EnergyEfficiency.Details(2.5, 1, 1));
    }

    @Test
    @DisplayName("south-west rooms count as south facing, north and unknown do not")
    void orientationShare() {
        EnergyEfficiency efficiency = estimator.estimate(FloorPlan.of(400, 0, 0, "modern", List.of(
                oriented("Living Room", RoomType.LIVING, 10, 10, Orientation.SOUTHWEST),
                oriented("Office", RoomType.OFFICE, 10, 10, Orientation.NORTH),
                oriented("Kitchen", RoomType.KITCHEN, 10, 10, null),
                oriented("Bedroom 2", RoomType.BEDROOM, 10, 10, Orientation.EAST))));

        assertThat(efficiency.orientation()).isEqualTo(50);
        assertThat(efficiency.score()).isEqualTo(80);
        assertThat(efficiency.grade()).isEqualTo("B");
        assertThat(efficiency.details().southFacingRooms()).isEqualTo(1);
    }

    @Test
    @DisplayName("grade thresholds are 85, 70 and 55")
    void gradeThresholds() {
        assertThat(EnergyEfficiencyEstimator.grade(85)).isEqualTo("A");
        assertThat(EnergyEfficiencyEstimator.grade(84.9)).isEqualTo("B");
        assertThat(EnergyEfficiencyEstimator.grade(70)).isEqualTo("B");
        assertThat(EnergyEfficiencyEstimator.grade(55)).isEqualTo("C");
        assertThat(EnergyEfficiencyEstimator.grade(54.9)).isEqualTo("D");
    }

    private static Room oriented(String name, RoomType type, double width, double height, Orientation orientation) {
        return new Room(name, type, 0, 0, width, height, width * height, null, orientation, 1,
                List.of(), List.of(), Set.of(), 5);
    }
}
