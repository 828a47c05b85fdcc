package com.floorplanner.backend.modules.analysis.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.floorplanner.backend.modules.analysis.domain.Recommendation;
import com.floorplanner.backend.modules.analysis.domain.Recommendation.Priority;
import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.compliance.domain.Violation;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Room;
import com.floorplanner.backend.modules.layout.domain.RoomType;

class RecommendationAdvisorTest {

    private final RecommendationAdvisor advisor = new RecommendationAdvisor();

    @Test
    @DisplayName("critical violations, low efficiency and narrow rooms each produce a recommendation")
    void recommendationsByPriority() {
        FloorPlan plan = FloorPlan.of(500, 1, 1, "modern", List.of(
                Room.of("Hall", RoomType.LIVING, 0, 0, 30, 10, 300),
                Room.of("2-Car Garage", RoomType.GARAGE, 0, 0, 20, 15, 300)));
        ComplianceResult compliance = ComplianceResult.of(List.of(
                Violation.critical("Bedroom 2", "IRC R310.1", "no egress", "add egress"),
                Violation.critical(Violation.OVERALL_PLAN, "IRC R311.2", "no exit", "add exit")));

        List<Recommendation> recommendations = advisor.recommend(plan, compliance);

        assertThat(recommendations).extracting(Recommendation::priority)
                .containsExactly(Priority.HIGH, Priority.MEDIUM, Priority.LOW);
        assertThat(recommendations.get(0).description())
                .isEqualTo("Address 2 critical building code violations before construction");
        assertThat(recommendations.get(1).description())
                .isEqualTo("Current efficiency is 50.0%. Consider reducing circulation areas");
        assertThat(recommendations.get(2).title()).isEqualTo("Balance Hall Proportions");
        assertThat(recommendations.get(2).description()).isEqualTo("Room has unusual aspect ratio (3.0:1)");
    }

    @Test
    @DisplayName("a compliant efficient plan needs no recommendations")
    void noRecommendations() {
        FloorPlan plan = FloorPlan.of(300, 0, 0, "modern", List.of(
                Room.of("Living Room", RoomType.LIVING, 0, 0, 20, 15, 300)));

        assertThat(advisor.recommend(plan, ComplianceResult.of(List.of()))).isEmpty();
    }

    @Test
    @DisplayName("at most ten recommendations are returned")
    void limitedToTen() {
        List<Room> rooms = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            rooms.add(Room.of("Gallery " + i, RoomType.LIBRARY, 0, 0, 30, 10, 300));
        }

        List<Recommendation> recommendations = advisor.recommend(
                FloorPlan.of(3600, 0, 0, "modern", rooms), ComplianceResult.of(List.of()));

        assertThat(recommendations).hasSize(RecommendationAdvisor.MAX_RECOMMENDATIONS);
        assertThat(recommendations.get(9).title()).isEqualTo("Balance Gallery 10 Proportions");
    }
}
