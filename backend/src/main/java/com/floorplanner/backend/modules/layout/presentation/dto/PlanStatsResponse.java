package com.floorplanner.backend.modules.layout.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;

public record PlanStatsResponse(
        @JsonProperty("total_living_area") double totalLivingArea,
        @JsonProperty("efficiency_ratio") double efficiencyRatio,
        @JsonProperty("room_count") int roomCount,
        @JsonProperty("total_area") double totalArea
) {

    public static PlanStatsResponse from(FloorPlan plan) {
        return new PlanStatsResponse(
                PlanNumbers.round2(plan.totalLivingArea()),
                PlanNumbers.round2(plan.efficiencyRatio()),
                plan.roomCount(),
                PlanNumbers.round2(plan.totalArea())
        );
    }
}
