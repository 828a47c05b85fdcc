package com.floorplanner.backend.modules.layout.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;

/**
 * Wire form of a plan. Lot dimensions are {@code null} when unknown.
 */
public record FloorPlanResponse(
        @JsonProperty("total_sqft") double totalSqFt,
        int bedrooms,
        double bathrooms,
        int floors,
        String style,
        @JsonProperty("lot_width") Double lotWidth,
        @JsonProperty("lot_depth") Double lotDepth,
        List<RoomResponse> rooms,
        PlanStatsResponse stats
) {

    public static FloorPlanResponse from(FloorPlan plan) {
        return new FloorPlanResponse(
                PlanNumbers.round2(plan.totalSqFt()),
                plan.bedroomCount(),
                plan.bathroomCount(),
                plan.floors(),
                plan.style(),
                plan.lotWidth() > 0 ? PlanNumbers.round2(plan.lotWidth()) : null,
                plan.lotDepth() > 0 ? PlanNumbers.round2(plan.lotDepth()) : null,
                plan.rooms().stream().map(RoomResponse::from).toList(),
                PlanStatsResponse.from(plan)
        );
    }
}
