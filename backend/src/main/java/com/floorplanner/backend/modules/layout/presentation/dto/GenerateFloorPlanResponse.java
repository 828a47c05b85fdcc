package com.floorplanner.backend.modules.layout.presentation.dto;

import com.floorplanner.backend.modules.compliance.presentation.dto.ComplianceResponse;

public record GenerateFloorPlanResponse(
        boolean success,
        FloorPlanResponse floorPlan,
        ComplianceResponse validation,
        String message
) {

    public static final String GENERATED = "Floor plan generated successfully";
}
