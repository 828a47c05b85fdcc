package com.floorplanner.backend.modules.analysis.domain;

import java.util.List;

import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;

public record PlanAnalysis(
        FloorPlan plan,
        ComplianceResult compliance,
        EnergyEfficiency energyEfficiency,
        List<Recommendation> recommendations,
        List<RoomOverlap> overlaps
) {

    public PlanAnalysis {
        recommendations = List.copyOf(recommendations);
        overlaps = List.copyOf(overlaps);
    }
}
