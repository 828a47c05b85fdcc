package com.floorplanner.backend.modules.analysis.presentation.dto;

import java.util.List;

import com.floorplanner.backend.modules.analysis.domain.EnergyEfficiency;
import com.floorplanner.backend.modules.analysis.domain.PlanAnalysis;
import com.floorplanner.backend.modules.analysis.domain.Recommendation;
import com.floorplanner.backend.modules.compliance.presentation.dto.ComplianceResponse;
import com.floorplanner.backend.modules.layout.presentation.dto.PlanNumbers;
import com.floorplanner.backend.modules.layout.presentation.dto.PlanStatsResponse;

public record AnalyzePlanResponse(
        boolean success,
        ComplianceResponse validation,
        PlanStatsResponse stats,
        EnergyEfficiency energyEfficiency,
        List<Recommendation> recommendations,
        List<OverlapResponse> overlaps
) {

    public static AnalyzePlanResponse from(PlanAnalysis analysis) {
        return new AnalyzePlanResponse(
                true,
                ComplianceResponse.from(analysis.compliance()),
                PlanStatsResponse.from(analysis.plan()),
                analysis.energyEfficiency(),
                analysis.recommendations(),
                analysis.overlaps().stream()
                        .map(overlap -> new OverlapResponse(
                                overlap.firstRoom(),
                                overlap.secondRoom(),
                                PlanNumbers.round2(overlap.overlapArea())))
                        .toList()
        );
    }

    public record OverlapResponse(String firstRoom, String secondRoom, double overlapArea) {
    }
}
