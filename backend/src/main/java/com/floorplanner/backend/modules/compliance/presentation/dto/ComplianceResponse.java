package com.floorplanner.backend.modules.compliance.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.compliance.domain.ComplianceSummary;

public record ComplianceResponse(
        boolean compliant,
        @JsonProperty("compliance_score") int complianceScore,
        String grade,
        List<ViolationResponse> violations,
        ComplianceSummary summary
) {

    public static ComplianceResponse from(ComplianceResult result) {
        return new ComplianceResponse(
                result.compliant(),
                result.complianceScore(),
                result.grade().label(),
                result.violations().stream().map(ViolationResponse::from).toList(),
                result.summary()
        );
    }
}
