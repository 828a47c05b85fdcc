package com.floorplanner.backend.modules.compliance.presentation.dto;

public record ValidatePlanResponse(boolean success, ComplianceResponse validation, String report) {
}
