package com.floorplanner.backend.modules.compliance.presentation.dto;

import com.floorplanner.backend.modules.compliance.domain.Violation;

public record ViolationResponse(String severity, String room, String code, String message, String recommendation) {

    public static ViolationResponse from(Violation violation) {
        return new ViolationResponse(
                violation.severity().code(),
                violation.room(),
                violation.code(),
                violation.message(),
                violation.recommendation()
        );
    }
}
