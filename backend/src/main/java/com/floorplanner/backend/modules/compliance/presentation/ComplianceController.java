package com.floorplanner.backend.modules.compliance.presentation;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.floorplanner.backend.modules.compliance.application.ComplianceReportBuilder;
import com.floorplanner.backend.modules.compliance.application.ComplianceValidator;
import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.compliance.presentation.dto.ComplianceResponse;
import com.floorplanner.backend.modules.compliance.presentation.dto.ValidatePlanResponse;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.presentation.FloorPlanPayloadMapper;
import com.floorplanner.backend.modules.layout.presentation.dto.FloorPlanPayload;

@RestController
@RequestMapping("/api")
public class ComplianceController {

    private final FloorPlanPayloadMapper payloadMapper;
    private final ComplianceValidator complianceValidator;
    private final ComplianceReportBuilder reportBuilder;

    public ComplianceController(
            FloorPlanPayloadMapper payloadMapper,
            ComplianceValidator complianceValidator,
            ComplianceReportBuilder reportBuilder
    ) {
        this.payloadMapper = payloadMapper;
        this.complianceValidator = complianceValidator;
        this.reportBuilder = reportBuilder;
    }

    @Operation(summary = "Validate a plan against the building code and render a text report")
    @PostMapping("/validate")
    public ResponseEntity<ValidatePlanResponse> validate(@Valid @RequestBody FloorPlanPayload payload) {
        FloorPlan plan = payloadMapper.toFloorPlan(payload);
        ComplianceResult result = complianceValidator.validate(plan);
        return ResponseEntity.ok(new ValidatePlanResponse(
                true,
                ComplianceResponse.from(result),
                reportBuilder.build(result)
        ));
    }
}
