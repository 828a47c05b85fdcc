package com.floorplanner.backend.modules.layout.presentation;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.floorplanner.backend.modules.compliance.application.ComplianceValidator;
import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.compliance.presentation.dto.ComplianceResponse;
import com.floorplanner.backend.modules.layout.application.FloorPlanGenerator;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.presentation.dto.FloorPlanResponse;
import com.floorplanner.backend.modules.layout.presentation.dto.GenerateFloorPlanRequest;
import com.floorplanner.backend.modules.layout.presentation.dto.GenerateFloorPlanResponse;

@RestController
@RequestMapping("/api")
public class FloorPlanController {

    private final FloorPlanGenerator floorPlanGenerator;
    private final ComplianceValidator complianceValidator;

    public FloorPlanController(FloorPlanGenerator floorPlanGenerator, ComplianceValidator complianceValidator) {
        this.floorPlanGenerator = floorPlanGenerator;
        this.complianceValidator = complianceValidator;
    }

    @Operation(
            summary = "Generate a floor plan",
            description = """
                    Allocates area by style, places rooms inside the building footprint and \
                    validates the result against the residential building code. \
                    Unknown styles fall back to `modern`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan generated, `validation` holds the compliance result"),
            @ApiResponse(responseCode = "422", description = "Input out of range, `errors` lists each problem")
    })
    @PostMapping("/generate")
    public ResponseEntity<GenerateFloorPlanResponse> generate(@Valid @RequestBody GenerateFloorPlanRequest request) {
        FloorPlan plan = floorPlanGenerator.generate(request.toGenerationRequest()).floorPlan();
        ComplianceResult validation = complianceValidator.validate(plan);
        return ResponseEntity.ok(new GenerateFloorPlanResponse(
                true,
                FloorPlanResponse.from(plan),
                ComplianceResponse.from(validation),
                GenerateFloorPlanResponse.GENERATED
        ));
    }
}
