package com.floorplanner.backend.modules.analysis.presentation;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.floorplanner.backend.modules.analysis.application.PlanAnalysisService;
import com.floorplanner.backend.modules.analysis.presentation.dto.AnalyzePlanResponse;
import com.floorplanner.backend.modules.layout.presentation.FloorPlanPayloadMapper;
import com.floorplanner.backend.modules.layout.presentation.dto.FloorPlanPayload;

@RestController
@RequestMapping("/api")
public class AnalysisController {

    private final FloorPlanPayloadMapper payloadMapper;
    private final PlanAnalysisService planAnalysisService;

    public AnalysisController(FloorPlanPayloadMapper payloadMapper, PlanAnalysisService planAnalysisService) {
        this.payloadMapper = payloadMapper;
        this.planAnalysisService = planAnalysisService;
    }

    @Operation(
            summary = "Analyze a plan",
            description = "Code validation, plan statistics, an energy estimate, up to 10 recommendations and overlapping room pairs."
    )
    @PostMapping("/analyze")
    public ResponseEntity<AnalyzePlanResponse> analyze(@Valid @RequestBody FloorPlanPayload payload) {
        return ResponseEntity.ok(AnalyzePlanResponse.from(planAnalysisService.analyze(payloadMapper.toFloorPlan(payload))));
    }
}
