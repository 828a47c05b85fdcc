package com.floorplanner.backend.modules.analysis.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.floorplanner.backend.modules.analysis.domain.PlanAnalysis;
import com.floorplanner.backend.modules.analysis.domain.RoomOverlap;
import com.floorplanner.backend.modules.compliance.application.ComplianceValidator;
import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;

/**
 * Combines code validation, the energy estimate, recommendations and the overlap check for one plan.
 */
@Service
public class PlanAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(PlanAnalysisService.class);

    private final ComplianceValidator complianceValidator;
    private final EnergyEfficiencyEstimator energyEfficiencyEstimator;
    private final RecommendationAdvisor recommendationAdvisor;
    private final GeometryInspector geometryInspector;

    public PlanAnalysisService(
            ComplianceValidator complianceValidator,
            EnergyEfficiencyEstimator energyEfficiencyEstimator,
            RecommendationAdvisor recommendationAdvisor,
            GeometryInspector geometryInspector
    ) {
        this.complianceValidator = complianceValidator;
        this.energyEfficiencyEstimator = energyEfficiencyEstimator;
        this.recommendationAdvisor = recommendationAdvisor;
        this.geometryInspector = geometryInspector;
    }

    public PlanAnalysis analyze(FloorPlan plan) {
        ComplianceResult compliance = complianceValidator.validate(plan);
        List<RoomOverlap> overlaps = geometryInspector.findOverlaps(plan);
        if (!overlaps.isEmpty()) {
            log.info("Plan with {} rooms has {} overlapping room pairs", plan.roomCount(), overlaps.size());
        }
        return new PlanAnalysis(
                plan,
                compliance,
                energyEfficiencyEstimator.estimate(plan),
                recommendationAdvisor.recommend(plan, compliance),
                overlaps
        );
    }
}
