package com.floorplanner.backend.modules.analysis.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.analysis.domain.Recommendation;
import com.floorplanner.backend.modules.analysis.domain.Recommendation.Priority;
import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Room;

@Component
public class RecommendationAdvisor {

    static final int MAX_RECOMMENDATIONS = 10;
    static final double TARGET_EFFICIENCY = 80;
    static final double BALANCED_ASPECT_RATIO = 2.5;

    public List<Recommendation> recommend(FloorPlan plan, ComplianceResult compliance) {
        List<Recommendation> recommendations = new ArrayList<>();

        int critical = compliance.summary().critical();
        if (critical > 0) {
            recommendations.add(new Recommendation(Priority.HIGH, "Building Code", "Critical Code Violations",
                    "Address %d critical building code violations before construction".formatted(critical),
                    "Review validation report and make necessary changes"));
        }

        double efficiency = plan.efficiencyRatio();
        if (efficiency < TARGET_EFFICIENCY) {
            recommendations.add(new Recommendation(Priority.MEDIUM, "Space Efficiency", "Improve Space Utilization",
                    String.format(Locale.ROOT, "Current efficiency is %.1f%%. Consider reducing circulation areas", efficiency),
                    "Optimize hallway and transition spaces"));
        }

        for (Room room : plan.rooms()) {
            if (room.aspectRatio() > BALANCED_ASPECT_RATIO) {
                recommendations.add(new Recommendation(Priority.LOW, "Room Design", "Balance " + room.name() + " Proportions",
                        String.format(Locale.ROOT, "Room has unusual aspect ratio (%.1f:1)", room.aspectRatio()),
                        "Consider more balanced width-to-length ratio"));
            }
        }

        return recommendations.size() > MAX_RECOMMENDATIONS
                ? List.copyOf(recommendations.subList(0, MAX_RECOMMENDATIONS))
                : List.copyOf(recommendations);
    }
}
