package com.floorplanner.backend.modules.analysis.application;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.analysis.domain.EnergyEfficiency;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Room;

/**
 * Rough energy estimate from plan compactness (area per perimeter foot) and the share of
 * south-facing rooms.
 */
@Component
public class EnergyEfficiencyEstimator {

    static final double IDEAL_COMPACTNESS = 0.25;
    static final double COMPACTNESS_WEIGHT = 0.6;
    static final double ORIENTATION_WEIGHT = 0.4;

    public EnergyEfficiency estimate(FloorPlan plan) {
        if (plan.rooms().isEmpty()) {
            return EnergyEfficiency.notApplicable();
        }

        double totalArea = plan.totalArea();
        double totalPerimeter = plan.rooms().stream().mapToDouble(Room::perimeter).sum();
        double compactness = totalPerimeter > 0 ? totalArea / totalPerimeter : 0;
        double compactnessScore = Math.min(100, compactness / IDEAL_COMPACTNESS * 100);

        int southFacing = (int) plan.rooms().stream()
                .filter(room -> room.orientation() != null && room.orientation().code().contains("south"))
                .count();
        int totalRooms = plan.roomCount();
        double orientationScore = Math.min(100, (double) southFacing / totalRooms * 200);

        double score = compactnessScore * COMPACTNESS_WEIGHT + orientationScore * ORIENTATION_WEIGHT;
        return new EnergyEfficiency(
                round(score, 1),
                grade(score),
                round(compactnessScore, 1),
                round(orientationScore, 1),
                new EnergyEfficiency.Details(round(compactness, 3), southFacing, totalRooms)
        );
    }

    static String grade(double score) {
        if (score >= 85) {
            return "A";
        }
        if (score >= 70) {
            return "B";
        }
        if (score >= 55) {
            return "C";
        }
        return "D";
    }

    private static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
