package com.floorplanner.backend.modules.compliance.domain;

/**
 * Dimensional minimums checked by the compliance rules, based on the International Residential Code.
 * Areas in square feet, widths in feet.
 */
public record BuildingCodes(
        double bedroomMinArea,
        double bathroomMinArea,
        double kitchenMinArea,
        double livingMinArea,
        double hallwayMinWidth,
        double egressWindowMinArea,
        double maxAspectRatio,
        double maxAreaVariancePercent,
        double minEfficiencyPercent
) {

    public static BuildingCodes defaults() {
        return new BuildingCodes(70, 35, 50, 120, 3, 5.7, 3.0, 10, 75);
    }
}
