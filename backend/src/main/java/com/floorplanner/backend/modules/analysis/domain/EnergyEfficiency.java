package com.floorplanner.backend.modules.analysis.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EnergyEfficiency(
        double score,
        String grade,
        double compactness,
        double orientation,
        Details details
) {

    public static final String NOT_APPLICABLE = "N/A";

    public static EnergyEfficiency notApplicable() {
        return new EnergyEfficiency(0, NOT_APPLICABLE, 0, 0, new Details(0, 0, 0));
    }

    public record Details(
            @JsonProperty("building_compactness") double buildingCompactness,
            @JsonProperty("south_facing_rooms") int southFacingRooms,
            @JsonProperty("total_rooms") int totalRooms
    ) {
    }
}
