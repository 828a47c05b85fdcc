package com.floorplanner.backend.modules.layout.domain;

import java.util.Optional;

public record GenerationRequest(
        double totalSqFt,
        int bedroomCount,
        double bathroomCount,
        String style,
        SpecialRooms specialRooms,
        LotSize lot
) {

    public GenerationRequest {
        style = (style == null || style.isBlank()) ? FloorPlan.DEFAULT_STYLE : style;
        specialRooms = specialRooms == null ? SpecialRooms.none() : specialRooms;
    }

    public static GenerationRequest of(double totalSqFt, int bedroomCount, double bathroomCount, String style) {
        return new GenerationRequest(totalSqFt, bedroomCount, bathroomCount, style, SpecialRooms.none(), null);
    }

    public Optional<LotSize> lotSize() {
        return Optional.ofNullable(lot);
    }
}
