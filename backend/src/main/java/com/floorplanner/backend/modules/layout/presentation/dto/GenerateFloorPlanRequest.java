package com.floorplanner.backend.modules.layout.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import com.floorplanner.backend.modules.layout.domain.GenerationRequest;
import com.floorplanner.backend.modules.layout.domain.LotSize;
import com.floorplanner.backend.modules.layout.domain.SpecialRooms;
import com.fasterxml.jackson.annotation.JsonAlias;

public record GenerateFloorPlanRequest(
        @NotNull(message = "totalSqFt is required and must be a number")
        @DecimalMin(value = "500", message = "totalSqFt must be between 500 and 20,000")
        @DecimalMax(value = "20000", message = "totalSqFt must be between 500 and 20,000")
        Double totalSqFt,

        @NotNull(message = "bedrooms is required and must be an integer")
        @Min(value = 1, message = "bedrooms must be between 1 and 10")
        @Max(value = 10, message = "bedrooms must be between 1 and 10")
        Integer bedrooms,

        @NotNull(message = "bathrooms is required and must be a number")
        @DecimalMin(value = "1", message = "bathrooms must be between 1 and 8")
        @DecimalMax(value = "8", message = "bathrooms must be between 1 and 8")
        Double bathrooms,

        String style,

        @Valid
        SpecialRoomsRequest specialRooms,

        @DecimalMin(value = "20", message = "lotWidth must be between 20 and 1,000")
        @DecimalMax(value = "1000", message = "lotWidth must be between 20 and 1,000")
        @JsonAlias("lot_width")
        Double lotWidth,

        @DecimalMin(value = "20", message = "lotDepth must be between 20 and 1,000")
        @DecimalMax(value = "1000", message = "lotDepth must be between 20 and 1,000")
        @JsonAlias("lot_depth")
        Double lotDepth
) {

    @AssertTrue(message = "lotWidth and lotDepth must be given together")
    public boolean isLotComplete() {
        return (lotWidth == null) == (lotDepth == null);
    }

    public GenerationRequest toGenerationRequest() {
        LotSize lot = (lotWidth != null && lotDepth != null) ? new LotSize(lotWidth, lotDepth) : null;
        SpecialRooms special = specialRooms != null ? specialRooms.toSpecialRooms() : SpecialRooms.none();
        return new GenerationRequest(totalSqFt, bedrooms, bathrooms, style, special, lot);
    }

    public record SpecialRoomsRequest(
            boolean office,
            boolean laundry,
            boolean garage,
            @Min(value = 1, message = "garageCars must be at least 1")
            @JsonAlias("garage_cars")
            Integer garageCars,
            boolean temple
    ) {

        public SpecialRooms toSpecialRooms() {
            int cars = garageCars != null ? garageCars : SpecialRooms.DEFAULT_GARAGE_CARS;
            return new SpecialRooms(office, laundry, garage, cars, temple);
        }
    }
}
