package com.floorplanner.backend.modules.layout.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A plan submitted by a client, usually one previously returned by generation. Derived fields such as
 * {@code stats}, {@code perimeter} and {@code aspect_ratio} are ignored on input. A missing room list is
 * rejected by the mapper with a 400 rather than by bean validation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FloorPlanPayload(
        @JsonProperty("total_sqft") @JsonAlias("totalSqFt") Double totalSqFt,
        Integer bedrooms,
        Double bathrooms,
        Integer floors,
        String style,
        @JsonProperty("lot_width") Double lotWidth,
        @JsonProperty("lot_depth") Double lotDepth,
        List<@NotNull(message = "rooms must not contain null entries") @Valid RoomPayload> rooms
) {
}
