package com.floorplanner.backend.modules.layout.presentation.dto;

import java.util.List;
import java.util.Set;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A room as submitted for validation or analysis. {@code type} defaults to living when omitted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoomPayload(
        @NotBlank(message = "room name is required")
        String name,
        String type,
        @NotNull(message = "room x is required") Double x,
        @NotNull(message = "room y is required") Double y,
        @NotNull(message = "room width is required") Double width,
        @NotNull(message = "room height is required") Double height,
        @NotNull(message = "room area is required") Double area,
        String color,
        String orientation,
        @JsonProperty("floor_level") @JsonAlias("floorLevel") Integer floorLevel,
        List<@NotNull(message = "doors must not contain null entries") DoorPayload> doors,
        List<@NotNull(message = "windows must not contain null entries") WindowPayload> windows,
        @JsonProperty("adjacent_rooms") @JsonAlias("adjacentRooms") Set<String> adjacentRooms
) {
}
