package com.floorplanner.backend.modules.layout.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Orientation {
    NORTH,
    SOUTH,
    EAST,
    WEST,
    NORTHEAST,
    NORTHWEST,
    SOUTHEAST,
    SOUTHWEST;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isSouthern() {
        return this == SOUTH || this == SOUTHEAST || this == SOUTHWEST;
    }

    public boolean isNorthern() {
        return this == NORTH || this == NORTHEAST || this == NORTHWEST;
    }

    /**
     * Lenient lookup for imported plans; returns {@code null} for blank or unknown codes.
     */
    public static Orientation fromCodeOrNull(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (Orientation orientation : values()) {
            if (orientation.name().equals(normalized)) {
                return orientation;
            }
        }
        return null;
    }
}
