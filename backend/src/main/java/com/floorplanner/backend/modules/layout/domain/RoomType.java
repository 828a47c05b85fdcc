package com.floorplanner.backend.modules.layout.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RoomType {
    LIVING,
    DINING,
    KITCHEN,
    BEDROOM,
    MASTER_BEDROOM,
    BATHROOM,
    MASTER_BATHROOM,
    OFFICE,
    LAUNDRY,
    GARAGE,
    HALLWAY,
    STORAGE,
    PANTRY,
    MUDROOM,
    TEMPLE,
    GYM,
    LIBRARY;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBedroom() {
        return this == BEDROOM || this == MASTER_BEDROOM;
    }

    public boolean isBathroom() {
        return this == BATHROOM || this == MASTER_BATHROOM;
    }

    @JsonCreator
    public static RoomType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("room type must not be blank");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (RoomType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown room type: " + code);
    }
}
