package com.floorplanner.backend.modules.layout.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AllocationCategory {
    LIVING,
    KITCHEN,
    DINING,
    BEDROOMS,
    BATHROOMS,
    CIRCULATION,
    STORAGE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
