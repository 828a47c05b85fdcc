package com.floorplanner.backend.modules.analysis.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public record Recommendation(
        Priority priority,
        String category,
        String title,
        String description,
        String action
) {

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
