package com.floorplanner.backend.modules.compliance.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    CRITICAL(20),
    WARNING(5),
    INFO(1);

    private final int penalty;

    Severity(int penalty) {
        this.penalty = penalty;
    }

    public int penalty() {
        return penalty;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
