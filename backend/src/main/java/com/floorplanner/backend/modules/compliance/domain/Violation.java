package com.floorplanner.backend.modules.compliance.domain;

import java.util.Objects;

/**
 * A single rule finding. {@code room} is a room name or {@link #OVERALL_PLAN} for plan-level rules.
 */
public record Violation(Severity severity, String room, String code, String message, String recommendation) {

    public static final String OVERALL_PLAN = "Overall Plan";

    public Violation {
        Objects.requireNonNull(severity, "severity");
        recommendation = recommendation == null ? "" : recommendation;
    }

    public static Violation critical(String room, String code, String message, String recommendation) {
        return new Violation(Severity.CRITICAL, room, code, message, recommendation);
    }

    public static Violation warning(String room, String code, String message, String recommendation) {
        return new Violation(Severity.WARNING, room, code, message, recommendation);
    }

    public static Violation info(String room, String code, String message, String recommendation) {
        return new Violation(Severity.INFO, room, code, message, recommendation);
    }

    public boolean hasRecommendation() {
        return !recommendation.isBlank();
    }
}
