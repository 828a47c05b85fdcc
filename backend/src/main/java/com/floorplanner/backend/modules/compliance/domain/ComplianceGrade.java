package com.floorplanner.backend.modules.compliance.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Letter grades with inclusive lower bounds, highest first.
 */
public enum ComplianceGrade {
    A_PLUS("A+", 95),
    A("A", 90),
    B_PLUS("B+", 85),
    B("B", 80),
    C_PLUS("C+", 75),
    C("C", 70),
    D("D", 60),
    F("F", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double lowerBound;

    ComplianceGrade(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static ComplianceGrade fromScore(double score) {
        for (ComplianceGrade grade : values()) {
            if (score >= grade.lowerBound) {
                return grade;
            }
        }
        return F;
    }
}
