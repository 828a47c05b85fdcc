package com.floorplanner.backend.modules.layout.presentation.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding applied to every number leaving the API.
 */
public final class PlanNumbers {

    private PlanNumbers() {
    }

    public static double round2(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
