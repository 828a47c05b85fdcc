package com.floorplanner.backend.modules.layout.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fractional shares per category and the matching absolute areas ({@code share * totalSqFt}).
 */
public record SpaceAllocation(String style, double totalSqFt, Map<AllocationCategory, Double> shares) {

    public SpaceAllocation {
        shares = Collections.unmodifiableMap(new EnumMap<>(shares));
    }

    public double share(AllocationCategory category) {
        return shares.getOrDefault(category, 0.0);
    }

    public double area(AllocationCategory category) {
        return share(category) * totalSqFt;
    }

    public double shareTotal() {
        return shares.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
