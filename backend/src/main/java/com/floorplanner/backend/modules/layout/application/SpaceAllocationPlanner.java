package com.floorplanner.backend.modules.layout.application;

import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.BATHROOMS;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.BEDROOMS;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.CIRCULATION;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.LIVING;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.STORAGE;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.layout.domain.AllocationCategory;
import com.floorplanner.backend.modules.layout.domain.SpaceAllocation;

@Component
public class SpaceAllocationPlanner {

    private static final Logger log = LoggerFactory.getLogger(SpaceAllocationPlanner.class);

    public SpaceAllocation allocate(double totalSqFt, int bedroomCount, double bathroomCount, String style) {
        EnumMap<AllocationCategory, Double> shares = ArchitecturalKnowledge.styleShares(style);

        if (bedroomCount > 3) {
            shares.merge(BEDROOMS, 0.05, Double::sum);
            shares.merge(LIVING, -0.03, Double::sum);
            shares.merge(CIRCULATION, -0.02, Double::sum);
        }
        if (bathroomCount > 2) {
            shares.merge(BATHROOMS, 0.03, Double::sum);
            shares.merge(STORAGE, -0.03, Double::sum);
        }

        // shares are intentionally not clamped
        for (Map.Entry<AllocationCategory, Double> entry : shares.entrySet()) {
            if (entry.getValue() < 0) {
                log.warn("Allocation share for {} is negative ({}) for style={}, bedrooms={}, bathrooms={}",
                        entry.getKey().code(), entry.getValue(), style, bedroomCount, bathroomCount);
            }
        }
        return new SpaceAllocation(style, totalSqFt, shares);
    }
}
