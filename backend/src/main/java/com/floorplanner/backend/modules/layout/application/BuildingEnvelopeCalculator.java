package com.floorplanner.backend.modules.layout.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.layout.domain.Footprint;
import com.floorplanner.backend.modules.layout.domain.LotSize;

/**
 * Picks a footprint close to a 1.3:1 width to depth ratio, which keeps the perimeter small
 * for the requested area.
 */
@Component
public class BuildingEnvelopeCalculator {

    static final double IDEAL_RATIO = 1.3;
    static final double LOT_USABLE_FRACTION = 0.8;
    static final double GROWTH_STEP = 5;

    public Footprint calculate(double totalSqFt, Optional<LotSize> lot) {
        double maxWidth = lot.map(l -> l.width() * LOT_USABLE_FRACTION).orElse(Double.POSITIVE_INFINITY);
        double maxDepth = lot.map(l -> l.depth() * LOT_USABLE_FRACTION).orElse(Double.POSITIVE_INFINITY);

        double width = Math.min(Math.sqrt(totalSqFt * IDEAL_RATIO), maxWidth);
        double depth = Math.min(totalSqFt / width, maxDepth);

        while (width * depth < totalSqFt) {
            if (width < maxWidth) {
                width += GROWTH_STEP;
            } else {
                depth += GROWTH_STEP;
            }
        }
        return new Footprint(round2(width), round2(depth));
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
