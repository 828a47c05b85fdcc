package com.floorplanner.backend.modules.layout.domain;

public record LotSize(double width, double depth) {

    public LotSize {
        if (width <= 0 || depth <= 0) {
            throw new IllegalArgumentException("lot dimensions must be positive");
        }
    }
}
