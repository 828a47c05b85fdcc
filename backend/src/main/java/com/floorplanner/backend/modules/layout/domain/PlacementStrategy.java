package com.floorplanner.backend.modules.layout.domain;

/**
 * How a room's position was found. Only {@link #PREFERRED_ORIENTATION} and {@link #RASTER_SCAN}
 * guarantee the margin against earlier rooms; {@link #DEFAULT_POSITION} may overlap.
 */
public enum PlacementStrategy {
    PREFERRED_ORIENTATION,
    RASTER_SCAN,
    DEFAULT_POSITION;

    public boolean isFallback() {
        return this != PREFERRED_ORIENTATION;
    }
}
