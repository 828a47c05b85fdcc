package com.floorplanner.backend.modules.layout.application;

/**
 * Tunables of the placement engine, all in feet (or square feet for {@code minRoomSize}).
 *
 * @param minRoomSize        floor applied to every requested room area
 * @param gridSize           snapping unit for room width and height
 * @param placementMargin    clearance required between a candidate and already placed rooms
 * @param scanStep           step along the free axis of an orientation scan
 * @param fallbackScanStep   step of the raster scan used when no oriented candidate is free
 * @param edgeClearance      offset from the footprint edge where scans start
 * @param scoreRadius        centre distance beyond which a placed room does not affect scoring
 * @param adjacencyThreshold centre distance below which two rooms are recorded as adjacent
 */
public record LayoutSettings(
        double minRoomSize,
        double gridSize,
        double placementMargin,
        int scanStep,
        int fallbackScanStep,
        double edgeClearance,
        double scoreRadius,
        double adjacencyThreshold
) {

    public static LayoutSettings defaults() {
        return new LayoutSettings(50, 10, 5, 50, 25, 50, 100, 50);
    }
}
