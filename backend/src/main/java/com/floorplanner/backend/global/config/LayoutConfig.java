package com.floorplanner.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.floorplanner.backend.modules.layout.application.LayoutSettings;

@Configuration
public class LayoutConfig {

    @Value("${app.layout.min-room-size:50}")
    private double minRoomSize;

    @Value("${app.layout.grid-size:10}")
    private double gridSize;

    @Value("${app.layout.placement-margin:5}")
    private double placementMargin;

    @Value("${app.layout.scan-step:50}")
    private int scanStep;

    @Value("${app.layout.fallback-scan-step:25}")
    private int fallbackScanStep;

    @Value("${app.layout.edge-clearance:50}")
    private double edgeClearance;

    @Value("${app.layout.score-radius:100}")
    private double scoreRadius;

    @Value("${app.layout.adjacency-threshold:50}")
    private double adjacencyThreshold;

    @Bean
    public LayoutSettings layoutSettings() {
        return new LayoutSettings(
                minRoomSize,
                gridSize,
                placementMargin,
                scanStep,
                fallbackScanStep,
                edgeClearance,
                scoreRadius,
                adjacencyThreshold
        );
    }
}
