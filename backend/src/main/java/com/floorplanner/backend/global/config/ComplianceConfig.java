package com.floorplanner.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.floorplanner.backend.modules.compliance.domain.BuildingCodes;

/**
 * Building code minimums. Defaults follow the International Residential Code values the rules cite.
 */
@Configuration
public class ComplianceConfig {

    @Value("${app.compliance.bedroom-min-area:70}")
    private double bedroomMinArea;

    @Value("${app.compliance.bathroom-min-area:35}")
    private double bathroomMinArea;

    @Value("${app.compliance.kitchen-min-area:50}")
    private double kitchenMinArea;

    @Value("${app.compliance.living-min-area:120}")
    private double livingMinArea;

    @Value("${app.compliance.hallway-min-width:3}")
    private double hallwayMinWidth;

    @Value("${app.compliance.egress-window-min-area:5.7}")
    private double egressWindowMinArea;

    @Value("${app.compliance.max-aspect-ratio:3.0}")
    private double maxAspectRatio;

    @Value("${app.compliance.max-area-variance-percent:10}")
    private double maxAreaVariancePercent;

    @Value("${app.compliance.min-efficiency-percent:75}")
    private double minEfficiencyPercent;

    @Bean
    public BuildingCodes buildingCodes() {
        return new BuildingCodes(
                bedroomMinArea,
                bathroomMinArea,
                kitchenMinArea,
                livingMinArea,
                hallwayMinWidth,
                egressWindowMinArea,
                maxAspectRatio,
                maxAreaVariancePercent,
                minEfficiencyPercent
        );
    }
}
