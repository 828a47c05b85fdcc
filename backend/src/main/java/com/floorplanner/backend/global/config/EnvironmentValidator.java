package com.floorplanner.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.compliance.domain.BuildingCodes;
import com.floorplanner.backend.modules.layout.application.LayoutSettings;

/**
 * Checks required properties and layout/compliance tunables once the application is ready.
 * Start-up fails when anything is missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "app.cors.allowed-origins",
            "server.port"
    };

    private final Environment environment;
    private final LayoutSettings layoutSettings;
    private final BuildingCodes buildingCodes;

    public EnvironmentValidator(Environment environment, LayoutSettings layoutSettings, BuildingCodes buildingCodes) {
        this.environment = environment;
        this.layoutSettings = layoutSettings;
        this.buildingCodes = buildingCodes;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missing.add(property);
            }
        }

        List<String> invalid = new ArrayList<>();
        invalid.addAll(invalidLayoutSettings(layoutSettings));
        invalid.addAll(invalidBuildingCodes(buildingCodes));

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            if (!missing.isEmpty()) {
                log.error("Missing required properties: {}", String.join(", ", missing));
            }
            invalid.forEach(message -> log.error("Invalid property {}", message));
            throw new IllegalStateException("Environment validation failed: "
                    + missing.size() + " missing, " + invalid.size() + " invalid");
        }

        log.info("Environment validation passed (grid {} ft, min room {} sq ft)",
                layoutSettings.gridSize(), layoutSettings.minRoomSize());
    }

    static List<String> invalidLayoutSettings(LayoutSettings settings) {
        List<String> invalid = new ArrayList<>();
        requirePositive(invalid, "app.layout.min-room-size", settings.minRoomSize());
        requirePositive(invalid, "app.layout.grid-size", settings.gridSize());
        requireNonNegative(invalid, "app.layout.placement-margin", settings.placementMargin());
        requirePositive(invalid, "app.layout.scan-step", settings.scanStep());
        requirePositive(invalid, "app.layout.fallback-scan-step", settings.fallbackScanStep());
        requireNonNegative(invalid, "app.layout.edge-clearance", settings.edgeClearance());
        requirePositive(invalid, "app.layout.score-radius", settings.scoreRadius());
        requirePositive(invalid, "app.layout.adjacency-threshold", settings.adjacencyThreshold());
        return invalid;
    }

    static List<String> invalidBuildingCodes(BuildingCodes codes) {
        List<String> invalid = new ArrayList<>();
        requirePositive(invalid, "app.compliance.bedroom-min-area", codes.bedroomMinArea());
        requirePositive(invalid, "app.compliance.bathroom-min-area", codes.bathroomMinArea());
        requirePositive(invalid, "app.compliance.kitchen-min-area", codes.kitchenMinArea());
        requirePositive(invalid, "app.compliance.living-min-area", codes.livingMinArea());
        requirePositive(invalid, "app.compliance.hallway-min-width", codes.hallwayMinWidth());
        requirePositive(invalid, "app.compliance.egress-window-min-area", codes.egressWindowMinArea());
        if (codes.maxAspectRatio() < 1) {
            invalid.add("app.compliance.max-aspect-ratio: must be at least 1");
        }
        requireNonNegative(invalid, "app.compliance.max-area-variance-percent", codes.maxAreaVariancePercent());
        if (codes.minEfficiencyPercent() < 0 || codes.minEfficiencyPercent() > 100) {
            invalid.add("app.compliance.min-efficiency-percent: must be between 0 and 100");
        }
        return invalid;
    }

    private static void requirePositive(List<String> invalid, String property, double value) {
        if (!(value > 0)) {
            invalid.add(property + ": must be greater than 0");
        }
    }

    private static void requireNonNegative(List<String> invalid, String property, double value) {
        if (!(value >= 0)) {
            invalid.add(property + ": must not be negative");
        }
    }
}
