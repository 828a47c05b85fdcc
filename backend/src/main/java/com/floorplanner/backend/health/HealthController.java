package com.floorplanner.backend.health;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;

/**
 * Service metadata plus liveness and readiness probes.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "Floor Plan Generator";

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;
    private final String version;

    public HealthController(
            HealthEndpoint healthEndpoint,
            Clock clock,
            @Value("${app.version:0.1.0}") String version
    ) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
        this.version = version;
    }

    @Operation(summary = "Service status and enabled features")
    @GetMapping("/api/health")
    public ServiceStatusResponse health() {
        return new ServiceStatusResponse(
                "healthy",
                SERVICE_NAME,
                version,
                Map.of(
                        "generation", true,
                        "code_validation", true,
                        "analysis", true
                )
        );
    }

    /**
     * Liveness: the process is up and serving requests.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    /**
     * Readiness, as reported by the actuator health endpoint.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            return new HealthResponse(healthComponent.getStatus().getCode(), Instant.now(clock).toString());
        } catch (RuntimeException e) {
            return new HealthResponse("DOWN", Instant.now(clock).toString());
        }
    }

    public record HealthResponse(
            String status,   // "UP" | "DOWN"
            String timestamp // ISO-8601 timestamp
    ) {
    }

    public record ServiceStatusResponse(
            String status,
            String service,
            String version,
            Map<String, Boolean> features
    ) {
    }
}
