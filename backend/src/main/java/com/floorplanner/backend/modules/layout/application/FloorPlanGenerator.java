package com.floorplanner.backend.modules.layout.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Footprint;
import com.floorplanner.backend.modules.layout.domain.GeneratedPlan;
import com.floorplanner.backend.modules.layout.domain.GenerationRequest;
import com.floorplanner.backend.modules.layout.domain.Placement;
import com.floorplanner.backend.modules.layout.domain.PlacementStrategy;
import com.floorplanner.backend.modules.layout.domain.Room;
import com.floorplanner.backend.modules.layout.domain.RoomRequest;
import com.floorplanner.backend.modules.layout.domain.SpaceAllocation;

/**
 * Runs the layout pipeline: allocation, room list, envelope, placement, adjacency, openings.
 * Inputs are trusted to be range-checked by the caller.
 */
@Service
public class FloorPlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(FloorPlanGenerator.class);

    private final SpaceAllocationPlanner allocationPlanner;
    private final RoomListGenerator roomListGenerator;
    private final BuildingEnvelopeCalculator envelopeCalculator;
    private final SpatialPlacementEngine placementEngine;
    private final AdjacencyAnnotator adjacencyAnnotator;
    private final OpeningPlacer openingPlacer;

    public FloorPlanGenerator(
            SpaceAllocationPlanner allocationPlanner,
            RoomListGenerator roomListGenerator,
            BuildingEnvelopeCalculator envelopeCalculator,
            SpatialPlacementEngine placementEngine,
            AdjacencyAnnotator adjacencyAnnotator,
            OpeningPlacer openingPlacer
    ) {
        this.allocationPlanner = allocationPlanner;
        this.roomListGenerator = roomListGenerator;
        this.envelopeCalculator = envelopeCalculator;
        this.placementEngine = placementEngine;
        this.adjacencyAnnotator = adjacencyAnnotator;
        this.openingPlacer = openingPlacer;
    }

    public static FloorPlanGenerator withSettings(LayoutSettings settings) {
        return new FloorPlanGenerator(
                new SpaceAllocationPlanner(),
                new RoomListGenerator(),
                new BuildingEnvelopeCalculator(),
                new SpatialPlacementEngine(settings),
                new AdjacencyAnnotator(settings),
                new OpeningPlacer()
        );
    }

    public GeneratedPlan generate(GenerationRequest request) {
        SpaceAllocation allocation = allocationPlanner.allocate(
                request.totalSqFt(), request.bedroomCount(), request.bathroomCount(), request.style());
        List<RoomRequest> roomRequests = roomListGenerator.generate(
                allocation, request.bedroomCount(), request.bathroomCount(), request.specialRooms());
        Footprint footprint = envelopeCalculator.calculate(request.totalSqFt(), request.lotSize());

        List<Placement> placements = placementEngine.place(roomRequests, footprint);
        Map<String, PlacementStrategy> strategies = new LinkedHashMap<>();
        placements.forEach(placement -> strategies.put(placement.room().name(), placement.strategy()));

        List<Room> rooms = placements.stream().map(Placement::room).toList();
        rooms = adjacencyAnnotator.annotate(rooms);
        rooms = openingPlacer.addOpenings(rooms);

        FloorPlan plan = new FloorPlan(
                request.totalSqFt(),
                rooms,
                request.bedroomCount(),
                request.bathroomCount(),
                1,
                request.style(),
                footprint.width(),
                footprint.depth()
        );
        GeneratedPlan generated = new GeneratedPlan(plan, strategies);

        List<String> defaulted = generated.roomNamesPlacedBy(PlacementStrategy.DEFAULT_POSITION);
        if (!defaulted.isEmpty()) {
            log.warn("{} of {} rooms fell back to the default position and may overlap: {}",
                    defaulted.size(), rooms.size(), defaulted);
        }
        log.info("Generated {} plan: {} sq ft, {} rooms, footprint {}x{}",
                plan.style(), request.totalSqFt(), rooms.size(), footprint.width(), footprint.depth());
        return generated;
    }
}
