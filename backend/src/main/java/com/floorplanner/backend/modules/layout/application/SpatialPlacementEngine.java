package com.floorplanner.backend.modules.layout.application;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.layout.domain.Footprint;
import com.floorplanner.backend.modules.layout.domain.Orientation;
import com.floorplanner.backend.modules.layout.domain.Placement;
import com.floorplanner.backend.modules.layout.domain.PlacementStrategy;
import com.floorplanner.backend.modules.layout.domain.Room;
import com.floorplanner.backend.modules.layout.domain.RoomRequest;
import com.floorplanner.backend.modules.layout.domain.RoomType;

/**
 * Greedy placement of room rectangles inside a footprint.
 *
 * <p>Requests are handled in descending priority. Each room is sized from its ideal aspect ratio and
 * snapped to the layout grid, then scanned along the footprint edges its type prefers. Free candidates
 * are scored by how close they sit to already placed rooms the type likes being near. When no oriented
 * candidate is free a raster scan takes the first free cell, and as a last resort the room goes to the
 * default position even if that overlaps. Placement therefore never fails.
 *
 * <p>Scan bounds are truncated to whole feet before the exclusive upper limit is applied, so a
 * partial last step is never scanned.
 */
@Component
public class SpatialPlacementEngine {

    private static final Logger log = LoggerFactory.getLogger(SpatialPlacementEngine.class);

    static final int MAX_SCAN_POSITIONS = 1_000;

    private final LayoutSettings settings;

    public SpatialPlacementEngine(LayoutSettings settings) {
        this.settings = settings;
    }

    public List<Placement> place(List<RoomRequest> requests, Footprint footprint) {
        // List.sort is stable, ties keep request order
        List<RoomRequest> ordered = new ArrayList<>(requests);
        ordered.sort(Comparator.comparingInt(RoomRequest::priority).reversed());

        List<Rect> occupied = new ArrayList<>();
        List<Room> placedRooms = new ArrayList<>();
        List<Placement> placements = new ArrayList<>();

        for (RoomRequest request : ordered) {
            double area = Math.max(request.area(), settings.minRoomSize());
            double aspectRatio = ArchitecturalKnowledge.idealAspectRatio(request.type());

            double rawHeight = Math.sqrt(area / aspectRatio);
            double rawWidth = area / rawHeight;
            double width = snap(rawWidth);
            double height = snap(rawHeight);

            Candidate chosen = findBestPosition(request.type(), width, height, footprint, occupied, placedRooms);

            Room room = new Room(
                    request.name(),
                    request.type(),
                    chosen.x(),
                    chosen.y(),
                    width,
                    height,
                    width * height,
                    ArchitecturalKnowledge.color(request.type()),
                    chosen.orientation(),
                    1,
                    List.of(),
                    List.of(),
                    Set.of(),
                    request.priority()
            );
            placedRooms.add(room);
            occupied.add(new Rect(chosen.x(), chosen.y(), width, height));
            placements.add(new Placement(room, chosen.strategy()));
        }
        return placements;
    }

    double snap(double dimension) {
        double grid = settings.gridSize();
        return Math.floor(dimension / grid + 0.5) * grid;
    }

    Candidate findBestPosition(
            RoomType type,
            double width,
            double height,
            Footprint footprint,
            List<Rect> occupied,
            List<Room> placedRooms
    ) {
        Candidate best = null;
        double bestScore = -1;

        for (Orientation orientation : ArchitecturalKnowledge.preferredOrientations(type)) {
            for (double x : xPositions(orientation, width, footprint)) {
                for (double y : yPositions(orientation, height, footprint)) {
                    if (!isAvailable(x, y, width, height, occupied)) {
                        continue;
                    }
                    double score = positionScore(type, x, y, width, height, placedRooms);
                    if (score > bestScore) {
                        bestScore = score;
                        best = new Candidate(x, y, orientation, PlacementStrategy.PREFERRED_ORIENTATION);
                    }
                }
            }
        }

        if (best != null) {
            return best;
        }
        return firstAvailable(type, width, height, footprint, occupied);
    }

    private List<Double> xPositions(Orientation orientation, double width, Footprint footprint) {
        if (orientation.isSouthern() || orientation.isNorthern()) {
            return steps(settings.edgeClearance(), footprint.width() - width, settings.scanStep());
        }
        if (orientation == Orientation.EAST) {
            return List.of(settings.edgeClearance());
        }
        return List.of(footprint.width() - width - settings.edgeClearance());
    }

    private List<Double> yPositions(Orientation orientation, double height, Footprint footprint) {
        if (orientation.isSouthern()) {
            return List.of(settings.edgeClearance());
        }
        if (orientation.isNorthern()) {
            return List.of(footprint.depth() - height - settings.edgeClearance());
        }
        return steps(settings.edgeClearance(), footprint.depth() - height, settings.scanStep());
    }

    /**
     * Integer positions from {@code start} up to, but excluding, the truncated {@code limit}.
     * At most {@value #MAX_SCAN_POSITIONS} positions are returned.
     */
    static List<Double> steps(double start, double limit, int step) {
        List<Double> positions = new ArrayList<>();
        long end = (long) limit;
        for (long value = (long) start; value < end && positions.size() < MAX_SCAN_POSITIONS; value += step) {
            positions.add((double) value);
        }
        return positions;
    }

    boolean isAvailable(double x, double y, double width, double height, List<Rect> occupied) {
        double margin = settings.placementMargin();
        for (Rect other : occupied) {
            boolean separated = x + width + margin < other.x()
                    || x - margin > other.x() + other.width()
                    || y + height + margin < other.y()
                    || y - margin > other.y() + other.height();
            if (!separated) {
                return false;
            }
        }
        return true;
    }

    double positionScore(RoomType type, double x, double y, double width, double height, List<Room> placedRooms) {
        double centerX = x + width / 2;
        double centerY = y + height / 2;
        double radius = settings.scoreRadius();

        double score = 0;
        for (Room placed : placedRooms) {
            double distance = Math.hypot(centerX - placed.centerX(), centerY - placed.centerY());
            if (distance < radius) {
                int preference = ArchitecturalKnowledge.adjacencyPreference(type, placed.roomType());
                score += preference * (radius - distance) / radius;
            }
        }
        return score;
    }

    private Candidate firstAvailable(RoomType type, double width, double height, Footprint footprint, List<Rect> occupied) {
        int step = settings.fallbackScanStep();
        for (double y : steps(settings.edgeClearance(), footprint.depth() - height, step)) {
            for (double x : steps(settings.edgeClearance(), footprint.width() - width, step)) {
                if (isAvailable(x, y, width, height, occupied)) {
                    log.debug("No oriented position for {} ({}x{}), raster scan placed it at ({}, {})",
                            type.code(), width, height, x, y);
                    return new Candidate(x, y, Orientation.SOUTH, PlacementStrategy.RASTER_SCAN);
                }
            }
        }
        log.debug("No free position for {} ({}x{}) in {}x{} footprint, using default position",
                type.code(), width, height, footprint.width(), footprint.depth());
        double fallback = settings.edgeClearance();
        return new Candidate(fallback, fallback, Orientation.SOUTH, PlacementStrategy.DEFAULT_POSITION);
    }

    record Rect(double x, double y, double width, double height) {
    }

    record Candidate(double x, double y, Orientation orientation, PlacementStrategy strategy) {
    }
}
