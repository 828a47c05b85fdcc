package com.floorplanner.backend.modules.layout.application;

import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.BATHROOMS;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.BEDROOMS;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.CIRCULATION;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.DINING;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.KITCHEN;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.LIVING;
import static com.floorplanner.backend.modules.layout.domain.AllocationCategory.STORAGE;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.floorplanner.backend.modules.layout.domain.AllocationCategory;
import com.floorplanner.backend.modules.layout.domain.Orientation;
import com.floorplanner.backend.modules.layout.domain.RoomType;

/**
 * Static design tables keyed by room type. Built once when the class loads and never mutated,
 * so it is safe to share between concurrent requests.
 */
public final class ArchitecturalKnowledge {

    public static final int DEFAULT_ADJACENCY_PREFERENCE = 5;
    public static final double DEFAULT_ASPECT_RATIO = 1.2;
    public static final String DEFAULT_STYLE = "modern";

    private static final Map<RoomType, Map<RoomType, Integer>> ADJACENCY = buildAdjacency();
    private static final Map<RoomType, List<Orientation>> ORIENTATIONS = buildOrientations();
    private static final Map<RoomType, Double> ASPECT_RATIOS = buildAspectRatios();
    private static final Map<RoomType, Integer> PRIORITIES = buildPriorities();
    private static final Map<RoomType, String> COLORS = buildColors();
    private static final Map<String, Map<AllocationCategory, Double>> STYLE_SHARES = buildStyleShares();

    private ArchitecturalKnowledge() {
    }

    public static int adjacencyPreference(RoomType type, RoomType neighbour) {
        return ADJACENCY.getOrDefault(type, Map.of()).getOrDefault(neighbour, DEFAULT_ADJACENCY_PREFERENCE);
    }

    public static List<Orientation> preferredOrientations(RoomType type) {
        return ORIENTATIONS.getOrDefault(type, List.of(Orientation.SOUTH));
    }

    public static double idealAspectRatio(RoomType type) {
        return ASPECT_RATIOS.getOrDefault(type, DEFAULT_ASPECT_RATIO);
    }

    public static int placementPriority(RoomType type) {
        return PRIORITIES.getOrDefault(type, 5);
    }

    public static String color(RoomType type) {
        return COLORS.getOrDefault(type, "#ffffff");
    }

    public static boolean isKnownStyle(String style) {
        return style != null && STYLE_SHARES.containsKey(style.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Base shares for a style; unknown or blank styles resolve to {@value #DEFAULT_STYLE}.
     * The returned map is a fresh copy the caller may adjust.
     */
    public static EnumMap<AllocationCategory, Double> styleShares(String style) {
        String key = isKnownStyle(style) ? style.trim().toLowerCase(Locale.ROOT) : DEFAULT_STYLE;
        return new EnumMap<>(STYLE_SHARES.get(key));
    }

    private static Map<RoomType, Map<RoomType, Integer>> buildAdjacency() {
        Map<RoomType, Map<RoomType, Integer>> matrix = new EnumMap<>(RoomType.class);
        matrix.put(RoomType.LIVING, preferences(Map.of(
                RoomType.DINING, 10, RoomType.KITCHEN, 8, RoomType.OFFICE, 6, RoomType.BEDROOM, 2, RoomType.GARAGE, 3)));
        matrix.put(RoomType.KITCHEN, preferences(Map.of(
                RoomType.DINING, 10, RoomType.LIVING, 8, RoomType.PANTRY, 9, RoomType.GARAGE, 6, RoomType.BEDROOM, 1)));
        matrix.put(RoomType.MASTER_BEDROOM, preferences(Map.of(
                RoomType.MASTER_BATHROOM, 10, RoomType.LIVING, 2, RoomType.KITCHEN, 1)));
        matrix.put(RoomType.BEDROOM, preferences(Map.of(
                RoomType.BATHROOM, 8, RoomType.HALLWAY, 7, RoomType.LIVING, 2, RoomType.KITCHEN, 1)));
        matrix.put(RoomType.GARAGE, preferences(Map.of(
                RoomType.MUDROOM, 10, RoomType.LAUNDRY, 8, RoomType.KITCHEN, 6, RoomType.BEDROOM, 1)));
        return Collections.unmodifiableMap(matrix);
    }

    private static Map<RoomType, Integer> preferences(Map<RoomType, Integer> row) {
        return Collections.unmodifiableMap(new EnumMap<>(row));
    }

    private static Map<RoomType, List<Orientation>> buildOrientations() {
        Map<RoomType, List<Orientation>> table = new EnumMap<>(RoomType.class);
        table.put(RoomType.LIVING, List.of(Orientation.SOUTH, Orientation.SOUTHWEST));
        table.put(RoomType.KITCHEN, List.of(Orientation.EAST, Orientation.SOUTHEAST));
        table.put(RoomType.MASTER_BEDROOM, List.of(Orientation.EAST, Orientation.NORTHEAST));
        table.put(RoomType.BEDROOM, List.of(Orientation.EAST, Orientation.NORTHEAST));
        table.put(RoomType.DINING, List.of(Orientation.SOUTH, Orientation.EAST));
        table.put(RoomType.OFFICE, List.of(Orientation.NORTH, Orientation.NORTHEAST));
        table.put(RoomType.BATHROOM, List.of(Orientation.NORTH, Orientation.WEST));
        table.put(RoomType.GARAGE, List.of(Orientation.NORTH, Orientation.NORTHWEST));
        return Collections.unmodifiableMap(table);
    }

    private static Map<RoomType, Double> buildAspectRatios() {
        Map<RoomType, Double> table = new EnumMap<>(RoomType.class);
        table.put(RoomType.LIVING, 1.5);
        table.put(RoomType.KITCHEN, 1.3);
        table.put(RoomType.DINING, 1.4);
        table.put(RoomType.BEDROOM, 1.2);
        table.put(RoomType.MASTER_BEDROOM, 1.3);
        table.put(RoomType.BATHROOM, 1.1);
        table.put(RoomType.OFFICE, 1.2);
        // long and narrow
        table.put(RoomType.GARAGE, 2.0);
        return Collections.unmodifiableMap(table);
    }

    private static Map<RoomType, Integer> buildPriorities() {
        Map<RoomType, Integer> table = new EnumMap<>(RoomType.class);
        table.put(RoomType.LIVING, 10);
        table.put(RoomType.KITCHEN, 9);
        table.put(RoomType.MASTER_BEDROOM, 8);
        table.put(RoomType.DINING, 7);
        table.put(RoomType.MASTER_BATHROOM, 7);
        table.put(RoomType.GARAGE, 6);
        table.put(RoomType.OFFICE, 6);
        table.put(RoomType.BEDROOM, 5);
        table.put(RoomType.TEMPLE, 5);
        table.put(RoomType.BATHROOM, 4);
        table.put(RoomType.LAUNDRY, 3);
        return Collections.unmodifiableMap(table);
    }

    private static Map<RoomType, String> buildColors() {
        Map<RoomType, String> table = new EnumMap<>(RoomType.class);
        table.put(RoomType.LIVING, "#a8d5ff");
        table.put(RoomType.DINING, "#ffd9a8");
        table.put(RoomType.KITCHEN, "#ffb6a8");
        table.put(RoomType.BEDROOM, "#c8ffc8");
        table.put(RoomType.MASTER_BEDROOM, "#b3ffb3");
        table.put(RoomType.BATHROOM, "#e6d5ff");
        table.put(RoomType.MASTER_BATHROOM, "#d4bdff");
        table.put(RoomType.OFFICE, "#fff4a8");
        table.put(RoomType.GARAGE, "#d4d4d4");
        table.put(RoomType.LAUNDRY, "#c4e5f4");
        table.put(RoomType.HALLWAY, "#f5f5f5");
        table.put(RoomType.STORAGE, "#e0e0e0");
        table.put(RoomType.PANTRY, "#ffe4cc");
        table.put(RoomType.MUDROOM, "#e8dcc4");
        table.put(RoomType.TEMPLE, "#fff0e6");
        return Collections.unmodifiableMap(table);
    }

    private static Map<String, Map<AllocationCategory, Double>> buildStyleShares() {
        Map<String, Map<AllocationCategory, Double>> styles = new LinkedHashMap<>();
        styles.put("modern", shares(0.25, 0.15, 0.10, 0.30, 0.10, 0.08, 0.02));
        styles.put("traditional", shares(0.22, 0.12, 0.12, 0.32, 0.12, 0.08, 0.02));
        styles.put("ranch", shares(0.28, 0.16, 0.08, 0.28, 0.10, 0.08, 0.02));
        styles.put("luxury", shares(0.30, 0.18, 0.10, 0.25, 0.12, 0.03, 0.02));
        return Collections.unmodifiableMap(styles);
    }

    private static Map<AllocationCategory, Double> shares(
            double living, double kitchen, double dining, double bedrooms,
            double bathrooms, double circulation, double storage
    ) {
        Map<AllocationCategory, Double> shares = new EnumMap<>(AllocationCategory.class);
        shares.put(LIVING, living);
        shares.put(KITCHEN, kitchen);
        shares.put(DINING, dining);
        shares.put(BEDROOMS, bedrooms);
        shares.put(BATHROOMS, bathrooms);
        shares.put(CIRCULATION, circulation);
        shares.put(STORAGE, storage);
        return Collections.unmodifiableMap(shares);
    }
}
