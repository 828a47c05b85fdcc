package com.floorplanner.backend.modules.layout.domain;

public record SpecialRooms(boolean office, boolean laundry, boolean garage, int garageCars, boolean temple) {

    public static final int DEFAULT_GARAGE_CARS = 2;

    public SpecialRooms {
        if (garage && garageCars < 1) {
            throw new IllegalArgumentException("garageCars must be at least 1 when a garage is requested");
        }
    }

    public static SpecialRooms none() {
        return new SpecialRooms(false, false, false, DEFAULT_GARAGE_CARS, false);
    }
}
