package com.floorplanner.backend.modules.layout.domain;

public record Door(double x, double y, double width, String kind) {

    public static final String ENTRY = "entry";
}
