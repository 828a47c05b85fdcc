package com.floorplanner.backend.modules.layout.domain;

public record Footprint(double width, double depth) {

    public double area() {
        return width * depth;
    }
}
