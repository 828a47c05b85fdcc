package com.floorplanner.backend.modules.layout.domain;

public record Window(double x, double y, double width, double height, String kind) {

    public static final String EGRESS = "egress";
    public static final String PICTURE = "picture";
    public static final String CASEMENT = "casement";

    public double area() {
        return width * height;
    }

    public boolean isEgress() {
        return EGRESS.equals(kind);
    }
}
