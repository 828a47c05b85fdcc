package com.floorplanner.backend.modules.layout.presentation.dto;

import com.floorplanner.backend.modules.layout.domain.Window;

public record WindowPayload(double x, double y, double width, double height, String type) {

    public static WindowPayload from(Window window) {
        return new WindowPayload(
                PlanNumbers.round2(window.x()),
                PlanNumbers.round2(window.y()),
                PlanNumbers.round2(window.width()),
                PlanNumbers.round2(window.height()),
                window.kind()
        );
    }

    public Window toWindow() {
        return new Window(x, y, width, height, type);
    }
}
