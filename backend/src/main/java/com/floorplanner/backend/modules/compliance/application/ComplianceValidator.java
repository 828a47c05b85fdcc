package com.floorplanner.backend.modules.compliance.application;

import static com.floorplanner.backend.modules.compliance.domain.Violation.OVERALL_PLAN;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.floorplanner.backend.modules.compliance.domain.BuildingCodes;
import com.floorplanner.backend.modules.compliance.domain.ComplianceResult;
import com.floorplanner.backend.modules.compliance.domain.Violation;
import com.floorplanner.backend.modules.layout.domain.FloorPlan;
import com.floorplanner.backend.modules.layout.domain.Room;
import com.floorplanner.backend.modules.layout.domain.RoomType;
import com.floorplanner.backend.modules.layout.domain.Window;

/**
 * Evaluates a plan against dimensional and life-safety rules. Findings are returned as violations,
 * never thrown. Room geometry is taken as given; overlapping rooms are not checked here.
 */
@Component
public class ComplianceValidator {

    private static final Logger log = LoggerFactory.getLogger(ComplianceValidator.class);

    private static final Set<RoomType> EXTERIOR_DOOR_TYPES = EnumSet.of(RoomType.LIVING, RoomType.KITCHEN, RoomType.GARAGE);

    private final BuildingCodes codes;

    public ComplianceValidator(BuildingCodes codes) {
        this.codes = codes;
    }

    public ComplianceResult validate(FloorPlan plan) {
        List<Violation> violations = new ArrayList<>();
        for (Room room : plan.rooms()) {
            violations.addAll(validateRoom(room));
        }
        violations.addAll(validateOverallPlan(plan));
        violations.addAll(validateEgress(plan));
        violations.addAll(validateCirculation(plan));

        ComplianceResult result = ComplianceResult.of(violations);
        log.debug("Validated plan with {} rooms: score={}, grade={}, violations={}",
                plan.roomCount(), result.complianceScore(), result.grade().label(), violations.size());
        return result;
    }

    List<Violation> validateRoom(Room room) {
        List<Violation> violations = new ArrayList<>();
        RoomType type = room.roomType();

        if (type.isBedroom() && room.area() < codes.bedroomMinArea()) {
            violations.add(Violation.critical(room.name(), "IRC R304.1",
                    "Bedroom area %s sq ft is below minimum %s sq ft".formatted(whole(room.area()), number(codes.bedroomMinArea())),
                    "Increase room area by %s sq ft".formatted(whole(codes.bedroomMinArea() - room.area()))));
        } else if (type.isBathroom() && room.area() < codes.bathroomMinArea()) {
            violations.add(Violation.critical(room.name(), "IRC R307",
                    "Bathroom area %s sq ft is below minimum %s sq ft".formatted(whole(room.area()), number(codes.bathroomMinArea())),
                    "Increase room area by %s sq ft".formatted(whole(codes.bathroomMinArea() - room.area()))));
        } else if (type == RoomType.KITCHEN && room.area() < codes.kitchenMinArea()) {
            violations.add(Violation.warning(room.name(), "IRC R305",
                    "Kitchen area %s sq ft is below recommended %s sq ft".formatted(whole(room.area()), number(codes.kitchenMinArea())),
                    "Consider increasing kitchen size by %s sq ft for better functionality"
                            .formatted(whole(codes.kitchenMinArea() - room.area()))));
        } else if (type == RoomType.LIVING && room.area() < codes.livingMinArea()) {
            violations.add(Violation.warning(room.name(), "Best Practice",
                    "Living room area %s sq ft is below recommended %s sq ft".formatted(whole(room.area()), number(codes.livingMinArea())),
                    "Consider adding %s sq ft of living space for comfort"
                            .formatted(whole(codes.livingMinArea() - room.area()))));
        }

        if (room.aspectRatio() > codes.maxAspectRatio()) {
            violations.add(Violation.info(room.name(), "Design Guideline",
                    "Room aspect ratio %s:1 is unusually narrow".formatted(oneDecimal(room.aspectRatio())),
                    "Consider more balanced proportions for better space utilization"));
        }

        if (type.isBedroom()) {
            violations.addAll(validateEgressWindows(room));
        }
        return violations;
    }

    private List<Violation> validateEgressWindows(Room room) {
        List<Window> egressWindows = room.windows().stream().filter(Window::isEgress).toList();
        if (egressWindows.isEmpty()) {
            return List.of(Violation.critical(room.name(), "IRC R310.1",
                    "Bedroom requires egress window for emergency escape",
                    "Add egress window with min %s sq ft opening".formatted(number(codes.egressWindowMinArea()))));
        }

        List<Violation> violations = new ArrayList<>();
        for (Window window : egressWindows) {
            double windowArea = window.area();
            if (windowArea < codes.egressWindowMinArea()) {
                violations.add(Violation.critical(room.name(), "IRC R310.2.1",
                        "Egress window %s sq ft is below minimum %s sq ft".formatted(oneDecimal(windowArea), number(codes.egressWindowMinArea())),
                        "Increase window size by %s sq ft".formatted(oneDecimal(codes.egressWindowMinArea() - windowArea))));
            }
        }
        return violations;
    }

    List<Violation> validateOverallPlan(FloorPlan plan) {
        List<Violation> violations = new ArrayList<>();

        double actualTotal = plan.totalArea();
        double claimedTotal = plan.totalSqFt();
        if (claimedTotal > 0) {
            double variance = Math.abs(actualTotal - claimedTotal) / claimedTotal * 100;
            if (variance > codes.maxAreaVariancePercent()) {
                violations.add(Violation.warning(OVERALL_PLAN, "Design Consistency",
                        "Total room area %s sq ft differs from target %s sq ft by %s%%"
                                .formatted(whole(actualTotal), whole(claimedTotal), oneDecimal(variance)),
                        "Adjust room sizes to match target square footage"));
            }
        }

        double efficiency = plan.efficiencyRatio();
        if (efficiency < codes.minEfficiencyPercent()) {
            violations.add(Violation.info(OVERALL_PLAN, "Space Efficiency",
                    "Space efficiency %s%% is below recommended %s%%".formatted(oneDecimal(efficiency), number(codes.minEfficiencyPercent())),
                    "Review circulation and storage areas to improve efficiency"));
        }

        long bedrooms = plan.bedroomRoomCount();
        if (bedrooms < plan.bedroomCount()) {
            violations.add(Violation.critical(OVERALL_PLAN, "Design Requirement",
                    "Plan has %d bedrooms but requires %d".formatted(bedrooms, plan.bedroomCount()),
                    "Add %d more bedroom(s)".formatted(plan.bedroomCount() - bedrooms)));
        }

        long bathrooms = plan.bathroomRoomCount();
        if (bathrooms < plan.bathroomCount()) {
            violations.add(Violation.critical(OVERALL_PLAN, "Design Requirement",
                    "Plan has %d bathrooms but requires %s".formatted(bathrooms, number(plan.bathroomCount())),
                    "Add %s more bathroom(s)".formatted(number(Math.ceil(plan.bathroomCount() - bathrooms)))));
        }
        return violations;
    }

    List<Violation> validateEgress(FloorPlan plan) {
        boolean hasExteriorDoor = plan.rooms().stream()
                .anyMatch(room -> EXTERIOR_DOOR_TYPES.contains(room.roomType()) && !room.doors().isEmpty());
        if (hasExteriorDoor) {
            return List.of();
        }
        return List.of(Violation.critical(OVERALL_PLAN, "IRC R311.2",
                "No clear egress door to exterior identified",
                "Ensure at least one exterior door for building exit"));
    }

    List<Violation> validateCirculation(FloorPlan plan) {
        List<Violation> violations = new ArrayList<>();
        List<Room> hallways = plan.roomsOfType(RoomType.HALLWAY);

        if (plan.bedroomRoomCount() > 2 && hallways.isEmpty()) {
            violations.add(Violation.info(OVERALL_PLAN, "Design Guideline",
                    "Multiple bedrooms without dedicated hallway circulation",
                    "Consider adding hallway for better privacy and access"));
        }

        for (Room hallway : hallways) {
            double narrowest = Math.min(hallway.width(), hallway.height());
            if (narrowest < codes.hallwayMinWidth()) {
                violations.add(Violation.critical(hallway.name(), "IRC R311.6",
                        "Hallway width %s ft is below minimum %s ft".formatted(oneDecimal(narrowest), number(codes.hallwayMinWidth())),
                        "Increase hallway width to at least %s ft".formatted(number(codes.hallwayMinWidth()))));
            }
        }
        return violations;
    }

    private static String whole(double value) {
        return String.format(Locale.ROOT, "%.0f", value);
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /**
     * Whole numbers without a fraction, anything else as written.
     */
    static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
