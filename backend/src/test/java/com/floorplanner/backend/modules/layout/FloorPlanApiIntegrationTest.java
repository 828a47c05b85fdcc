package com.floorplanner.backend.modules.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@SpringBootTest
@AutoConfigureMockMvc
class FloorPlanApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void generateReturnsPlanAndValidation() throws Exception {
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "totalSqFt", 2000,
                                "bedrooms", 3,
                                "bathrooms", 2,
                                "style", "modern"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Floor plan generated successfully"))
                .andExpect(jsonPath("$.floorPlan.total_sqft").value(2000.0))
                .andExpect(jsonPath("$.floorPlan.lot_width").value(50.99))
                .andExpect(jsonPath("$.floorPlan.lot_depth").value(39.22))
                .andExpect(jsonPath("$.floorPlan.rooms.length()").value(8))
                .andExpect(jsonPath("$.floorPlan.rooms[0].name").value("Living Room"))
                .andExpect(jsonPath("$.floorPlan.rooms[0].type").value("living"))
                .andExpect(jsonPath("$.floorPlan.rooms[0].floor_level").value(1))
                .andExpect(jsonPath("$.floorPlan.stats.room_count").value(8))
                .andExpect(jsonPath("$.validation.compliance_score").isNumber())
                .andExpect(jsonPath("$.validation.violations[*].code").value(hasItem("IRC R311.2")))
                .andExpect(jsonPath("$.validation.compliant").value(false));
    }

    @Test
    void generateAcceptsSpecialRoomsInEitherCase() throws Exception {
        String body = """
                {"totalSqFt": 3000, "bedrooms": 3, "bathrooms": 2.5,
                 "specialRooms": {"office": true, "garage": true, "garage_cars": 3}}
                """;

        mockMvc.perform(post("/api/generate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.floorPlan.rooms[*].name").value(hasItem("3-Car Garage")))
                .andExpect(jsonPath("$.floorPlan.rooms[*].name").value(hasItem("Home Office")))
                .andExpect(jsonPath("$.floorPlan.rooms[*].name").value(hasItem("Half Bath")));
    }

    @Test
    void generateRejectsOutOfRangeInput() throws Exception {
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "totalSqFt", 100,
                                "bedrooms", 3,
                                "bathrooms", 2))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.errors.length()").value(1))
                .andExpect(jsonPath("$.errors[0]").value("totalSqFt must be between 500 and 20,000"));
    }

    @Test
    void generateRejectsMissingFields() throws Exception {
        mockMvc.perform(post("/api/generate").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors.length()").value(3))
                .andExpect(jsonPath("$.errors").value(hasItem("bedrooms is required and must be an integer")));
    }

    @Test
    void generateRejectsLotOutsideBounds() throws Exception {
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "totalSqFt", 2000,
                                "bedrooms", 3,
                                "bathrooms", 2,
                                "lotWidth", 0.000001,
                                "lotDepth", 100))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.errors.length()").value(1))
                .andExpect(jsonPath("$.errors[0]").value("lotWidth must be between 20 and 1,000"));
    }

    @Test
    void generateCompletesOnSmallestLotWithLargestArea() throws Exception {
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "totalSqFt", 20000,
                                "bedrooms", 10,
                                "bathrooms", 8,
                                "lot_width", 20,
                                "lot_depth", 20))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.floorPlan.lot_width").value(16.0))
                .andExpect(jsonPath("$.floorPlan.lot_depth").value(1251.0));
    }

    @Test
    void generateRejectsGarageWithoutCars() throws Exception {
        String request = """
                {"totalSqFt": 2000, "bedrooms": 3, "bathrooms": 2,
                 "specialRooms": {"garage": true, "garage_cars": 0}}
                """;

        mockMvc.perform(post("/api/generate").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0]").value("garageCars must be at least 1"));
    }

    @Test
    void validateRejectsNullRoomAndOpeningEntries() throws Exception {
        mockMvc.perform(post("/api/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"total_sqft\": 1000, \"rooms\": [null]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0]").value("rooms must not contain null entries"));

        String plan = """
                {"total_sqft": 500, "rooms": [
                  {"name": "Den", "type": "living", "x": 0, "y": 0, "width": 20, "height": 25, "area": 500,
                   "doors": [null], "windows": [null]}
                ]}
                """;
        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(plan))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors.length()").value(2))
                .andExpect(jsonPath("$.errors").value(hasItem("doors must not contain null entries")))
                .andExpect(jsonPath("$.errors").value(hasItem("windows must not contain null entries")));
    }

    @Test
    void generatedPlanCanBeValidatedAndAnalyzed() throws Exception {
        MvcResult generated = mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "totalSqFt", 2000,
                                "bedrooms", 3,
                                "bathrooms", 2))))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode root = objectMapper.readTree(generated.getResponse().getContentAsString());
        String plan = objectMapper.writeValueAsString(root.get("floorPlan"));

        MvcResult validated = mockMvc.perform(post("/api/validate").contentType(MediaType.APPLICATION_JSON).content(plan))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.report").value(containsString("BUILDING CODE COMPLIANCE REPORT")))
                .andReturn();
        JsonNode validation = objectMapper.readTree(validated.getResponse().getContentAsString()).get("validation");
        assertThat(validation).isEqualTo(root.get("validation"));

        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(plan))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.room_count").value(8))
                .andExpect(jsonPath("$.energyEfficiency.grade").isString())
                .andExpect(jsonPath("$.energyEfficiency.details.total_rooms").value(8))
                .andExpect(jsonPath("$.recommendations[0].priority").value("high"))
                .andExpect(jsonPath("$.overlaps").isNotEmpty());
    }

    @Test
    void validateRejectsUnknownRoomType() throws Exception {
        String plan = """
                {"total_sqft": 500, "rooms": [
                  {"name": "Ballroom", "type": "ballroom", "x": 0, "y": 0, "width": 20, "height": 25, "area": 500}
                ]}
                """;

        mockMvc.perform(post("/api/validate").contentType(MediaType.APPLICATION_JSON).content(plan))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("unknown_room_type"))
                .andExpect(jsonPath("$.detail").value("Unknown room type: ballroom"));
    }

    @Test
    void validateRequiresRooms() throws Exception {
        mockMvc.perform(post("/api/validate").contentType(MediaType.APPLICATION_JSON).content("{\"total_sqft\": 1000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("plan_required"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content("{\"rooms\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("malformed_request"));
    }

    @Test
    void healthEndpointsReportStatusAndEchoRequestId() throws Exception {
        mockMvc.perform(get("/api/health").header("X-Request-Id", "health-check-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "health-check-1"))
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.features.code_validation").value(true));

        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));

        mockMvc.perform(get("/readyz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").isString())
                .andExpect(jsonPath("$.timestamp").isString());
    }
}
