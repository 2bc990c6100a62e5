package com.platform.fleetsync.api;

import com.fasterxml.jackson.databind.node.TextNode;
import com.platform.fleetsync.drift.DriftKind;
import com.platform.fleetsync.drift.FieldDelta;
import com.platform.fleetsync.resolution.ResolutionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.jayway.jsonpath.JsonPath;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureTestDatabase
@AutoConfigureMockMvc
public class ResolutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ResolutionService resolutionService;

    @Test
    void createPolicy_withInvalidStrategy_returnsBadRequest() throws Exception {
        String payload = "{\"name\": \"bad\", \"category\": \"network\", \"strategy\": \"panic\"}";

        mockMvc.perform(post("/api/resolution/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
                .andExpect(status().isBadRequest());
    }

    @Test
    void approveRequest_pending_recordsDecision() throws Exception {
        mockMvc.perform(post("/api/resolution/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"restore-network\", \"category\": \"network\", \"strategy\": \"restore\","
                    + " \"priority\": \"high\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.enabled").value(true))
                .andExpect(jsonPath("$.priority").value("high"));

        int created = resolutionService.raiseRequests(501L, List.of(new FieldDelta("mqtt.server", DriftKind.CHANGED,
            TextNode.valueOf("broker.local"), TextNode.valueOf("rogue.local"), "network", "critical")));
        assertThat(created).isEqualTo(1);

        MvcResult listed = mockMvc.perform(get("/api/resolution/requests").param("device_id", "501"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].status").value("pending"))
                .andExpect(jsonPath("$[0].strategy").value("restore"))
                .andReturn();
        Number id = JsonPath.read(listed.getResponse().getContentAsString(), "$[0].id");

        mockMvc.perform(post("/api/resolution/requests/" + id + "/approve")
                .header(ApiHeaders.ACTOR, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"known broker move\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.decided_by").value("alice"))
                .andExpect(jsonPath("$.decision_reason").value("known broker move"))
                .andExpect(jsonPath("$.outcome").value("failed"))
                .andExpect(jsonPath("$.outcome_detail").value(startsWith("DEVICE_NOT_FOUND")));

        mockMvc.perform(post("/api/resolution/requests/" + id + "/reject"))
                .andExpect(status().isConflict());
    }

    @Test
    void raiseRequests_samePathTwice_keepsOnePending() throws Exception {
        mockMvc.perform(post("/api/resolution/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"restore-system\", \"category\": \"system\", \"strategy\": \"restore\"}"))
                .andExpect(status().isCreated());
        FieldDelta delta = new FieldDelta("system.device.name", DriftKind.CHANGED,
            TextNode.valueOf("kitchen"), TextNode.valueOf("shelly"), "system", "warning");

        assertThat(resolutionService.raiseRequests(502L, List.of(delta))).isEqualTo(1);
        assertThat(resolutionService.raiseRequests(502L, List.of(delta))).isZero();
    }

    @Test
    void raiseRequests_ignorePolicy_suppressesRequests() throws Exception {
        mockMvc.perform(post("/api/resolution/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"ignore-security\", \"category\": \"security\", \"strategy\": \"ignore\"}"))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/resolution/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"restore-security\", \"category\": \"security\", \"strategy\": \"restore\","
                    + " \"priority\": \"critical\"}"))
                .andExpect(status().isCreated());

        int created = resolutionService.raiseRequests(503L, List.of(new FieldDelta("auth.enable", DriftKind.MISSING,
            TextNode.valueOf("true"), null, "security", "critical")));

        assertThat(created).isZero();
    }

    @Test
    void getRequest_unknownId_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/resolution/requests/987654"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getMetrics_returnsCounts() throws Exception {
        mockMvc.perform(get("/api/resolution/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending_requests").isNumber())
                .andExpect(jsonPath("$.open_trends").isNumber());
    }
}
