package com.platform.fleetsync.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureTestDatabase
@AutoConfigureMockMvc
public class DeviceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void addDevice_withInvalidIp_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/devices")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ip\": \"999.1.1.1\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void addDevice_withScriptInName_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/devices")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ip\": \"10.0.0.5\", \"name\": \"<script>alert(1)</script>\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void control_withUnknownAction_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/devices/1/control")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\": \"explode\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getDevice_unknownId_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/devices/424242"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value(containsString("424242")));
    }

    @Test
    void discovery_withOversizedRange_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/discovery")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"range\": \"10.0.0.0/16\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("limit")));
    }
}
