package com.platform.fleetsync.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.jayway.jsonpath.JsonPath;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureTestDatabase
@AutoConfigureMockMvc
public class TemplateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void createTemplate_withValidConfig_returnsCreated() throws Exception {
        String payload = "{\"name\": \"relay-safe-default\", \"scope\": \"global\","
            + " \"config\": {\"relay\": {\"default_state\": \"off\"}}}";

        mockMvc.perform(post("/api/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("relay-safe-default"))
                .andExpect(jsonPath("$.device_type").value("all"))
                .andExpect(jsonPath("$.config.relay.default_state").value("off"));
    }

    @Test
    void createTemplate_withDuplicateName_returnsConflict() throws Exception {
        String payload = "{\"name\": \"mqtt-broker\", \"config\": {\"mqtt\": {\"server\": \"broker.local\"}}}";

        mockMvc.perform(post("/api/templates").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/templates").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isConflict());
    }

    @Test
    void createTemplate_withInvalidPort_returnsBadRequest() throws Exception {
        String payload = "{\"name\": \"bad-port\", \"config\": {\"mqtt\": {\"port\": 70000}}}";

        mockMvc.perform(post("/api/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("mqtt.port")));
    }

    @Test
    void createTemplate_withUnknownGroup_returnsBadRequest() throws Exception {
        String payload = "{\"name\": \"bad-group\", \"config\": {\"bluetooth\": {\"enable\": true}}}";

        mockMvc.perform(post("/api/templates").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isBadRequest());
    }

    @Test
    void createTemplate_forDeviceTypeScopeWithoutType_returnsBadRequest() throws Exception {
        String payload = "{\"name\": \"typed\", \"scope\": \"device_type\", \"config\": {}}";

        mockMvc.perform(post("/api/templates").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isBadRequest());
    }

    @Test
    void updateAndDeleteTemplate_roundTrip() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"led-off\", \"config\": {\"led\": {\"power_indication\": true}}}"))
                .andExpect(status().isCreated())
                .andReturn();
        Number id = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

        mockMvc.perform(put("/api/templates/" + id)
                .header(ApiHeaders.ACTOR, "ops")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"led-off\", \"config\": {\"led\": {\"power_indication\": false}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.config.led.power_indication").value(false));

        mockMvc.perform(delete("/api/templates/" + id))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/templates/" + id))
                .andExpect(status().isNotFound());
    }

    @Test
    void getTemplate_unknownId_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/templates/424242"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").exists());
    }
}
