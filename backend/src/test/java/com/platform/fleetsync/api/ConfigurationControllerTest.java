package com.platform.fleetsync.api;

import com.jayway.jsonpath.JsonPath;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.concurrent.atomic.AtomicInteger;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureTestDatabase
@AutoConfigureMockMvc
public class ConfigurationControllerTest {

    private static final AtomicInteger MACS = new AtomicInteger();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DeviceRepository deviceRepository;

    @Test
    void desiredConfig_mergesTemplatesAndOverride() throws Exception {
        Long deviceId = newDevice();
        Number a = template("cfg-relay-on", "{\"relay\": {\"default_state\": \"on\"}}");
        Number b = template("cfg-auto-off", "{\"relay\": {\"auto_off\": 30}}");

        mockMvc.perform(put("/api/devices/" + deviceId + "/config/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"template_ids\": [" + a + ", " + b + "]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.template_ids.length()").value(2));

        mockMvc.perform(get("/api/devices/" + deviceId + "/config/desired"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.config.relay.default_state").value("on"))
                .andExpect(jsonPath("$.config.relay.auto_off").value(30))
                .andExpect(jsonPath("$.sources['relay.default_state']").value("template:" + a));

        mockMvc.perform(put("/api/devices/" + deviceId + "/config/overrides")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"relay\": {\"default_state\": \"off\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.config.relay.default_state").value("off"))
                .andExpect(jsonPath("$.config.relay.auto_off").value(30))
                .andExpect(jsonPath("$.sources['relay.default_state']").value("override"));

        mockMvc.perform(delete("/api/devices/" + deviceId + "/config/overrides"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.config.relay.default_state").value("on"));
    }

    @Test
    void deleteTemplate_inUse_returnsConflict() throws Exception {
        Long deviceId = newDevice();
        Number id = template("cfg-in-use", "{\"led\": {\"power_indication\": true}}");

        mockMvc.perform(post("/api/devices/" + deviceId + "/config/templates/" + id))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/templates/" + id))
                .andExpect(status().isConflict());

        mockMvc.perform(delete("/api/devices/" + deviceId + "/config/templates/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.template_ids.length()").value(0));
        mockMvc.perform(delete("/api/templates/" + id))
                .andExpect(status().isNoContent());
    }

    @Test
    void overrides_withInvalidValue_returnsBadRequest() throws Exception {
        Long deviceId = newDevice();

        mockMvc.perform(put("/api/devices/" + deviceId + "/config/overrides")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mqtt\": {\"keep_alive\": 0}}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/devices/" + deviceId + "/config/overrides"))
                .andExpect(status().isOk())
                .andExpect(content().json("{}"));
    }

    @Test
    void desiredConfig_unknownDevice_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/devices/31337/config/desired"))
                .andExpect(status().isNotFound());
    }

    private Long newDevice() {
        int n = MACS.incrementAndGet();
        Device device = deviceRepository.save(Device.builder()
            .mac(String.format("C0FFEE%06X", n))
            .ip("192.0.2." + n)
            .name("config-test-" + n)
            .type("SHSW-1")
            .build());
        return device.getId();
    }

    private Number template(String name, String config) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"" + name + "\", \"config\": " + config + "}"))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
    }
}
