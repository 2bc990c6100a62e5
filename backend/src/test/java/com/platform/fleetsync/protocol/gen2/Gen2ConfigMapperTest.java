package com.platform.fleetsync.protocol.gen2;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class Gen2ConfigMapperTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void toCanonical_mapsSysWifiMqttAndSwitches() throws Exception {
        ObjectNode config = (ObjectNode) mapper.readTree("{"
            + "\"sys\":{\"device\":{\"name\":\"kitchen\",\"mac\":\"A8032AB12345\"},\"location\":{\"tz\":\"Europe/Sofia\",\"lat\":42.7,\"lon\":23.3}},"
            + "\"wifi\":{\"sta\":{\"enable\":true,\"ssid\":\"iot\",\"ipv4mode\":\"dhcp\"}},"
            + "\"mqtt\":{\"enable\":true,\"server\":\"broker.local:1884\",\"user\":\"dev\"},"
            + "\"switch:0\":{\"name\":\"pump\",\"initial_state\":\"restore_last\",\"auto_off\":true,\"auto_off_delay\":60}}");

        ObjectNode canonical = Gen2ConfigMapper.toCanonical(config);

        assertThat(canonical.path("system").path("device").path("name").asText()).isEqualTo("kitchen");
        assertThat(canonical.path("location").path("lng").asDouble()).isEqualTo(23.3);
        assertThat(canonical.path("wifi").path("ssid").asText()).isEqualTo("iot");
        assertThat(canonical.path("mqtt").path("server").asText()).isEqualTo("broker.local");
        assertThat(canonical.path("mqtt").path("port").asInt()).isEqualTo(1884);
        assertThat(canonical.path("relay").path("relays").get(0).path("default_state").asText()).isEqualTo("last");
        assertThat(canonical.path("relay").path("default_state").asText()).isEqualTo("last");
        assertThat(canonical.path("relay").path("auto_off").asInt()).isEqualTo(60);
    }

    @Test
    void toCalls_buildsOneCallPerComponent() throws Exception {
        ObjectNode canonical = (ObjectNode) mapper.readTree("{"
            + "\"system\":{\"device\":{\"name\":\"kitchen\"}},"
            + "\"relay\":{\"relays\":[{\"id\":0,\"default_state\":\"switch\",\"auto_on\":0}]},"
            + "\"mqtt\":{\"server\":\"broker.local\",\"port\":1883,\"password\":\"pw\"}}");

        List<Gen2ConfigMapper.RpcCall> calls = Gen2ConfigMapper.toCalls(canonical);

        assertThat(calls).extracting(Gen2ConfigMapper.RpcCall::method)
            .containsExactly("Sys.SetConfig", "Switch.SetConfig", "MQTT.SetConfig");
        ObjectNode switchConfig = (ObjectNode) calls.get(1).params().path("config");
        assertThat(switchConfig.path("initial_state").asText()).isEqualTo("match_input");
        assertThat(switchConfig.path("auto_on").asBoolean()).isFalse();
        assertThat(calls.get(1).params().path("id").asInt()).isZero();
        assertThat(calls.get(2).params().path("config").path("server").asText()).isEqualTo("broker.local:1883");
        assertThat(calls.get(2).params().path("config").path("pass").asText()).isEqualTo("pw");
    }

    @Test
    void initialStateNames_translateBothWays() {
        assertThat(Gen2ConfigMapper.toInitialState(Gen2ConfigMapper.fromInitialState("restore_last")))
            .isEqualTo("restore_last");
        assertThat(Gen2ConfigMapper.fromInitialState("off")).isEqualTo("off");
    }
}
