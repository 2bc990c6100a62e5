package com.platform.fleetsync.protocol.gen1;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.error.DeviceAuthException;
import com.platform.fleetsync.error.DeviceProtocolException;
import com.platform.fleetsync.protocol.AbstractHttpDeviceClient;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.ComponentCommand;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.DeviceInfo;
import com.platform.fleetsync.protocol.DeviceStatus;
import com.platform.fleetsync.protocol.Generation;
import com.platform.fleetsync.protocol.ProtocolProperties;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gen1 REST client. Credentials go out as HTTP Basic auth on every request.
 */
@Slf4j
public class Gen1BasicClient extends AbstractHttpDeviceClient {
    
    public Gen1BasicClient(String ip, DeviceCredential credential, HttpClient httpClient,
            ObjectMapper objectMapper, ProtocolProperties properties) {
        super(ip, credential, httpClient, objectMapper, properties);
    }
    
    @Override
    public Generation generation() {
        return Generation.GEN1;
    }
    
    @Override
    public DeviceInfo getInfo(CallContext ctx) {
        JsonNode shelly = get(ctx, "get_info", "/shelly");
        return DeviceInfo.builder()
            .type(textOrNull(shelly, "type"))
            .mac(textOrNull(shelly, "mac"))
            .firmware(textOrNull(shelly, "fw"))
            .authEnabled(shelly.path("auth").asBoolean(false))
            .generation(1)
            .ip(ip)
            .build();
    }
    
    @Override
    public DeviceStatus getStatus(CallContext ctx) {
        JsonNode status = get(ctx, "get_status", "/status");
        JsonNode wifi = status.path("wifi_sta");
        
        List<DeviceStatus.SwitchState> switches = new ArrayList<>();
        JsonNode relays = status.path("relays");
        JsonNode meters = status.path("meters");
        for (int i = 0; i < relays.size(); i++) {
            JsonNode meter = meters.path(i);
            Double power = meter.has("power") ? meter.get("power").asDouble() : null;
            switches.add(new DeviceStatus.SwitchState(i, relays.get(i).path("ison").asBoolean(false), power));
        }
        
        return DeviceStatus.builder()
            .ip(ip)
            .generation(1)
            .uptimeSeconds(status.has("uptime") ? status.get("uptime").asLong() : null)
            .temperature(status.has("temperature") ? status.get("temperature").asDouble() : null)
            .wifiConnected(wifi.path("connected").asBoolean(false))
            .wifiSsid(textOrNull(wifi, "ssid"))
            .wifiRssi(wifi.has("rssi") ? wifi.get("rssi").asInt() : null)
            .switches(switches)
            .raw(status)
            .build();
    }
    
    @Override
    public JsonNode getConfiguration(CallContext ctx) {
        return get(ctx, "get_configuration", "/settings");
    }
    
    @Override
    protected void execute(CallContext ctx, ComponentCommand command) {
        String path = switch (command.type()) {
            case SWITCH -> "/relay/" + command.channel() + "?turn=" + command.action();
            case LIGHT -> command.level() == null
                ? "/light/" + command.channel() + "?turn=" + command.action()
                : "/light/" + command.channel() + "?turn=on&brightness=" + command.level();
            case COVER -> "position".equals(command.action())
                ? "/roller/" + command.channel() + "?go=to_pos&roller_pos=" + command.level()
                : "/roller/" + command.channel() + "?go=" + command.action();
        };
        get(ctx, "set_" + command.type().name().toLowerCase(), path);
    }
    
    @Override
    public void reboot(CallContext ctx) {
        get(ctx, "reboot", "/reboot");
    }
    
    /**
     * {@code /status} is protected when login is enabled, unlike {@code /shelly}.
     */
    @Override
    public void testConnection(CallContext ctx) {
        get(ctx, "test_connection", "/status");
    }
    
    @Override
    public void applyConfiguration(CallContext ctx, ObjectNode canonicalConfig) {
        List<Gen1SettingsMapper.SettingsWrite> writes = Gen1SettingsMapper.toWrites(canonicalConfig);
        for (Gen1SettingsMapper.SettingsWrite write : writes) {
            get(ctx, "apply_configuration", write.path() + "?" + encode(write.params()));
        }
        log.debug("Applied {} settings writes to {}", writes.size(), ip);
    }
    
    private JsonNode get(CallContext ctx, String operation, String pathAndQuery) {
        HttpRequest.Builder builder = request(ctx, pathAndQuery).GET();
        if (credential != null) {
            String token = Base64.getEncoder().encodeToString(
                (credential.username() + ":" + credential.password()).getBytes(StandardCharsets.UTF_8));
            builder.header("Authorization", "Basic " + token);
        }
        
        HttpResponse<String> response = send(ctx, operation, builder.build());
        int status = response.statusCode();
        if (status == 401) {
            throw credential == null
                ? DeviceAuthException.required(ip, 1, operation)
                : DeviceAuthException.rejected(ip, 1, operation);
        }
        if (status < 200 || status >= 300) {
            throw DeviceProtocolException.unexpectedStatus(ip, 1, operation, status, response.body());
        }
        return readJson(operation, response.body());
    }
    
    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }
}
