package com.platform.fleetsync.protocol.gen2;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.error.DeviceAuthException;
import com.platform.fleetsync.error.DeviceProtocolException;
import com.platform.fleetsync.protocol.AbstractHttpDeviceClient;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.ComponentCommand;
import com.platform.fleetsync.protocol.ComponentType;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.DeviceInfo;
import com.platform.fleetsync.protocol.DeviceStatus;
import com.platform.fleetsync.protocol.Generation;
import com.platform.fleetsync.protocol.ProtocolProperties;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gen2 JSON-RPC client over {@code POST /rpc} with digest challenge-response auth.
 * 
 * A request is first sent without credentials. On 401 the challenge is
 * answered once; if the device reports a stale nonce the fresh challenge is
 * answered exactly once more. Any further 401 is an auth failure.
 */
@Slf4j
public class Gen2RpcClient extends AbstractHttpDeviceClient {
    
    private static final String RPC_PATH = "/rpc";
    
    private final DigestAuthenticator authenticator;
    private final AtomicInteger requestIds = new AtomicInteger();
    
    public Gen2RpcClient(String ip, DeviceCredential credential, HttpClient httpClient,
            ObjectMapper objectMapper, ProtocolProperties properties) {
        super(ip, credential, httpClient, objectMapper, properties);
        this.authenticator = credential != null ? new DigestAuthenticator(credential) : null;
    }
    
    @Override
    public Generation generation() {
        return Generation.GEN2;
    }
    
    @Override
    public DeviceInfo getInfo(CallContext ctx) {
        JsonNode info = rpc(ctx, "Shelly.GetDeviceInfo", null);
        return toDeviceInfo(info);
    }
    
    /**
     * Unauthenticated {@code GET /rpc/Shelly.GetDeviceInfo}, used for generation detection.
     */
    public DeviceInfo fetchDeviceInfo(CallContext ctx) {
        String operation = "get_device_info";
        HttpResponse<String> response = send(ctx, operation,
            request(ctx, RPC_PATH + "/Shelly.GetDeviceInfo").GET().build());
        if (response.statusCode() != 200) {
            throw DeviceProtocolException.unexpectedStatus(ip, 2, operation, response.statusCode(), null);
        }
        return toDeviceInfo(readJson(operation, response.body()));
    }
    
    private DeviceInfo toDeviceInfo(JsonNode info) {
        return DeviceInfo.builder()
            .id(textOrNull(info, "id"))
            .mac(textOrNull(info, "mac"))
            .model(textOrNull(info, "model"))
            .generation(info.path("gen").asInt(0))
            .firmware(textOrNull(info, "ver"))
            .app(textOrNull(info, "app"))
            .authEnabled(info.path("auth_en").asBoolean(false))
            .ip(ip)
            .build();
    }
    
    @Override
    public DeviceStatus getStatus(CallContext ctx) {
        JsonNode status = rpc(ctx, "Shelly.GetStatus", null);
        JsonNode sys = status.path("sys");
        JsonNode wifi = status.path("wifi");
        
        List<DeviceStatus.SwitchState> switches = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = status.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().startsWith("switch:")) {
                JsonNode sw = field.getValue();
                Double power = sw.has("apower") ? sw.get("apower").asDouble() : null;
                switches.add(new DeviceStatus.SwitchState(sw.path("id").asInt(), sw.path("output").asBoolean(false), power));
            }
        }
        switches.sort((a, b) -> Integer.compare(a.id(), b.id()));
        
        return DeviceStatus.builder()
            .ip(ip)
            .generation(2)
            .uptimeSeconds(sys.has("uptime") ? sys.get("uptime").asLong() : null)
            .temperature(sys.has("temp") ? sys.get("temp").asDouble() : null)
            .wifiConnected(wifi.hasNonNull("sta_ip"))
            .wifiSsid(textOrNull(wifi, "ssid"))
            .wifiRssi(wifi.has("rssi") ? wifi.get("rssi").asInt() : null)
            .switches(switches)
            .raw(status)
            .build();
    }
    
    @Override
    public JsonNode getConfiguration(CallContext ctx) {
        return rpc(ctx, "Shelly.GetConfig", null);
    }
    
    @Override
    protected void execute(CallContext ctx, ComponentCommand command) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("id", command.channel());
        String method;
        switch (command.type()) {
            case SWITCH, LIGHT -> {
                String prefix = command.type() == ComponentType.SWITCH ? "Switch" : "Light";
                if ("toggle".equals(command.action())) {
                    method = prefix + ".Toggle";
                } else {
                    method = prefix + ".Set";
                    params.put("on", "on".equals(command.action()));
                    if (command.level() != null) {
                        params.put("brightness", command.level());
                    }
                }
            }
            case COVER -> {
                switch (command.action()) {
                    case "open" -> method = "Cover.Open";
                    case "close" -> method = "Cover.Close";
                    case "stop" -> method = "Cover.Stop";
                    default -> {
                        method = "Cover.GoToPosition";
                        params.put("pos", command.level());
                    }
                }
            }
            default -> throw new IllegalStateException("Unhandled component " + command.type());
        }
        rpc(ctx, method, params);
    }
    
    @Override
    public void reboot(CallContext ctx) {
        rpc(ctx, "Shelly.Reboot", null);
    }
    
    /**
     * {@code Shelly.GetStatus} requires auth when the device has it enabled.
     */
    @Override
    public void testConnection(CallContext ctx) {
        rpc(ctx, "Shelly.GetStatus", null);
    }
    
    @Override
    public void applyConfiguration(CallContext ctx, ObjectNode canonicalConfig) {
        List<Gen2ConfigMapper.RpcCall> calls = Gen2ConfigMapper.toCalls(canonicalConfig);
        for (Gen2ConfigMapper.RpcCall call : calls) {
            rpc(ctx, call.method(), call.params());
        }
        log.debug("Applied {} config calls to {}", calls.size(), ip);
    }
    
    /**
     * Perform one RPC call and return its {@code result}.
     */
    JsonNode rpc(CallContext ctx, String method, ObjectNode params) {
        String body = requestBody(method, params);
        
        HttpResponse<String> response = post(ctx, method, body, null);
        if (response.statusCode() == 401) {
            if (authenticator == null) {
                throw DeviceAuthException.required(ip, 2, method);
            }
            DigestChallenge challenge = challengeFrom(method, response);
            response = post(ctx, method, body, authenticator.authorize(challenge, "POST", RPC_PATH));
            
            if (response.statusCode() == 401) {
                DigestChallenge retry = challengeFrom(method, response);
                if (!retry.stale()) {
                    throw DeviceAuthException.rejected(ip, 2, method);
                }
                log.debug("Stale nonce from {} on {}, answering fresh challenge once", ip, method);
                response = post(ctx, method, body, authenticator.authorize(retry, "POST", RPC_PATH));
                if (response.statusCode() == 401) {
                    throw DeviceAuthException.rejected(ip, 2, method);
                }
            }
        }
        
        if (response.statusCode() != 200) {
            throw DeviceProtocolException.unexpectedStatus(ip, 2, method, response.statusCode(), response.body());
        }
        
        JsonNode envelope = readJson(method, response.body());
        JsonNode error = envelope.get("error");
        if (error != null && !error.isNull()) {
            int code = error.path("code").asInt(-1);
            if (code == 401) {
                throw DeviceAuthException.rejected(ip, 2, method);
            }
            throw DeviceProtocolException.rpcError(ip, method, code, error.path("message").asText(""));
        }
        JsonNode result = envelope.get("result");
        return result != null ? result : NullNode.getInstance();
    }
    
    private String requestBody(String method, ObjectNode params) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        if (params != null) {
            request.set("params", params);
        }
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize RPC request " + method, e);
        }
    }
    
    private HttpResponse<String> post(CallContext ctx, String method, String body, String authorization) {
        HttpRequest.Builder builder = request(ctx, RPC_PATH)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return send(ctx, method, builder.build());
    }
    
    private DigestChallenge challengeFrom(String method, HttpResponse<String> response) {
        String header = response.headers().firstValue("WWW-Authenticate").orElse(null);
        if (header == null) {
            throw DeviceProtocolException.malformed(ip, 2, method, "401 without WWW-Authenticate challenge", null);
        }
        try {
            return DigestChallenge.parse(header);
        } catch (IllegalArgumentException e) {
            throw DeviceProtocolException.malformed(ip, 2, method, "invalid digest challenge: " + e.getMessage(), e);
        }
    }
}
