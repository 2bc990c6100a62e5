package com.platform.fleetsync.protocol.gen2;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.protocol.CanonicalJson;
import com.platform.fleetsync.protocol.CanonicalJson.HostPort;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.platform.fleetsync.protocol.CanonicalJson.copy;
import static com.platform.fleetsync.protocol.CanonicalJson.object;
import static com.platform.fleetsync.protocol.CanonicalJson.objectOrNull;
import static com.platform.fleetsync.protocol.CanonicalJson.putGroup;

/**
 * Translates between {@code Shelly.GetConfig} and the canonical schema, and
 * from canonical configuration to {@code *.SetConfig} calls.
 */
public final class Gen2ConfigMapper {
    
    private static final List<String> RELAY_MIRROR = List.of("default_state", "auto_on", "auto_off");
    
    private Gen2ConfigMapper() {
    }
    
    public record RpcCall(String method, ObjectNode params) {
    }
    
    public static ObjectNode toCanonical(JsonNode config) {
        ObjectNode canonical = object();
        if (config == null || !config.isObject()) {
            return canonical;
        }
        
        ObjectNode sys = objectOrNull(config, "sys");
        if (sys != null) {
            ObjectNode sysDevice = objectOrNull(sys, "device");
            ObjectNode system = object();
            if (sysDevice != null) {
                ObjectNode device = object();
                copy(sysDevice, "name", device);
                copy(sysDevice, "eco_mode", device);
                copy(sysDevice, "discoverable", device);
                putGroup(system, "device", device);
                copy(sysDevice, "mac", system);
                copy(sysDevice, "fw_id", system);
            }
            putGroup(canonical, "system", system);
            
            ObjectNode sysLocation = objectOrNull(sys, "location");
            if (sysLocation != null) {
                ObjectNode location = object();
                copy(sysLocation, "tz", location);
                copy(sysLocation, "lat", location);
                copy(sysLocation, "lon", location, "lng");
                putGroup(canonical, "location", location);
            }
        }
        
        ObjectNode sta = objectOrNull(objectOrNull(config, "wifi"), "sta");
        if (sta != null) {
            ObjectNode wifi = object();
            copy(sta, "enable", wifi);
            copy(sta, "ssid", wifi);
            copy(sta, "ipv4mode", wifi);
            if ("static".equals(sta.path("ipv4mode").asText()) && sta.hasNonNull("ip")) {
                ObjectNode staticIp = object();
                copy(sta, "ip", staticIp);
                copy(sta, "netmask", staticIp);
                copy(sta, "gw", staticIp);
                copy(sta, "nameserver", staticIp);
                wifi.set("static_ip", staticIp);
            }
            putGroup(canonical, "wifi", wifi);
        }
        
        ObjectNode mqttSource = objectOrNull(config, "mqtt");
        if (mqttSource != null) {
            ObjectNode mqtt = object();
            copy(mqttSource, "enable", mqtt);
            if (mqttSource.hasNonNull("server")) {
                HostPort hostPort = CanonicalJson.splitHostPort(mqttSource.get("server").asText());
                mqtt.put("server", hostPort.host());
                if (hostPort.port() != null) {
                    mqtt.put("port", hostPort.port());
                }
            }
            copy(mqttSource, "user", mqtt);
            copy(mqttSource, "client_id", mqtt);
            putGroup(canonical, "mqtt", mqtt);
        }
        
        ObjectNode cloudSource = objectOrNull(config, "cloud");
        if (cloudSource != null) {
            ObjectNode cloud = object();
            copy(cloudSource, "enable", cloud);
            copy(cloudSource, "server", cloud);
            putGroup(canonical, "cloud", cloud);
        }
        
        putGroup(canonical, "relay", relay(components(config, "switch")));
        putGroup(canonical, "input", input(components(config, "input")));
        putGroup(canonical, "dimming", dimming(components(config, "light")));
        putGroup(canonical, "roller", roller(components(config, "cover")));
        
        return canonical;
    }
    
    /**
     * Collect {@code prefix:N} components ordered by N.
     */
    private static Map<Integer, JsonNode> components(JsonNode config, String prefix) {
        Map<Integer, JsonNode> found = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = config.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            String suffix = key.startsWith(prefix + ":") ? key.substring(prefix.length() + 1) : "";
            if (suffix.matches("\\d{1,3}")) {
                found.put(Integer.parseInt(suffix), entry.getValue());
            }
        }
        return found;
    }
    
    private static ObjectNode relay(Map<Integer, JsonNode> switches) {
        if (switches.isEmpty()) {
            return null;
        }
        ObjectNode relay = object();
        ArrayNode channels = relay.putArray("relays");
        for (Map.Entry<Integer, JsonNode> entry : switches.entrySet()) {
            JsonNode source = entry.getValue();
            ObjectNode channel = object();
            channel.put("id", entry.getKey());
            copy(source, "name", channel);
            if (source.hasNonNull("initial_state")) {
                channel.put("default_state", fromInitialState(source.get("initial_state").asText()));
            }
            if (source.has("auto_on")) {
                channel.put("auto_on", source.path("auto_on").asBoolean() ? source.path("auto_on_delay").asInt(0) : 0);
            }
            if (source.has("auto_off")) {
                channel.put("auto_off", source.path("auto_off").asBoolean() ? source.path("auto_off_delay").asInt(0) : 0);
            }
            if (entry.getKey() == 0) {
                copy(source, "power_limit", relay, "max_power_limit");
            }
            channels.add(channel);
        }
        CanonicalJson.mirrorFirstChannel(relay, RELAY_MIRROR);
        return relay;
    }
    
    private static ObjectNode input(Map<Integer, JsonNode> inputs) {
        if (inputs.isEmpty()) {
            return null;
        }
        ObjectNode input = object();
        ArrayNode channels = input.putArray("inputs");
        for (Map.Entry<Integer, JsonNode> entry : inputs.entrySet()) {
            ObjectNode channel = object();
            channel.put("id", entry.getKey());
            copy(entry.getValue(), "name", channel);
            copy(entry.getValue(), "type", channel);
            copy(entry.getValue(), "invert", channel, "inverted");
            channels.add(channel);
        }
        JsonNode first = channels.get(0);
        copy(first, "type", input);
        copy(first, "inverted", input);
        return input;
    }
    
    private static ObjectNode dimming(Map<Integer, JsonNode> lights) {
        if (lights.isEmpty()) {
            return null;
        }
        JsonNode first = lights.values().iterator().next();
        ObjectNode dimming = object();
        if (first.hasNonNull("initial_state")) {
            dimming.put("default_state", fromInitialState(first.get("initial_state").asText()));
        }
        copy(first.path("default"), "brightness", dimming, "default_brightness");
        copy(first, "transition_duration", dimming, "transition");
        JsonNode nightMode = first.get("night_mode");
        if (nightMode != null) {
            copy(nightMode, "enable", dimming, "night_mode");
        }
        return dimming;
    }
    
    private static ObjectNode roller(Map<Integer, JsonNode> covers) {
        if (covers.isEmpty()) {
            return null;
        }
        JsonNode first = covers.values().iterator().next();
        ObjectNode roller = object();
        copy(first, "maxtime_open", roller, "max_open_time");
        copy(first, "maxtime_close", roller, "max_close_time");
        copy(first, "swap_inputs", roller);
        copy(first, "in_mode", roller, "input_mode");
        copy(first, "power_limit", roller, "obstacle_power");
        JsonNode obstacle = first.get("obstacle_detection");
        if (obstacle != null) {
            copy(obstacle, "enable", roller, "obstacle_detection");
        }
        return roller;
    }
    
    static String fromInitialState(String initialState) {
        return switch (initialState) {
            case "restore_last" -> "last";
            case "match_input" -> "switch";
            default -> initialState;
        };
    }
    
    static String toInitialState(String defaultState) {
        return switch (defaultState) {
            case "last" -> "restore_last";
            case "switch" -> "match_input";
            default -> defaultState;
        };
    }
    
    /**
     * RPC calls that bring a Gen2 device to the given canonical configuration.
     */
    public static List<RpcCall> toCalls(ObjectNode canonical) {
        List<RpcCall> calls = new ArrayList<>();
        
        ObjectNode sysConfig = object();
        ObjectNode system = objectOrNull(canonical, "system");
        ObjectNode device = objectOrNull(system, "device");
        if (device != null) {
            ObjectNode target = object();
            copy(device, "name", target);
            copy(device, "eco_mode", target);
            copy(device, "discoverable", target);
            putGroup(sysConfig, "device", target);
        }
        ObjectNode location = objectOrNull(canonical, "location");
        if (location != null) {
            ObjectNode target = object();
            copy(location, "tz", target);
            copy(location, "lat", target);
            copy(location, "lng", target, "lon");
            putGroup(sysConfig, "location", target);
        }
        if (sysConfig.size() > 0) {
            calls.add(call("Sys.SetConfig", null, sysConfig));
        }
        
        for (ObjectNode channel : CanonicalJson.relayChannels(objectOrNull(canonical, "relay"))) {
            ObjectNode config = object();
            copy(channel, "name", config);
            if (channel.hasNonNull("default_state")) {
                config.put("initial_state", toInitialState(channel.get("default_state").asText()));
            }
            if (channel.hasNonNull("auto_on")) {
                int delay = channel.get("auto_on").asInt();
                config.put("auto_on", delay > 0);
                if (delay > 0) {
                    config.put("auto_on_delay", delay);
                }
            }
            if (channel.hasNonNull("auto_off")) {
                int delay = channel.get("auto_off").asInt();
                config.put("auto_off", delay > 0);
                if (delay > 0) {
                    config.put("auto_off_delay", delay);
                }
            }
            if (config.size() > 0) {
                calls.add(call("Switch.SetConfig", channel.path("id").asInt(), config));
            }
        }
        
        ObjectNode wifi = objectOrNull(canonical, "wifi");
        if (wifi != null) {
            ObjectNode sta = object();
            copy(wifi, "enable", sta);
            copy(wifi, "ssid", sta);
            copy(wifi, "password", sta, "pass");
            copy(wifi, "ipv4mode", sta);
            ObjectNode staticIp = objectOrNull(wifi, "static_ip");
            if (staticIp != null) {
                copy(staticIp, "ip", sta);
                copy(staticIp, "netmask", sta);
                copy(staticIp, "gw", sta);
                copy(staticIp, "nameserver", sta);
            }
            if (sta.size() > 0) {
                ObjectNode config = object();
                config.set("sta", sta);
                calls.add(call("WiFi.SetConfig", null, config));
            }
        }
        
        ObjectNode mqtt = objectOrNull(canonical, "mqtt");
        if (mqtt != null) {
            ObjectNode config = object();
            copy(mqtt, "enable", config);
            if (mqtt.hasNonNull("server")) {
                Integer port = mqtt.hasNonNull("port") ? mqtt.get("port").asInt() : null;
                config.put("server", new HostPort(mqtt.get("server").asText(), port).join());
            }
            copy(mqtt, "user", config);
            copy(mqtt, "password", config, "pass");
            copy(mqtt, "client_id", config);
            if (config.size() > 0) {
                calls.add(call("MQTT.SetConfig", null, config));
            }
        }
        
        ObjectNode cloud = objectOrNull(canonical, "cloud");
        if (cloud != null) {
            ObjectNode config = object();
            copy(cloud, "enable", config);
            copy(cloud, "server", config);
            if (config.size() > 0) {
                calls.add(call("Cloud.SetConfig", null, config));
            }
        }
        
        return calls;
    }
    
    private static RpcCall call(String method, Integer id, ObjectNode config) {
        ObjectNode params = object();
        if (id != null) {
            params.put("id", id);
        }
        params.set("config", config);
        return new RpcCall(method, params);
    }
}
