package com.platform.fleetsync.protocol.gen1;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.protocol.CanonicalJson;
import com.platform.fleetsync.protocol.CanonicalJson.HostPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.platform.fleetsync.protocol.CanonicalJson.copy;
import static com.platform.fleetsync.protocol.CanonicalJson.copyInverted;
import static com.platform.fleetsync.protocol.CanonicalJson.object;
import static com.platform.fleetsync.protocol.CanonicalJson.objectOrNull;
import static com.platform.fleetsync.protocol.CanonicalJson.putGroup;
import static com.platform.fleetsync.protocol.CanonicalJson.putParam;

/**
 * Translates between the Gen1 {@code /settings} document and the canonical schema.
 */
public final class Gen1SettingsMapper {
    
    private static final List<String> RELAY_MIRROR = List.of("default_state", "auto_on", "auto_off", "btn_type");
    
    private Gen1SettingsMapper() {
    }
    
    /**
     * A single settings write: GET {@code path} with {@code params} as query.
     */
    public record SettingsWrite(String path, Map<String, String> params) {
    }
    
    public static ObjectNode toCanonical(JsonNode settings) {
        ObjectNode canonical = object();
        if (settings == null || !settings.isObject()) {
            return canonical;
        }
        
        ObjectNode system = object();
        ObjectNode device = object();
        copy(settings, "name", device, "name");
        copy(settings, "eco_mode_enabled", device, "eco_mode");
        copy(settings, "discoverable", device);
        putGroup(system, "device", device);
        copy(settings.get("device"), "mac", system, "mac");
        copy(settings, "fw", system, "firmware");
        putGroup(canonical, "system", system);
        
        putGroup(canonical, "wifi", wifi(objectOrNull(settings, "wifi_sta")));
        putGroup(canonical, "mqtt", mqtt(objectOrNull(settings, "mqtt")));
        
        ObjectNode login = objectOrNull(settings, "login");
        if (login != null) {
            ObjectNode auth = object();
            copy(login, "enabled", auth, "enable");
            copy(login, "username", auth, "user");
            putGroup(canonical, "auth", auth);
        }
        
        ObjectNode cloudSource = objectOrNull(settings, "cloud");
        if (cloudSource != null) {
            ObjectNode cloud = object();
            copy(cloudSource, "enabled", cloud, "enable");
            putGroup(canonical, "cloud", cloud);
        }
        
        ObjectNode location = object();
        copy(settings, "timezone", location, "tz");
        copy(settings, "lat", location);
        copy(settings, "lng", location);
        putGroup(canonical, "location", location);
        
        ObjectNode coiotSource = objectOrNull(settings, "coiot");
        if (coiotSource != null) {
            ObjectNode coiot = object();
            copy(coiotSource, "enabled", coiot, "enable");
            copy(coiotSource, "update_period", coiot);
            copy(coiotSource, "peer", coiot);
            putGroup(canonical, "coiot", coiot);
        }
        
        putGroup(canonical, "relay", relay(settings.get("relays")));
        
        ObjectNode powerMetering = object();
        copy(settings, "max_power", powerMetering);
        putGroup(canonical, "power_metering", powerMetering);
        
        putGroup(canonical, "roller", roller(settings.get("rollers")));
        putGroup(canonical, "dimming", dimming(settings));
        
        ObjectNode led = object();
        copyInverted(settings, "led_power_disable", led, "power_indication");
        copyInverted(settings, "led_status_disable", led, "network_indication");
        putGroup(canonical, "led", led);
        
        return canonical;
    }
    
    private static ObjectNode wifi(ObjectNode sta) {
        if (sta == null) {
            return null;
        }
        ObjectNode wifi = object();
        copy(sta, "enabled", wifi, "enable");
        copy(sta, "ssid", wifi);
        copy(sta, "ipv4_method", wifi, "ipv4mode");
        if ("static".equals(sta.path("ipv4_method").asText()) && sta.hasNonNull("ip")) {
            ObjectNode staticIp = object();
            copy(sta, "ip", staticIp);
            copy(sta, "mask", staticIp, "netmask");
            copy(sta, "gw", staticIp);
            copy(sta, "dns", staticIp, "nameserver");
            wifi.set("static_ip", staticIp);
        }
        return wifi;
    }
    
    private static ObjectNode mqtt(ObjectNode source) {
        if (source == null) {
            return null;
        }
        ObjectNode mqtt = object();
        copy(source, "enable", mqtt);
        if (source.hasNonNull("server")) {
            HostPort hostPort = CanonicalJson.splitHostPort(source.get("server").asText());
            mqtt.put("server", hostPort.host());
            if (hostPort.port() != null) {
                mqtt.put("port", hostPort.port());
            }
        }
        copy(source, "user", mqtt);
        copy(source, "id", mqtt, "client_id");
        copy(source, "clean_session", mqtt);
        copy(source, "keep_alive", mqtt);
        return mqtt;
    }
    
    private static ObjectNode relay(JsonNode relays) {
        if (!(relays instanceof ArrayNode array) || array.isEmpty()) {
            return null;
        }
        ObjectNode relay = object();
        ArrayNode channels = relay.putArray("relays");
        for (int i = 0; i < array.size(); i++) {
            JsonNode source = array.get(i);
            ObjectNode channel = object();
            channel.put("id", i);
            copy(source, "name", channel);
            copy(source, "default_state", channel);
            copy(source, "auto_on", channel);
            copy(source, "auto_off", channel);
            copy(source, "btn_type", channel);
            channels.add(channel);
        }
        CanonicalJson.mirrorFirstChannel(relay, RELAY_MIRROR);
        return relay;
    }
    
    private static ObjectNode roller(JsonNode rollers) {
        if (!(rollers instanceof ArrayNode array) || array.isEmpty()) {
            return null;
        }
        JsonNode first = array.get(0);
        ObjectNode roller = object();
        copy(first, "maxtime_open", roller, "max_open_time");
        copy(first, "maxtime_close", roller, "max_close_time");
        copy(first, "default_state", roller, "default_position");
        copy(first, "positioning", roller, "positioning_enabled");
        copy(first, "obstacle_power", roller);
        copy(first, "swap_inputs", roller);
        copy(first, "input_mode", roller);
        if (first.has("obstacle_mode")) {
            roller.put("obstacle_detection", !"disabled".equals(first.path("obstacle_mode").asText()));
        }
        return roller;
    }
    
    private static ObjectNode dimming(JsonNode settings) {
        JsonNode lights = settings.get("lights");
        ObjectNode dimming = object();
        if (lights instanceof ArrayNode array && !array.isEmpty()) {
            JsonNode first = array.get(0);
            copy(first, "default_state", dimming);
            copy(first, "brightness", dimming, "default_brightness");
        }
        if (dimming.size() == 0 && !settings.has("fade_rate") && !settings.has("min_brightness")) {
            return null;
        }
        copy(settings, "fade_rate", dimming);
        copy(settings, "transition", dimming);
        copy(settings, "leading_edge", dimming);
        copy(settings, "min_brightness", dimming);
        ObjectNode nightMode = objectOrNull(settings, "night_mode");
        if (nightMode != null) {
            copy(nightMode, "enabled", dimming, "night_mode");
        }
        return dimming;
    }
    
    /**
     * Settings writes that bring a Gen1 device to the given canonical configuration.
     */
    public static List<SettingsWrite> toWrites(ObjectNode canonical) {
        List<SettingsWrite> writes = new ArrayList<>();
        
        Map<String, String> general = new LinkedHashMap<>();
        ObjectNode system = objectOrNull(canonical, "system");
        if (system != null) {
            ObjectNode device = objectOrNull(system, "device");
            if (device != null) {
                putParam(general, "name", device.get("name"));
                putParam(general, "eco_mode_enabled", device.get("eco_mode"));
                putParam(general, "discoverable", device.get("discoverable"));
            }
        }
        ObjectNode location = objectOrNull(canonical, "location");
        if (location != null) {
            putParam(general, "timezone", location.get("tz"));
            putParam(general, "lat", location.get("lat"));
            putParam(general, "lng", location.get("lng"));
        }
        ObjectNode led = objectOrNull(canonical, "led");
        if (led != null) {
            putInverted(general, "led_power_disable", led.get("power_indication"));
            putInverted(general, "led_status_disable", led.get("network_indication"));
        }
        ObjectNode powerMetering = objectOrNull(canonical, "power_metering");
        if (powerMetering != null) {
            putParam(general, "max_power", powerMetering.get("max_power"));
        }
        ObjectNode coiot = objectOrNull(canonical, "coiot");
        if (coiot != null) {
            putParam(general, "coiot_enable", coiot.get("enable"));
            putParam(general, "coiot_update_period", coiot.get("update_period"));
            putParam(general, "coiot_peer", coiot.get("peer"));
        }
        if (!general.isEmpty()) {
            writes.add(new SettingsWrite("/settings", general));
        }
        
        for (ObjectNode channel : CanonicalJson.relayChannels(objectOrNull(canonical, "relay"))) {
            Map<String, String> params = new LinkedHashMap<>();
            putParam(params, "name", channel.get("name"));
            putParam(params, "default_state", channel.get("default_state"));
            putParam(params, "auto_on", channel.get("auto_on"));
            putParam(params, "auto_off", channel.get("auto_off"));
            putParam(params, "btn_type", channel.get("btn_type"));
            if (!params.isEmpty()) {
                writes.add(new SettingsWrite("/settings/relay/" + channel.path("id").asInt(), params));
            }
        }
        
        ObjectNode wifi = objectOrNull(canonical, "wifi");
        if (wifi != null) {
            Map<String, String> params = new LinkedHashMap<>();
            putParam(params, "enabled", wifi.get("enable"));
            putParam(params, "ssid", wifi.get("ssid"));
            putParam(params, "key", wifi.get("password"));
            putParam(params, "ipv4_method", wifi.get("ipv4mode"));
            ObjectNode staticIp = objectOrNull(wifi, "static_ip");
            if (staticIp != null) {
                putParam(params, "ip", staticIp.get("ip"));
                putParam(params, "netmask", staticIp.get("netmask"));
                putParam(params, "gateway", staticIp.get("gw"));
                putParam(params, "dns", staticIp.get("nameserver"));
            }
            if (!params.isEmpty()) {
                writes.add(new SettingsWrite("/settings/sta", params));
            }
        }
        
        ObjectNode mqtt = objectOrNull(canonical, "mqtt");
        if (mqtt != null) {
            Map<String, String> params = new LinkedHashMap<>();
            putParam(params, "mqtt_enable", mqtt.get("enable"));
            if (mqtt.hasNonNull("server")) {
                Integer port = mqtt.hasNonNull("port") ? mqtt.get("port").asInt() : null;
                params.put("mqtt_server", new HostPort(mqtt.get("server").asText(), port).join());
            }
            putParam(params, "mqtt_user", mqtt.get("user"));
            putParam(params, "mqtt_pass", mqtt.get("password"));
            putParam(params, "mqtt_id", mqtt.get("client_id"));
            putParam(params, "mqtt_clean_session", mqtt.get("clean_session"));
            putParam(params, "mqtt_keep_alive", mqtt.get("keep_alive"));
            if (!params.isEmpty()) {
                writes.add(new SettingsWrite("/settings/mqtt", params));
            }
        }
        
        ObjectNode cloud = objectOrNull(canonical, "cloud");
        if (cloud != null && cloud.hasNonNull("enable")) {
            Map<String, String> params = new LinkedHashMap<>();
            putParam(params, "enabled", cloud.get("enable"));
            writes.add(new SettingsWrite("/settings/cloud", params));
        }
        
        ObjectNode auth = objectOrNull(canonical, "auth");
        if (auth != null && auth.hasNonNull("enable")) {
            boolean enable = auth.path("enable").asBoolean();
            boolean complete = auth.hasNonNull("user") && auth.hasNonNull("password");
            // enabling login without both parts would lock the device out
            if (!enable || complete) {
                Map<String, String> params = new LinkedHashMap<>();
                putParam(params, "enabled", auth.get("enable"));
                if (enable) {
                    putParam(params, "username", auth.get("user"));
                    putParam(params, "password", auth.get("password"));
                }
                writes.add(new SettingsWrite("/settings/login", params));
            }
        }
        
        return writes;
    }
    
    private static void putInverted(Map<String, String> params, String name, JsonNode value) {
        if (value != null && value.isBoolean()) {
            params.put(name, String.valueOf(!value.booleanValue()));
        }
    }
}
