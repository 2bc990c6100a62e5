package com.platform.fleetsync.configuration;

import com.platform.fleetsync.configuration.capability.*;
import com.platform.fleetsync.error.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Top-level groups of the canonical configuration schema.
 */
public enum CapabilityGroup {
    
    WIFI("wifi", WifiConfig.class),
    MQTT("mqtt", MqttConfig.class),
    AUTH("auth", AuthConfig.class),
    SYSTEM("system", SystemConfig.class),
    CLOUD("cloud", CloudConfig.class),
    LOCATION("location", LocationConfig.class),
    COIOT("coiot", CoiotConfig.class),
    RELAY("relay", RelayConfig.class),
    POWER_METERING("power_metering", PowerMeteringConfig.class),
    DIMMING("dimming", DimmingConfig.class),
    ROLLER("roller", RollerConfig.class),
    INPUT("input", InputConfig.class),
    LED("led", LedConfig.class),
    COLOR("color", ColorConfig.class);
    
    private final String key;
    private final Class<? extends ConfigSection> type;
    
    CapabilityGroup(String key, Class<? extends ConfigSection> type) {
        this.key = key;
        this.type = type;
    }
    
    public String getKey() {
        return key;
    }
    
    public Class<? extends ConfigSection> getType() {
        return type;
    }
    
    /**
     * Look up by schema key; accepts {@code power-metering} as well as {@code power_metering}.
     */
    public static CapabilityGroup fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
            .filter(group -> group.key.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new ValidationException("group", key,
                "Unknown configuration group '" + key + "', expected one of " + keys()));
    }
    
    public static boolean isKnown(String key) {
        return Arrays.stream(values()).anyMatch(group -> group.key.equals(key));
    }
    
    private static String keys() {
        return Arrays.stream(values()).map(CapabilityGroup::getKey).collect(Collectors.joining(", "));
    }
}
