package com.platform.fleetsync.protocol;

import com.platform.fleetsync.error.ValidationException;

import java.util.Locale;

public enum ComponentType {
    SWITCH,
    LIGHT,
    COVER;
    
    public static ComponentType fromName(String name) {
        if (name == null) {
            throw new ValidationException("component", "must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "switch", "relay" -> SWITCH;
            case "light", "dimmer" -> LIGHT;
            case "cover", "roller" -> COVER;
            default -> throw new ValidationException("component", name, "expected switch, light or cover");
        };
    }
}
