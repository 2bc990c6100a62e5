package com.platform.fleetsync.protocol;

import com.platform.fleetsync.error.ValidationException;

import java.util.Locale;
import java.util.Set;

/**
 * Validated state change for one component channel.
 *
 * @param type    component kind
 * @param channel zero-based channel
 * @param action  on, off, toggle (switch, light) or open, close, stop, position (cover)
 * @param level   brightness or position 0-100 when the action carries one
 */
public record ComponentCommand(ComponentType type, int channel, String action, Integer level) {
    
    private static final Set<String> SWITCH_ACTIONS = Set.of("on", "off", "toggle");
    private static final Set<String> COVER_ACTIONS = Set.of("open", "close", "stop");
    
    /**
     * Parse a component/value pair. A numeric value sets brightness (light) or position (cover).
     */
    public static ComponentCommand parse(String component, int channel, String value) {
        ComponentType type = ComponentType.fromName(component);
        if (channel < 0) {
            throw new ValidationException("channel", channel, "must be >= 0");
        }
        if (value == null || value.isBlank()) {
            throw new ValidationException("value", "must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        
        switch (type) {
            case SWITCH -> {
                if (!SWITCH_ACTIONS.contains(normalized)) {
                    throw new ValidationException("value", value, "switch accepts on, off or toggle");
                }
                return new ComponentCommand(type, channel, normalized, null);
            }
            case LIGHT -> {
                if (SWITCH_ACTIONS.contains(normalized)) {
                    return new ComponentCommand(type, channel, normalized, null);
                }
                return new ComponentCommand(type, channel, "on", parseLevel(value, "brightness"));
            }
            case COVER -> {
                if (COVER_ACTIONS.contains(normalized)) {
                    return new ComponentCommand(type, channel, normalized, null);
                }
                return new ComponentCommand(type, channel, "position", parseLevel(value, "position"));
            }
            default -> throw new ValidationException("component", component, "unsupported component");
        }
    }
    
    private static int parseLevel(String value, String field) {
        int level;
        try {
            level = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(field, value, "must be an action or a number 0-100");
        }
        if (level < 0 || level > 100) {
            throw new ValidationException(field, level, "must be between 0 and 100");
        }
        return level;
    }
}
