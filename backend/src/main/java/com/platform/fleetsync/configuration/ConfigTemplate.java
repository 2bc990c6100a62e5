package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Named partial configuration applied to devices in a defined order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfigTemplate {
    
    public static final String ALL_DEVICE_TYPES = "all";
    
    private Long id;
    private String name;
    private String description;
    
    @Builder.Default
    private String scope = "global";
    
    @Builder.Default
    private String deviceType = ALL_DEVICE_TYPES;
    
    private ObjectNode config;
    
    private Instant createdAt;
    private Instant updatedAt;
    private Long version;
    
    /**
     * True if the template may be applied to a device of the given type.
     */
    public boolean appliesTo(String type) {
        return deviceType == null
            || ALL_DEVICE_TYPES.equalsIgnoreCase(deviceType)
            || (type != null && deviceType.equalsIgnoreCase(type));
    }
}
