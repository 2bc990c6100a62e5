package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.fleetsync.api.validation.SafeText;
import jakarta.validation.Valid;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Device identity settings. {@code mac}, {@code firmware} and {@code fw_id}
 * are reported by the device and never pushed.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SystemConfig extends ConfigSection {
    
    @Valid
    private DeviceSection device;
    
    private String mac;
    
    private String firmware;
    
    private String fwId;
    
    @Data
    @EqualsAndHashCode(callSuper = false)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DeviceSection extends ConfigSection {
        
        @SafeText(maxLength = 64)
        private String name;
        
        private Boolean ecoMode;
        
        private Boolean discoverable;
    }
}
