package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LedConfig extends ConfigSection {
    
    private Boolean enabled;
    
    @Size(max = 32)
    private String mode;
    
    @Min(value = 0, message = "Brightness must be 0-100")
    @Max(value = 100, message = "Brightness must be 0-100")
    private Integer brightness;
    
    private Boolean nightMode;
    
    private Boolean powerIndication;
    
    private Boolean networkIndication;
}
