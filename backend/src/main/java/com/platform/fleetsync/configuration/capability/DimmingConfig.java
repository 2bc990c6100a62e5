package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DimmingConfig extends ConfigSection {
    
    @Min(0) @Max(100)
    private Integer minBrightness;
    
    @Min(0) @Max(100)
    private Integer maxBrightness;
    
    @Min(value = 0, message = "Brightness must be 0-100")
    @Max(value = 100, message = "Brightness must be 0-100")
    private Integer defaultBrightness;
    
    @Pattern(regexp = "^(on|off|last|switch)$", message = "default_state must be on, off, last or switch")
    private String defaultState;
    
    @Min(1) @Max(5)
    private Integer fadeRate;
    
    /**
     * Transition time in milliseconds.
     */
    @Min(0) @Max(5000)
    private Integer transition;
    
    private Boolean leadingEdge;
    
    private Boolean nightMode;
}
