package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ColorConfig extends ConfigSection {
    
    @Pattern(regexp = "^(color|white)$", message = "mode must be color or white")
    private String mode;
    
    @Min(0) @Max(100)
    private Integer defaultWhite;
    
    private Boolean effectsEnabled;
    
    @Min(0) @Max(100)
    private Integer effectSpeed;
    
    @Valid
    private Rgb defaultColor;
    
    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class Rgb extends ConfigSection {
        
        @Min(0) @Max(255)
        private Integer r;
        
        @Min(0) @Max(255)
        private Integer g;
        
        @Min(0) @Max(255)
        private Integer b;
    }
}
