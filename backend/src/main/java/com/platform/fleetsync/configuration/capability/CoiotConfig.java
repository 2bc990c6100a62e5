package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CoiotConfig extends ConfigSection {
    
    private Boolean enable;
    
    @Min(value = 1, message = "Update period must be at least 1 second")
    @Max(value = 86400)
    private Integer updatePeriod;
    
    @Size(max = 255)
    private String peer;
}
