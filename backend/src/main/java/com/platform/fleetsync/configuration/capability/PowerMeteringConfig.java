package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PowerMeteringConfig extends ConfigSection {
    
    @PositiveOrZero(message = "max_power must be non-negative")
    private Double maxPower;
    
    @PositiveOrZero
    private Double maxVoltage;
    
    @PositiveOrZero
    private Double maxCurrent;
    
    @Pattern(regexp = "^(off|alarm|shutdown)$", message = "protection_action must be off, alarm or shutdown")
    private String protectionAction;
    
    @Min(value = 1, message = "Reporting period must be at least 1 second")
    @Max(value = 3600)
    private Integer reportingPeriod;
}
