package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RollerConfig extends ConfigSection {
    
    @Pattern(regexp = "^(normal|reversed)$", message = "motor_direction must be normal or reversed")
    private String motorDirection;
    
    @Positive
    @Max(value = 300, message = "max_open_time cannot exceed 300 seconds")
    private Double maxOpenTime;
    
    @Positive
    @Max(value = 300, message = "max_close_time cannot exceed 300 seconds")
    private Double maxCloseTime;
    
    /**
     * Power-on behaviour: open, close, stop, or a position 0-100.
     */
    @Pattern(regexp = "^(open|close|stop|switch|100|[1-9]?\\d)$", message = "Invalid default position")
    private String defaultPosition;
    
    private Boolean positioningEnabled;
    
    private Boolean obstacleDetection;
    
    @PositiveOrZero
    private Integer obstaclePower;
    
    private Boolean swapInputs;
    
    @Pattern(regexp = "^(one_button|two_button|detached|single|dual)$", message = "Invalid input mode")
    private String inputMode;
}
