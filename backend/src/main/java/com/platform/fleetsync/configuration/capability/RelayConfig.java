package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.fleetsync.api.validation.SafeText;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

/**
 * Relay settings. Top-level fields describe channel 0 and are mirrored into
 * {@code relays[0]} when the configuration is pushed.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RelayConfig extends ConfigSection {
    
    static final String DEFAULT_STATES = "^(on|off|last|switch)$";
    static final String BUTTON_TYPES = "^(momentary|toggle|edge|detached|action|cycle|momentary_on_release)$";
    
    @Pattern(regexp = DEFAULT_STATES, message = "default_state must be on, off, last or switch")
    private String defaultState;
    
    @Pattern(regexp = BUTTON_TYPES, message = "Invalid button type")
    private String btnType;
    
    @PositiveOrZero(message = "auto_on must be non-negative")
    private Double autoOn;
    
    @PositiveOrZero(message = "auto_off must be non-negative")
    private Double autoOff;
    
    @PositiveOrZero
    private Double maxPowerLimit;
    
    @Valid
    private List<Channel> relays;
    
    @Data
    @EqualsAndHashCode(callSuper = false)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Channel extends ConfigSection {
        
        @Min(value = 0, message = "Channel id must be non-negative")
        @Max(value = 15)
        private Integer id;
        
        @SafeText(maxLength = 64)
        private String name;
        
        @Pattern(regexp = DEFAULT_STATES, message = "default_state must be on, off, last or switch")
        private String defaultState;
        
        @PositiveOrZero
        private Double autoOn;
        
        @PositiveOrZero
        private Double autoOff;
        
        @Pattern(regexp = BUTTON_TYPES, message = "Invalid button type")
        private String btnType;
    }
}
