package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.fleetsync.api.validation.SafeText;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InputConfig extends ConfigSection {
    
    static final String INPUT_TYPES = "^(button|switch|analog)$";
    
    @Pattern(regexp = INPUT_TYPES, message = "type must be button, switch or analog")
    private String type;
    
    @Size(max = 32)
    private String mode;
    
    private Boolean inverted;
    
    @Min(0) @Max(1000)
    private Integer debounceTime;
    
    @Min(0) @Max(5000)
    private Integer longPushTime;
    
    @Valid
    private List<Channel> inputs;
    
    @Data
    @EqualsAndHashCode(callSuper = false)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Channel extends ConfigSection {
        
        @Min(0) @Max(15)
        private Integer id;
        
        @SafeText(maxLength = 64)
        private String name;
        
        @Pattern(regexp = INPUT_TYPES, message = "type must be button, switch or analog")
        private String type;
        
        private Boolean inverted;
    }
}
