package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuthConfig extends ConfigSection {
    
    private Boolean enable;
    
    @Size(min = 1, max = 32, message = "User must be 1-32 characters")
    private String user;
    
    @Size(min = 1, max = 64, message = "Password must be 1-64 characters")
    private String password;
}
