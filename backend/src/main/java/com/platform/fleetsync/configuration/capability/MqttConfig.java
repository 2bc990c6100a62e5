package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MqttConfig extends ConfigSection {
    
    private Boolean enable;
    
    @Size(max = 255, message = "Server cannot exceed 255 characters")
    private String server;
    
    @Min(value = 1, message = "Port must be at least 1")
    @Max(value = 65535, message = "Port cannot exceed 65535")
    private Integer port;
    
    @Size(max = 64)
    private String user;
    
    @Size(max = 64)
    private String password;
    
    @Size(max = 64)
    private String clientId;
    
    private Boolean cleanSession;
    
    @Min(value = 1, message = "Keep-alive must be at least 1 second")
    @Max(value = 3600, message = "Keep-alive cannot exceed 1 hour")
    private Integer keepAlive;
}
