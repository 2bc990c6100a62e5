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
public class WifiConfig extends ConfigSection {
    
    private static final String IPV4 = "^((25[0-5]|2[0-4]\\d|1?\\d?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1?\\d?\\d)$";
    
    private Boolean enable;
    
    @Size(max = 32, message = "SSID cannot exceed 32 characters")
    private String ssid;
    
    @Size(min = 8, max = 63, message = "WiFi password must be 8-63 characters")
    private String password;
    
    @Pattern(regexp = "^(dhcp|static)$", message = "ipv4mode must be dhcp or static")
    private String ipv4mode;
    
    @Valid
    private StaticIp staticIp;
    
    @Data
    @EqualsAndHashCode(callSuper = false)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class StaticIp extends ConfigSection {
        
        @Pattern(regexp = IPV4, message = "Invalid IPv4 address")
        private String ip;
        
        @Pattern(regexp = IPV4, message = "Invalid netmask")
        private String netmask;
        
        @Pattern(regexp = IPV4, message = "Invalid gateway")
        private String gw;
        
        @Pattern(regexp = IPV4, message = "Invalid nameserver")
        private String nameserver;
    }
}
