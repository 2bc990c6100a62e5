package com.platform.fleetsync.protocol;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Device protocol settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "fleetsync.protocol")
public class ProtocolProperties {
    
    /**
     * User-Agent header sent to devices.
     */
    private String userAgent = "fleet-sync/1.0";
    
    /**
     * TCP connect timeout.
     */
    private Duration connectTimeout = Duration.ofSeconds(2);
    
    /**
     * Ceiling for connectivity tests and generation detection.
     */
    private Duration testTimeout = Duration.ofSeconds(3);
    
    /**
     * Ceiling for info and status fetches.
     */
    private Duration statusTimeout = Duration.ofSeconds(5);
    
    /**
     * Ceiling for configuration fetch and push.
     */
    private Duration configTimeout = Duration.ofSeconds(8);
    
    /**
     * Ceiling for control commands (switch, reboot).
     */
    private Duration controlTimeout = Duration.ofSeconds(10);
}
