package com.platform.fleetsync.discovery;

import com.platform.fleetsync.protocol.DeviceInfo;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "fleetsync.discovery")
public class DiscoveryProperties {
    
    /**
     * Hosts contacted in parallel during a scan.
     */
    private int concurrency = 16;
    
    private Duration hostTimeout = Duration.ofSeconds(2);
    
    /**
     * Largest range a single scan accepts.
     */
    private int maxHosts = 1024;
    
    private String namePrefix = "device";
    
    /**
     * Display name for a newly found device: its reported id, else the prefix
     * and the last six hex digits of the hardware address.
     */
    public String initialName(DeviceInfo info, String mac) {
        if (info.getId() != null && !info.getId().isBlank()) {
            return info.getId();
        }
        String suffix = mac.length() > 6 ? mac.substring(mac.length() - 6) : mac;
        return namePrefix + "-" + suffix;
    }
}
