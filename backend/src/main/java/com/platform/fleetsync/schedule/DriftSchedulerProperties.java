package com.platform.fleetsync.schedule;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "fleetsync.drift.scheduler")
public class DriftSchedulerProperties {
    
    /**
     * When false the tick does nothing; on-demand runs still work.
     */
    private boolean enabled = true;
    
    private long tickMs = 30_000;
    
    /**
     * Runs returned when no limit is given.
     */
    private int historyLimit = 20;
    
    private long minIntervalSeconds = 60;
    
    private long maxIntervalSeconds = 7 * 24 * 3600;
}
