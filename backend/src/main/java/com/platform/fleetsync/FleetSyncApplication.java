package com.platform.fleetsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Device Fleet Sync
 * 
 * Keeps the desired configuration of a fleet of networked relay, dimmer and
 * roller controllers in step with what the devices actually run:
 * - Generation-aware protocol clients (Basic-Auth REST and Digest-Auth RPC)
 * - Credential recovery with a fleet-wide fallback credential
 * - Layered configuration (system defaults, ordered templates, device override)
 * - Drift detection, scheduling and trend tracking
 * - Discovery that preserves device identity across address changes
 */
@SpringBootApplication
@EnableScheduling
public class FleetSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetSyncApplication.class, args);
    }
}
