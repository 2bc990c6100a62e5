package com.platform.fleetsync.credential;

import com.platform.fleetsync.protocol.DeviceCredential;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Fleet-wide provisioning credential. Read-only to the engine.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "fleetsync.provisioning.auth")
public class FallbackCredentialProperties {
    
    private boolean enabled = false;
    
    private String username = "admin";
    
    private String password;
    
    /**
     * The fallback pair, or null when disabled or incomplete.
     */
    public DeviceCredential credential() {
        return enabled ? DeviceCredential.ofNullable(username, password) : null;
    }
}
