package com.platform.fleetsync.device;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.protocol.Generation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A managed device, identified by its hardware address.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Device {
    
    public static final String STATUS_ONLINE = "online";
    public static final String SYNC_SYNCED = "synced";
    public static final String SYNC_DRIFT = "drift";
    
    private Long id;
    private String mac;
    private String ip;
    private String type;
    private String name;
    private String firmware;
    
    @Builder.Default
    private Generation generation = Generation.GEN1;
    
    private String status;
    private Instant lastSeen;
    
    @JsonIgnore
    @Builder.Default
    private DeviceSettings settings = new DeviceSettings();
    
    /**
     * Applied templates in resolution order.
     */
    @Builder.Default
    private List<Long> templateIds = new ArrayList<>();
    
    /**
     * Device-level override, canonical schema. Null when none is set.
     */
    private ObjectNode overrides;
    
    /**
     * Last resolved desired configuration snapshot.
     */
    private ObjectNode desiredConfig;
    
    private boolean configApplied;
    private String syncStatus;
    private Instant lastSynced;
    
    private Instant createdAt;
    private Instant updatedAt;
    private Long version;
    
    public String getModel() {
        return settings != null ? settings.getModel() : null;
    }
    
    public boolean isAuthEnabled() {
        return settings != null && Boolean.TRUE.equals(settings.getAuthEnabled());
    }
    
    public boolean isHasCredential() {
        return settings != null && settings.hasSavedCredential();
    }
}
