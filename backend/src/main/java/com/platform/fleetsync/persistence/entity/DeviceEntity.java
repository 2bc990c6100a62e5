package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for managed devices.
 * Settings, overrides and the desired snapshot are JSON blobs keyed by capability group.
 */
@Entity
@Table(name = "devices", indexes = {
    @Index(name = "idx_device_ip", columnList = "ip"),
    @Index(name = "idx_device_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    /**
     * Hardware address; the device identity.
     */
    @Column(nullable = false, unique = true, length = 32)
    private String mac;
    
    @Column(length = 64)
    private String ip;
    
    @Column(length = 64)
    private String type;
    
    private String name;
    
    @Column(length = 128)
    private String firmware;
    
    @Column(nullable = false)
    @Builder.Default
    private int generation = 1;
    
    @Column(length = 20)
    private String status;
    
    @Column(name = "last_seen")
    private Instant lastSeen;
    
    @Column(name = "settings_json", columnDefinition = "TEXT")
    private String settingsJson;
    
    /**
     * Ordered template ids as a JSON integer array.
     */
    @Column(name = "template_ids_json", columnDefinition = "TEXT")
    private String templateIdsJson;
    
    @Column(name = "overrides_json", columnDefinition = "TEXT")
    private String overridesJson;
    
    @Column(name = "desired_config_json", columnDefinition = "TEXT")
    private String desiredConfigJson;
    
    @Column(name = "config_applied", nullable = false)
    @Builder.Default
    private boolean configApplied = false;
    
    @Column(name = "sync_status", length = 20)
    private String syncStatus;
    
    @Column(name = "last_synced")
    private Instant lastSynced;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Version
    @Column(nullable = false)
    private Long version;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (version == null) {
            version = 0L;
        }
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
