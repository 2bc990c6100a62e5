package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last imported full configuration of a device, in the canonical schema.
 */
@Entity
@Table(name = "device_configurations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceConfigurationEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "device_id", nullable = false, unique = true)
    private Long deviceId;
    
    @Column(name = "config_json", columnDefinition = "TEXT", nullable = false)
    private String configJson;
    
    @Column(name = "last_synced")
    private Instant lastSynced;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
