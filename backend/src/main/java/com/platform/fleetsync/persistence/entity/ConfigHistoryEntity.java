package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail of configuration changes. Passwords are masked before storage.
 */
@Entity
@Table(name = "config_history", indexes = {
    @Index(name = "idx_history_device_created", columnList = "device_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigHistoryEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "device_id", nullable = false)
    private Long deviceId;
    
    /**
     * import, export, override or template.
     */
    @Column(nullable = false, length = 20)
    private String action;
    
    @Column(name = "old_config_json", columnDefinition = "TEXT")
    private String oldConfigJson;
    
    @Column(name = "new_config_json", columnDefinition = "TEXT")
    private String newConfigJson;
    
    @Column(name = "changed_by", length = 64)
    private String changedBy;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
