package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "config_templates", indexes = {
    @Index(name = "idx_template_device_type", columnList = "device_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigTemplateEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false, unique = true)
    private String name;
    
    @Column(columnDefinition = "TEXT")
    private String description;
    
    /**
     * global, group or device_type.
     */
    @Column(nullable = false, length = 20)
    @Builder.Default
    private String scope = "global";
    
    @Column(name = "device_type", nullable = false, length = 64)
    @Builder.Default
    private String deviceType = "all";
    
    /**
     * Partial configuration in the canonical schema.
     */
    @Column(name = "config_json", columnDefinition = "TEXT", nullable = false)
    private String configJson;
    
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
