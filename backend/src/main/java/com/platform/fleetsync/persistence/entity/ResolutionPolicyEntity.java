package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "resolution_policies", indexes = {
    @Index(name = "idx_resolution_policy_category", columnList = "category, enabled")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionPolicyEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false, unique = true)
    private String name;
    
    /**
     * Drift category this policy covers: network, security, system or device.
     */
    @Column(nullable = false, length = 20)
    private String category;
    
    /**
     * restore, update or ignore.
     */
    @Column(nullable = false, length = 20)
    private String strategy;
    
    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;
    
    @Column(nullable = false, length = 20)
    @Builder.Default
    private String priority = "medium";
    
    @Column(columnDefinition = "TEXT")
    private String description;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
