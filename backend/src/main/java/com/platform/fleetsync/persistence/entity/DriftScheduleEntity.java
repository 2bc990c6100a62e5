package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "drift_schedules", indexes = {
    @Index(name = "idx_drift_schedule_next_run", columnList = "enabled, next_run")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftScheduleEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false, unique = true)
    private String name;
    
    @Column(columnDefinition = "TEXT")
    private String description;
    
    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;
    
    @Column(name = "interval_seconds", nullable = false)
    private long intervalSeconds;
    
    /**
     * Selected device ids as a JSON integer array; empty means every device.
     */
    @Column(name = "device_ids_json", columnDefinition = "TEXT")
    private String deviceIdsJson;
    
    @Column(name = "last_run")
    private Instant lastRun;
    
    @Column(name = "next_run")
    private Instant nextRun;
    
    @Column(name = "run_count", nullable = false)
    @Builder.Default
    private long runCount = 0;
    
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
