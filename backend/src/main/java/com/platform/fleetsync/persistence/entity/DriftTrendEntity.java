package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Repeated drift of one field on one device. At most one open trend per (device, path).
 */
@Entity
@Table(name = "drift_trends", indexes = {
    @Index(name = "idx_drift_trend_device_path", columnList = "device_id, path, resolved"),
    @Index(name = "idx_drift_trend_last_seen", columnList = "last_seen")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftTrendEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "device_id", nullable = false)
    private Long deviceId;
    
    @Column(nullable = false)
    private String path;
    
    @Column(length = 20)
    private String category;
    
    @Column(length = 20)
    private String severity;
    
    @Column(nullable = false)
    @Builder.Default
    private int occurrences = 1;
    
    @Column(name = "first_seen", nullable = false)
    private Instant firstSeen;
    
    @Column(name = "last_seen", nullable = false)
    private Instant lastSeen;
    
    @Column(nullable = false)
    @Builder.Default
    private boolean resolved = false;
    
    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
