package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "drift_reports", indexes = {
    @Index(name = "idx_drift_report_device_checked", columnList = "device_id, checked_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftReportEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "device_id", nullable = false)
    private Long deviceId;
    
    @Column(name = "in_sync", nullable = false)
    private boolean inSync;
    
    @Column(name = "difference_count", nullable = false)
    private int differenceCount;
    
    /**
     * Serialized field deltas.
     */
    @Column(name = "differences_json", columnDefinition = "TEXT")
    private String differencesJson;
    
    @Column(name = "checked_at", nullable = false)
    private Instant checkedAt;
}
