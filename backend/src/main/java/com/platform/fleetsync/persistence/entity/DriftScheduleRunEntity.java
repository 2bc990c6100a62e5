package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "drift_schedule_runs", indexes = {
    @Index(name = "idx_drift_run_schedule_started", columnList = "schedule_id, started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftScheduleRunEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "schedule_id", nullable = false)
    private Long scheduleId;
    
    /**
     * running, completed or failed.
     */
    @Column(nullable = false, length = 20)
    private String status;
    
    @Column(name = "started_at", nullable = false)
    private Instant startedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
    
    @Column(name = "duration_ms")
    private Long durationMs;
    
    @Column(name = "total_devices")
    private int totalDevices;
    
    @Column(name = "in_sync")
    private int inSync;
    
    private int drifted;
    
    private int errors;
    
    /**
     * Serialized bulk drift result.
     */
    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;
    
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;
}
