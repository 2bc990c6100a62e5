package com.platform.fleetsync.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "resolution_requests", indexes = {
    @Index(name = "idx_resolution_request_device_path", columnList = "device_id, path, status"),
    @Index(name = "idx_resolution_request_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionRequestEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "device_id", nullable = false)
    private Long deviceId;
    
    @Column(name = "policy_id", nullable = false)
    private Long policyId;
    
    @Column(nullable = false)
    private String path;
    
    @Column(length = 20)
    private String category;
    
    @Column(length = 20)
    private String severity;
    
    @Column(length = 20)
    private String strategy;
    
    @Column(name = "expected_json", columnDefinition = "TEXT")
    private String expectedJson;
    
    @Column(name = "actual_json", columnDefinition = "TEXT")
    private String actualJson;
    
    /**
     * pending, approved or rejected.
     */
    @Column(nullable = false, length = 20)
    @Builder.Default
    private String status = "pending";
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "decided_at")
    private Instant decidedAt;
    
    @Column(name = "decided_by", length = 64)
    private String decidedBy;
    
    @Column(name = "decision_reason", columnDefinition = "TEXT")
    private String decisionReason;
    
    /**
     * restored, updated or failed once an approved request has been applied.
     */
    @Column(length = 20)
    private String outcome;
    
    @Column(name = "outcome_detail", columnDefinition = "TEXT")
    private String outcomeDetail;
    
    @Column(name = "executed_at")
    private Instant executedAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
