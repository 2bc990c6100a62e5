package com.platform.fleetsync.resolution;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A drifted field awaiting a decision under a {@link ResolutionPolicy}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionRequest {
    
    public static final String PENDING = "pending";
    public static final String APPROVED = "approved";
    public static final String REJECTED = "rejected";
    
    public static final String OUTCOME_RESTORED = "restored";
    public static final String OUTCOME_UPDATED = "updated";
    public static final String OUTCOME_FAILED = "failed";
    
    private Long id;
    private Long deviceId;
    private Long policyId;
    private String path;
    private String category;
    private String severity;
    private String strategy;
    private JsonNode expected;
    private JsonNode actual;
    
    @Builder.Default
    private String status = PENDING;
    
    private Instant createdAt;
    private Instant decidedAt;
    private String decidedBy;
    private String decisionReason;
    
    /**
     * Result of applying the strategy after approval; null until then.
     */
    private String outcome;
    private String outcomeDetail;
    private Instant executedAt;
}
