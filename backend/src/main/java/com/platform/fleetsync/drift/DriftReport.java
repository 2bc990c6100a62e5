package com.platform.fleetsync.drift;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of comparing one device's live configuration with its desired configuration.
 */
@Data
@Builder
@JsonIgnoreProperties(value = "driftCount", allowGetters = true)
@NoArgsConstructor
@AllArgsConstructor
public class DriftReport {
    
    private Long id;
    private Long deviceId;
    private String deviceName;
    private String deviceIp;
    
    @Builder.Default
    private List<FieldDelta> differences = new ArrayList<>();
    
    /**
     * True iff no MISSING or CHANGED delta exists.
     */
    private boolean inSync;
    
    private Instant checkedAt;
    
    /**
     * Number of deltas that count as drift.
     */
    public int getDriftCount() {
        return (int) differences.stream().filter(d -> d.kind().isDrift()).count();
    }
}
