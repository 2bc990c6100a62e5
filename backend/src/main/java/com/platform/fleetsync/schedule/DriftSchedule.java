package com.platform.fleetsync.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Recurring bulk drift check over a device selection.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DriftSchedule {
    
    private Long id;
    private String name;
    private String description;
    private boolean enabled;
    private long intervalSeconds;
    
    /**
     * Empty selects every device.
     */
    @Builder.Default
    private List<Long> deviceIds = new ArrayList<>();
    
    private Instant lastRun;
    private Instant nextRun;
    private long runCount;
    private Instant createdAt;
    private Instant updatedAt;
    private Long version;
}
