package com.platform.fleetsync.resolution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * How drift in one category is handled. Policies with strategy {@code ignore}
 * never produce resolution requests.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionPolicy {
    
    public static final String STRATEGY_RESTORE = "restore";
    public static final String STRATEGY_UPDATE = "update";
    public static final String STRATEGY_IGNORE = "ignore";
    
    public static final List<String> STRATEGIES = List.of(STRATEGY_RESTORE, STRATEGY_UPDATE, STRATEGY_IGNORE);
    public static final List<String> CATEGORIES = List.of("network", "security", "system", "device");
    
    /**
     * Ascending urgency; the index is the rank.
     */
    public static final List<String> PRIORITIES = List.of("low", "medium", "high", "critical");
    
    private Long id;
    private String name;
    private String category;
    private String strategy;
    
    @Builder.Default
    private boolean enabled = true;
    
    @Builder.Default
    private String priority = "medium";
    
    private String description;
    private Instant createdAt;
    private Instant updatedAt;
    
    public int priorityRank() {
        return PRIORITIES.indexOf(priority);
    }
}
