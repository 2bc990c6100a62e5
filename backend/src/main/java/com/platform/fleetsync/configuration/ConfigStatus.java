package com.platform.fleetsync.configuration;

import java.time.Instant;

/**
 * Configuration summary for one device.
 */
public record ConfigStatus(
    Long deviceId,
    boolean configApplied,
    boolean hasOverrides,
    int templateCount,
    String syncStatus,
    Instant lastSynced,
    Instant updatedAt
) {
}
