package com.platform.fleetsync.drift;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftTrend {
    private Long id;
    private Long deviceId;
    private String path;
    private String category;
    private String severity;
    private int occurrences;
    private Instant firstSeen;
    private Instant lastSeen;
    private boolean resolved;
    private Instant resolvedAt;
}
