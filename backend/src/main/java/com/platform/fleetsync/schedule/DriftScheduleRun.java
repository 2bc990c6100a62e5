package com.platform.fleetsync.schedule;

import com.platform.fleetsync.drift.BulkDriftResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftScheduleRun {
    
    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    
    private Long id;
    private Long scheduleId;
    private String status;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private int totalDevices;
    private int inSync;
    private int drifted;
    private int errors;
    private BulkDriftResult result;
    private String errorMessage;
}
