package com.platform.fleetsync.drift;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of a bulk drift run. Always returned, even when every device failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkDriftResult {
    
    private int total;
    private int inSync;
    private int drifted;
    private int errors;
    
    @Builder.Default
    private List<DeviceResult> results = new ArrayList<>();
    
    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;
    
    public static BulkDriftResult empty(Instant now) {
        return BulkDriftResult.builder()
            .startedAt(now)
            .completedAt(now)
            .build();
    }
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeviceResult {
        
        public static final String SYNCED = "synced";
        public static final String DRIFT = "drift";
        public static final String ERROR = "error";
        
        private Long deviceId;
        private String deviceName;
        private String deviceIp;
        
        /**
         * synced, drift or error.
         */
        private String status;
        
        /**
         * Error code and message when status is error.
         */
        private String errorCode;
        private String error;
        
        private int differenceCount;
        private DriftReport report;
    }
}
