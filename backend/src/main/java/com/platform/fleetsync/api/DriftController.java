package com.platform.fleetsync.api;

import com.platform.fleetsync.drift.BulkDriftResult;
import com.platform.fleetsync.drift.DriftDetectionService;
import com.platform.fleetsync.drift.DriftReport;
import com.platform.fleetsync.drift.DriftTrend;
import com.platform.fleetsync.drift.DriftTrendService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for drift detection, reports and trends.
 */
@RestController
@RequestMapping("/api/drift")
@RequiredArgsConstructor
public class DriftController {
    
    private static final int MAX_LIMIT = 500;
    
    private final DriftDetectionService detectionService;
    private final DriftTrendService trendService;
    
    @PostMapping("/devices/{deviceId}")
    public DriftReport detectDrift(@PathVariable Long deviceId) {
        return detectionService.detect(deviceId);
    }
    
    /**
     * Check the listed devices, or all devices when the body or list is empty.
     * Per-device failures are reported inside the result.
     */
    @PostMapping("/bulk")
    public BulkDriftResult detectBulk(@Valid @RequestBody(required = false) ApiRequests.BulkDriftRequest request) {
        return detectionService.detectBulk(request != null ? request.getDeviceIds() : null);
    }
    
    @GetMapping("/reports")
    public List<DriftReport> getReports(
            @RequestParam(name = "device_id", required = false) Long deviceId,
            @RequestParam(defaultValue = "50") int limit) {
        return detectionService.getReports(deviceId, clamp(limit));
    }
    
    @GetMapping("/trends")
    public List<DriftTrend> getTrends(
            @RequestParam(name = "device_id", required = false) Long deviceId,
            @RequestParam(required = false) Boolean resolved,
            @RequestParam(defaultValue = "100") int limit) {
        return trendService.query(deviceId, resolved, clamp(limit));
    }
    
    @PostMapping("/trends/{trendId}/resolve")
    public DriftTrend resolveTrend(@PathVariable Long trendId) {
        return trendService.markResolved(trendId);
    }
    
    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
