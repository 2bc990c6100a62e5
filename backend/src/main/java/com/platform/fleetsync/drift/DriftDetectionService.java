package com.platform.fleetsync.drift;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.configuration.DeviceConfigurationService;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceRepository;
import com.platform.fleetsync.error.ErrorCode;
import com.platform.fleetsync.error.FleetSyncException;
import com.platform.fleetsync.error.ResourceNotFoundException;
import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.persistence.EntityMappers;
import com.platform.fleetsync.persistence.repository.DriftReportJpaRepository;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.resolution.ResolutionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Drift detection for one device or a set of devices.
 * 
 * Bulk detection runs devices one after another. Every device gets a result
 * entry; a device that cannot be checked is recorded as an error and the run
 * continues with the next one.
 */
@Slf4j
@Service
public class DriftDetectionService {
    
    private final DeviceRepository deviceRepository;
    private final DeviceConfigurationService configurationService;
    private final DriftDetector detector;
    private final DriftReportJpaRepository reportJpaRepository;
    private final DriftTrendService trendService;
    private final ResolutionService resolutionService;
    private final EntityMappers entityMappers;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    
    public DriftDetectionService(
            DeviceRepository deviceRepository,
            DeviceConfigurationService configurationService,
            DriftDetector detector,
            DriftReportJpaRepository reportJpaRepository,
            DriftTrendService trendService,
            ResolutionService resolutionService,
            EntityMappers entityMappers,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.deviceRepository = deviceRepository;
        this.configurationService = configurationService;
        this.detector = detector;
        this.reportJpaRepository = reportJpaRepository;
        this.trendService = trendService;
        this.resolutionService = resolutionService;
        this.entityMappers = entityMappers;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }
    
    public DriftReport detect(Long deviceId) {
        Device device = deviceRepository.findById(deviceId)
            .orElseThrow(() -> ResourceNotFoundException.device(deviceId));
        return detect(device);
    }
    
    /**
     * Compare the device's live configuration with its desired configuration,
     * store the report, update trends and the device's sync status.
     */
    public DriftReport detect(Device device) {
        return detect(device, null);
    }
    
    /**
     * As {@link #detect(Device)}, with the device calls derived from {@code parent}.
     */
    public DriftReport detect(Device device, CallContext parent) {
        ObjectNode live;
        try {
            live = configurationService.fetchLive(device, parent);
        } catch (RuntimeException e) {
            metricsRegistry.recordDriftCheck("error");
            throw e;
        }
        ObjectNode desired = configurationService.resolve(device).config();
        List<FieldDelta> deltas = detector.compare(desired, live);
        boolean inSync = DriftDetector.isInSync(deltas);
        Instant checkedAt = Instant.now();
        
        DriftReport report = DriftReport.builder()
            .deviceId(device.getId())
            .differences(new ArrayList<>(deltas))
            .inSync(inSync)
            .checkedAt(checkedAt)
            .build();
        DriftReport saved = entityMappers.toDomain(reportJpaRepository.save(entityMappers.toEntity(report)));
        saved.setDeviceName(device.getName());
        saved.setDeviceIp(device.getIp());
        
        if (!inSync) {
            trendService.record(device.getId(), deltas, checkedAt);
            resolutionService.raiseRequests(device.getId(), deltas);
            structuredLogger.drift().detected(device.getId(), device.getIp(), saved.getDriftCount());
        }
        
        String syncStatus = inSync ? Device.SYNC_SYNCED : Device.SYNC_DRIFT;
        if (!syncStatus.equals(device.getSyncStatus())) {
            device.setSyncStatus(syncStatus);
            deviceRepository.save(device);
        }
        
        metricsRegistry.recordDriftCheck(inSync ? "in_sync" : "drift");
        log.info("Drift check for device {} ({}): {} with {} difference(s)",
            device.getId(), device.getIp(), inSync ? "in sync" : "drifted", saved.getDriftCount());
        return saved;
    }
    
    /**
     * Check every listed device, or the whole fleet when the list is null or empty.
     * Always returns a result, even if every device failed.
     */
    public BulkDriftResult detectBulk(List<Long> deviceIds) {
        return detectBulk(deviceIds, null);
    }
    
    /**
     * Bulk detection whose device calls all derive from {@code parent}. Once the parent
     * is cancelled, devices not yet checked are recorded as cancelled.
     */
    public BulkDriftResult detectBulk(List<Long> deviceIds, CallContext parent) {
        Instant startedAt = Instant.now();
        List<Long> ids = deviceIds == null || deviceIds.isEmpty()
            ? deviceRepository.findAllIds()
            : deviceIds;
        
        List<BulkDriftResult.DeviceResult> results = new ArrayList<>(ids.size());
        int inSync = 0;
        int drifted = 0;
        int errors = 0;
        
        for (Long id : ids) {
            BulkDriftResult.DeviceResult result = parent != null && parent.isCancelled()
                ? cancelled(id)
                : detectIsolated(id, parent);
            results.add(result);
            switch (result.getStatus()) {
                case BulkDriftResult.DeviceResult.SYNCED -> inSync++;
                case BulkDriftResult.DeviceResult.DRIFT -> drifted++;
                default -> errors++;
            }
        }
        
        Instant completedAt = Instant.now();
        long durationMs = Duration.between(startedAt, completedAt).toMillis();
        structuredLogger.drift().bulkCompleted(ids.size(), inSync, drifted, errors, durationMs);
        log.info("Bulk drift check: {} devices, {} in sync, {} drifted, {} errors in {}ms",
            ids.size(), inSync, drifted, errors, durationMs);
        
        return BulkDriftResult.builder()
            .total(ids.size())
            .inSync(inSync)
            .drifted(drifted)
            .errors(errors)
            .results(results)
            .startedAt(startedAt)
            .completedAt(completedAt)
            .durationMs(durationMs)
            .build();
    }
    
    private static BulkDriftResult.DeviceResult cancelled(Long deviceId) {
        return BulkDriftResult.DeviceResult.builder()
            .deviceId(deviceId)
            .status(BulkDriftResult.DeviceResult.ERROR)
            .errorCode(ErrorCode.OPERATION_CANCELLED.getCode())
            .error("bulk drift check cancelled")
            .build();
    }
    
    private BulkDriftResult.DeviceResult detectIsolated(Long deviceId, CallContext parent) {
        BulkDriftResult.DeviceResult.DeviceResultBuilder result = BulkDriftResult.DeviceResult.builder()
            .deviceId(deviceId);
        try {
            Device device = deviceRepository.findById(deviceId)
                .orElseThrow(() -> ResourceNotFoundException.device(deviceId));
            result.deviceName(device.getName()).deviceIp(device.getIp());
            
            DriftReport report = detect(device, parent);
            return result
                .status(report.isInSync() ? BulkDriftResult.DeviceResult.SYNCED : BulkDriftResult.DeviceResult.DRIFT)
                .differenceCount(report.getDriftCount())
                .report(report)
                .build();
        } catch (FleetSyncException e) {
            log.warn("Drift check failed for device {}: [{}] {}", deviceId, e.getErrorCode().getCode(), e.getMessage());
            return result
                .status(BulkDriftResult.DeviceResult.ERROR)
                .errorCode(e.getErrorCode().getCode())
                .error(e.getMessage())
                .build();
        } catch (RuntimeException e) {
            log.error("Unexpected error checking drift for device {}", deviceId, e);
            return result
                .status(BulkDriftResult.DeviceResult.ERROR)
                .errorCode(ErrorCode.UNEXPECTED_ERROR.getCode())
                .error(e.getMessage())
                .build();
        }
    }
    
    /**
     * Stored reports, newest first. A null device id returns reports for all devices.
     */
    public List<DriftReport> getReports(Long deviceId, int limit) {
        return reportJpaRepository.findFiltered(deviceId, PageRequest.of(0, limit)).stream()
            .map(entityMappers::toDomain)
            .toList();
    }
}
