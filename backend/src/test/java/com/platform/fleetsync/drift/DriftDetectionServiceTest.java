package com.platform.fleetsync.drift;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.fleetsync.configuration.DeviceConfigurationService;
import com.platform.fleetsync.configuration.ResolvedConfiguration;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceRepository;
import com.platform.fleetsync.error.DeviceNetworkException;
import com.platform.fleetsync.error.ErrorCode;
import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.persistence.EntityMappers;
import com.platform.fleetsync.persistence.entity.DriftReportEntity;
import com.platform.fleetsync.persistence.repository.DriftReportJpaRepository;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.resolution.ResolutionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DriftDetectionServiceTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private DeviceRepository deviceRepository;
    private DeviceConfigurationService configurationService;
    private DriftTrendService trendService;
    private ResolutionService resolutionService;
    private SimpleMeterRegistry meterRegistry;
    private DriftDetectionService service;

    @BeforeEach
    void setUp() {
        deviceRepository = mock(DeviceRepository.class);
        configurationService = mock(DeviceConfigurationService.class);
        trendService = mock(DriftTrendService.class);
        resolutionService = mock(ResolutionService.class);
        DriftReportJpaRepository reportRepository = mock(DriftReportJpaRepository.class);
        when(reportRepository.save(any(DriftReportEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        meterRegistry = new SimpleMeterRegistry();

        service = new DriftDetectionService(deviceRepository, configurationService, new DriftDetector(),
            reportRepository, trendService, resolutionService, new EntityMappers(mapper),
            new MetricsRegistry(meterRegistry), new StructuredLogger());
    }

    @Test
    void detect_liveMatchesDesired_marksDeviceSynced() throws Exception {
        Device device = device(1L);
        ObjectNode config = json("{\"mqtt\":{\"server\":\"broker.local\"}}");
        stubConfig(device, config, config.deepCopy());

        DriftReport report = service.detect(device);

        assertThat(report.isInSync()).isTrue();
        assertThat(report.getDeviceName()).isEqualTo("device-1");
        assertThat(device.getSyncStatus()).isEqualTo(Device.SYNC_SYNCED);
        verify(trendService, never()).record(any(), anyList(), any());
        verify(deviceRepository).save(device);
    }

    @Test
    void detect_drift_recordsTrendsAndRequests() throws Exception {
        Device device = device(2L);
        stubConfig(device, json("{\"mqtt\":{\"server\":\"broker.local\"}}"),
            json("{\"mqtt\":{\"server\":\"rogue.local\"}}"));

        DriftReport report = service.detect(device);

        assertThat(report.isInSync()).isFalse();
        assertThat(report.getDriftCount()).isEqualTo(1);
        assertThat(device.getSyncStatus()).isEqualTo(Device.SYNC_DRIFT);
        verify(trendService).record(eq(2L), anyList(), any());
        verify(resolutionService).raiseRequests(eq(2L), anyList());
    }

    @Test
    void detect_unchangedStatus_doesNotRewriteDevice() throws Exception {
        Device device = device(3L);
        device.setSyncStatus(Device.SYNC_SYNCED);
        ObjectNode config = json("{}");
        stubConfig(device, config, config);

        service.detect(device);

        verify(deviceRepository, never()).save(any());
    }

    @Test
    void detect_unreachableDevice_propagatesAndCountsError() {
        Device device = device(4L);
        when(configurationService.fetchLive(eq(device), any())).thenThrow(DeviceNetworkException.timeout("10.0.0.4", 2, "get_config"));

        assertThatThrownBy(() -> service.detect(device)).isInstanceOf(DeviceNetworkException.class);
        assertThat(meterRegistry.find("fleetsync.drift.checks").tag("status", "error").counter()).isNotNull();
    }

    @Test
    void detectBulk_oneDeviceFails_othersStillChecked() throws Exception {
        for (long id = 1; id <= 5; id++) {
            Device device = device(id);
            when(deviceRepository.findById(id)).thenReturn(Optional.of(device));
            if (id == 3) {
                when(configurationService.fetchLive(eq(device), any()))
                    .thenThrow(DeviceNetworkException.unreachable("10.0.0.3", 2, "get_config", null));
            } else {
                ObjectNode config = json("{\"relay\":{\"default_state\":\"off\"}}");
                stubConfig(device, config, config.deepCopy());
            }
        }

        BulkDriftResult result = service.detectBulk(List.of(1L, 2L, 3L, 4L, 5L));

        assertThat(result.getTotal()).isEqualTo(5);
        assertThat(result.getResults()).hasSize(5);
        assertThat(result.getErrors()).isEqualTo(1);
        assertThat(result.getInSync()).isEqualTo(4);
        BulkDriftResult.DeviceResult failed = result.getResults().get(2);
        assertThat(failed.getDeviceId()).isEqualTo(3L);
        assertThat(failed.getStatus()).isEqualTo(BulkDriftResult.DeviceResult.ERROR);
        assertThat(failed.getErrorCode()).isEqualTo(ErrorCode.DEVICE_UNREACHABLE.getCode());
    }

    @Test
    void detectBulk_unknownDevice_isReportedNotThrown() {
        when(deviceRepository.findById(99L)).thenReturn(Optional.empty());

        BulkDriftResult result = service.detectBulk(List.of(99L));

        assertThat(result.getErrors()).isEqualTo(1);
        assertThat(result.getResults().get(0).getErrorCode()).isEqualTo(ErrorCode.DEVICE_NOT_FOUND.getCode());
    }

    @Test
    void detectBulk_withParentContext_passesItToDeviceCalls() throws Exception {
        Device device = device(6L);
        when(deviceRepository.findById(6L)).thenReturn(Optional.of(device));
        ObjectNode config = json("{}");
        stubConfig(device, config, config);
        CallContext run = CallContext.root();

        service.detectBulk(List.of(6L), run);

        verify(configurationService).fetchLive(device, run);
    }

    @Test
    void detectBulk_cancelledParent_skipsRemainingDevices() {
        CallContext run = CallContext.root();
        run.cancel();

        BulkDriftResult result = service.detectBulk(List.of(7L, 8L), run);

        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(result.getErrors()).isEqualTo(2);
        assertThat(result.getResults())
            .extracting(BulkDriftResult.DeviceResult::getErrorCode)
            .containsOnly(ErrorCode.OPERATION_CANCELLED.getCode());
        verify(deviceRepository, never()).findById(any());
        verify(configurationService, never()).fetchLive(any(), any());
    }

    @Test
    void detectBulk_withoutIds_checksWholeFleet() {
        when(deviceRepository.findAllIds()).thenReturn(List.of());

        BulkDriftResult result = service.detectBulk(null);

        assertThat(result.getTotal()).isZero();
        assertThat(result.getResults()).isEmpty();
    }

    private void stubConfig(Device device, ObjectNode desired, ObjectNode live) {
        when(configurationService.fetchLive(eq(device), any())).thenReturn(live);
        when(configurationService.resolve(device)).thenReturn(new ResolvedConfiguration(desired, Map.of()));
    }

    private static Device device(Long id) {
        return Device.builder()
            .id(id)
            .mac("A8032AB1234" + id)
            .ip("10.0.0." + id)
            .name("device-" + id)
            .build();
    }

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) mapper.readTree(text);
    }
}
