package com.platform.fleetsync.resolution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.platform.fleetsync.configuration.DeviceConfigurationService;
import com.platform.fleetsync.error.DeviceNetworkException;
import com.platform.fleetsync.error.ResourceConflictException;
import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.persistence.repository.DriftScheduleRunJpaRepository;
import com.platform.fleetsync.persistence.repository.DriftTrendJpaRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResolutionServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ResolutionRepository repository;
    private DeviceConfigurationService configurationService;
    private SimpleMeterRegistry meterRegistry;
    private ResolutionService service;

    @BeforeEach
    void setUp() {
        repository = mock(ResolutionRepository.class);
        configurationService = mock(DeviceConfigurationService.class);
        when(repository.saveRequest(any(ResolutionRequest.class))).thenAnswer(invocation -> invocation.getArgument(0));
        meterRegistry = new SimpleMeterRegistry();
        service = new ResolutionService(repository, mock(DriftTrendJpaRepository.class),
            mock(DriftScheduleRunJpaRepository.class), configurationService, new MetricsRegistry(meterRegistry));
    }

    @Test
    void approve_restoreStrategy_exportsDesiredConfiguration() {
        pending(ResolutionPolicy.STRATEGY_RESTORE, "mqtt.server", TextNode.valueOf("rogue.local"));

        ResolutionRequest result = service.approve(7L, "alice", "put it back");

        verify(configurationService).exportToDevice(42L, "alice");
        verify(configurationService, never()).patchOverrides(anyLong(), any(), anyString());
        assertThat(result.getStatus()).isEqualTo(ResolutionRequest.APPROVED);
        assertThat(result.getOutcome()).isEqualTo(ResolutionRequest.OUTCOME_RESTORED);
        assertThat(result.getExecutedAt()).isNotNull();
        assertThat(meterRegistry.find("fleetsync.resolution.executions").tag("outcome", "restored").counter())
            .isNotNull();
    }

    @Test
    void approve_updateStrategy_copiesLiveValueIntoOverrides() throws Exception {
        pending(ResolutionPolicy.STRATEGY_UPDATE, "mqtt.server", TextNode.valueOf("rogue.local"));

        ResolutionRequest result = service.approve(7L, "alice", "device is right");

        ArgumentCaptor<ObjectNode> patch = ArgumentCaptor.forClass(ObjectNode.class);
        verify(configurationService).patchOverrides(eq(42L), patch.capture(), eq("alice"));
        verify(configurationService, never()).exportToDevice(anyLong(), anyString());
        assertThat(patch.getValue()).isEqualTo(mapper.readTree("{\"mqtt\":{\"server\":\"rogue.local\"}}"));
        assertThat(result.getOutcome()).isEqualTo(ResolutionRequest.OUTCOME_UPDATED);
    }

    @Test
    void approve_updateStrategyOnArrayElement_patchesOnlyThatIndex() throws Exception {
        pending(ResolutionPolicy.STRATEGY_UPDATE, "relays.1.default_state", TextNode.valueOf("off"));

        service.approve(7L, "alice", null);

        ArgumentCaptor<ObjectNode> patch = ArgumentCaptor.forClass(ObjectNode.class);
        verify(configurationService).patchOverrides(eq(42L), patch.capture(), eq("alice"));
        assertThat(patch.getValue())
            .isEqualTo(mapper.readTree("{\"relays\":[null,{\"default_state\":\"off\"}]}"));
    }

    @Test
    void approve_updateStrategyWithoutLiveValue_recordsFailure() {
        pending(ResolutionPolicy.STRATEGY_UPDATE, "mqtt.user", null);

        ResolutionRequest result = service.approve(7L, "alice", null);

        verify(configurationService, never()).patchOverrides(anyLong(), any(), anyString());
        assertThat(result.getStatus()).isEqualTo(ResolutionRequest.APPROVED);
        assertThat(result.getOutcome()).isEqualTo(ResolutionRequest.OUTCOME_FAILED);
        assertThat(result.getOutcomeDetail()).isEqualTo("device reports no value at mqtt.user");
    }

    @Test
    void approve_restoreWhenDeviceUnreachable_recordsFailedOutcome() {
        pending(ResolutionPolicy.STRATEGY_RESTORE, "wifi.ap.enable", BooleanNode.TRUE);
        when(configurationService.exportToDevice(42L, "alice"))
            .thenThrow(DeviceNetworkException.timeout("10.0.0.42", 2, "apply_configuration"));

        ResolutionRequest result = service.approve(7L, "alice", null);

        assertThat(result.getStatus()).isEqualTo(ResolutionRequest.APPROVED);
        assertThat(result.getOutcome()).isEqualTo(ResolutionRequest.OUTCOME_FAILED);
        assertThat(result.getOutcomeDetail()).startsWith("DEVICE_TIMEOUT");
        assertThat(meterRegistry.find("fleetsync.resolution.executions").tag("outcome", "failed").counter())
            .isNotNull();
    }

    @Test
    void reject_pending_doesNotTouchDevice() {
        pending(ResolutionPolicy.STRATEGY_RESTORE, "mqtt.server", TextNode.valueOf("rogue.local"));

        ResolutionRequest result = service.reject(7L, "bob", "expected change");

        assertThat(result.getStatus()).isEqualTo(ResolutionRequest.REJECTED);
        assertThat(result.getOutcome()).isNull();
        verify(configurationService, never()).exportToDevice(anyLong(), anyString());
        verify(configurationService, never()).patchOverrides(anyLong(), any(), anyString());
    }

    @Test
    void approve_alreadyDecided_throwsConflict() {
        ResolutionRequest request = pending(ResolutionPolicy.STRATEGY_RESTORE, "mqtt.server", TextNode.valueOf("x"));
        request.setStatus(ResolutionRequest.REJECTED);

        assertThatThrownBy(() -> service.approve(7L, "alice", null))
            .isInstanceOf(ResourceConflictException.class);
        verify(configurationService, never()).exportToDevice(anyLong(), anyString());
    }

    private ResolutionRequest pending(String strategy, String path, JsonNode actual) {
        ResolutionRequest request = ResolutionRequest.builder()
            .id(7L)
            .deviceId(42L)
            .policyId(3L)
            .path(path)
            .category("network")
            .severity("warning")
            .strategy(strategy)
            .actual(actual)
            .status(ResolutionRequest.PENDING)
            .build();
        when(repository.findRequest(7L)).thenReturn(Optional.of(request));
        return request;
    }
}
