package com.platform.fleetsync.discovery;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.credential.DeviceClientCache;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceRepository;
import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.Generation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiscoveryReconcilerTest {

    private static final Instant SEEN = Instant.parse("2026-03-01T10:15:30.123Z");

    private final Map<String, Device> byMac = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private DeviceRepository deviceRepository;
    private DeviceClientCache clientCache;
    private DiscoveryReconciler reconciler;

    @BeforeEach
    void setUp() {
        deviceRepository = mock(DeviceRepository.class);
        when(deviceRepository.findByMac(anyString()))
            .thenAnswer(invocation -> Optional.ofNullable(byMac.get(invocation.<String>getArgument(0))));
        when(deviceRepository.save(any(Device.class))).thenAnswer(invocation -> {
            Device device = invocation.getArgument(0);
            if (device.getId() == null) {
                device.setId(ids.incrementAndGet());
            }
            byMac.put(device.getMac(), device.toBuilder().build());
            return device;
        });
        clientCache = mock(DeviceClientCache.class);
        reconciler = new DiscoveryReconciler(deviceRepository, clientCache,
            new MetricsRegistry(new SimpleMeterRegistry()), new StructuredLogger());
    }

    @Test
    void reconcile_newDevice_isCreatedWithInitialName() {
        DiscoveryReconciler.Result result = reconciler.reconcile(observed("10.0.0.5", "a8:03:2a:b1:23:45"), "device-B12345");

        assertThat(result.outcome()).isEqualTo(DiscoveryReconciler.Outcome.CREATED);
        Device device = result.device();
        assertThat(device.getMac()).isEqualTo("A8032AB12345");
        assertThat(device.getName()).isEqualTo("device-B12345");
        assertThat(device.getGeneration()).isEqualTo(Generation.GEN2);
        assertThat(device.getModel()).isEqualTo("SNSW-001X16EU");
        assertThat(device.isAuthEnabled()).isTrue();
    }

    @Test
    void reconcile_sameObservationTwice_isIdempotent() {
        DiscoveredDevice observed = observed("10.0.0.5", "A8032AB12345");

        reconciler.reconcile(observed, "first");
        DiscoveryReconciler.Result second = reconciler.reconcile(observed, "second");

        assertThat(second.outcome()).isEqualTo(DiscoveryReconciler.Outcome.UNCHANGED);
        assertThat(byMac).hasSize(1);
        assertThat(byMac.get("A8032AB12345").getName()).isEqualTo("first");
        verify(deviceRepository, times(1)).save(any());
    }

    @Test
    void reconcile_withoutMac_isSkipped() {
        DiscoveryReconciler.Result result = reconciler.reconcile(observed("10.0.0.9", "  "), "x");

        assertThat(result.outcome()).isEqualTo(DiscoveryReconciler.Outcome.SKIPPED);
        verify(deviceRepository, never()).save(any());
    }

    @Test
    void reconcile_addressChange_preservesOwnedFieldsAndInvalidatesClient() {
        ObjectNode overrides = JsonNodeFactory.instance.objectNode();
        overrides.putObject("relay").put("default_state", "on");
        ObjectNode desired = JsonNodeFactory.instance.objectNode();
        desired.putObject("mqtt").put("enable", true);
        Device existing = Device.builder()
            .id(7L)
            .mac("A8032AB12345")
            .ip("10.0.0.5")
            .name("kitchen")
            .generation(Generation.GEN2)
            .templateIds(List.of(3L, 4L))
            .overrides(overrides)
            .desiredConfig(desired)
            .configApplied(true)
            .syncStatus(Device.SYNC_SYNCED)
            .build();
        existing.setSettings(existing.getSettings().withCredential(new DeviceCredential("admin", "pw")));
        byMac.put(existing.getMac(), existing);

        DiscoveryReconciler.Result result = reconciler.reconcile(observed("10.0.0.42", "A8032AB12345"), "ignored");

        assertThat(result.outcome()).isEqualTo(DiscoveryReconciler.Outcome.UPDATED);
        Device updated = result.device();
        assertThat(updated.getIp()).isEqualTo("10.0.0.42");
        assertThat(updated.getName()).isEqualTo("kitchen");
        assertThat(updated.getTemplateIds()).containsExactly(3L, 4L);
        assertThat(updated.getSettings().savedCredential()).isEqualTo(new DeviceCredential("admin", "pw"));
        assertThat(updated.getLastSeen()).isEqualTo(SEEN);
        assertThat(updated.getOverrides()).isEqualTo(overrides);
        assertThat(updated.getDesiredConfig()).isEqualTo(desired);
        assertThat(updated.isConfigApplied()).isTrue();
        assertThat(updated.getSyncStatus()).isEqualTo(Device.SYNC_SYNCED);
        Device persisted = byMac.get("A8032AB12345");
        assertThat(persisted.getIp()).isEqualTo("10.0.0.42");
        assertThat(persisted.getOverrides()).isEqualTo(overrides);
        assertThat(persisted.getDesiredConfig()).isEqualTo(desired);
        assertThat(persisted.isConfigApplied()).isTrue();
        verify(clientCache).invalidate("10.0.0.5", "address_changed");
    }

    @Test
    void reconcile_sameAddress_keepsCachedClient() {
        reconciler.reconcile(observed("10.0.0.5", "A8032AB12345"), "first");
        DiscoveredDevice later = new DiscoveredDevice("10.0.0.5", "A8032AB12345", "SNSW-001X16EU", "1.1.0",
            Device.STATUS_ONLINE, SEEN.plus(1, ChronoUnit.MINUTES), "SNSW-001X16EU", 2, true);

        DiscoveryReconciler.Result result = reconciler.reconcile(later, "second");

        assertThat(result.outcome()).isEqualTo(DiscoveryReconciler.Outcome.UPDATED);
        assertThat(result.device().getFirmware()).isEqualTo("1.1.0");
        verify(clientCache, never()).invalidate(anyString(), anyString());
    }

    private static DiscoveredDevice observed(String ip, String mac) {
        return new DiscoveredDevice(ip, mac, "SNSW-001X16EU", "1.0.8", Device.STATUS_ONLINE, SEEN,
            "SNSW-001X16EU", 2, true);
    }
}
