package com.platform.fleetsync.discovery;

import com.platform.fleetsync.credential.DeviceClientCache;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceRepository;
import com.platform.fleetsync.device.DeviceService;
import com.platform.fleetsync.device.DeviceSettings;
import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.protocol.Generation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Folds observed devices into the inventory, keyed by hardware address.
 * 
 * Discovery owns the address, type, firmware, generation, status and last-seen
 * fields, plus the model, generation and auth flag inside the settings blob.
 * Everything else on an existing device (name, stored credential, templates,
 * overrides, desired snapshot) is left as it is.
 */
@Slf4j
@Component
public class DiscoveryReconciler {
    
    public enum Outcome {
        SKIPPED,
        CREATED,
        UPDATED,
        UNCHANGED
    }
    
    public record Result(Outcome outcome, Device device) {
    }
    
    private final DeviceRepository deviceRepository;
    private final DeviceClientCache clientCache;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    
    public DiscoveryReconciler(
            DeviceRepository deviceRepository,
            DeviceClientCache clientCache,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.deviceRepository = deviceRepository;
        this.clientCache = clientCache;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }
    
    /**
     * Create or update the device with the observed hardware address.
     * An observation without a hardware address changes nothing.
     */
    public Result reconcile(DiscoveredDevice observed, String initialName) {
        String mac = DeviceService.normalizeMac(observed.mac());
        if (mac.isEmpty()) {
            log.debug("Skipping device at {} without hardware address", observed.ip());
            return new Result(Outcome.SKIPPED, null);
        }
        
        Optional<Device> existing = deviceRepository.findByMac(mac);
        if (existing.isPresent()) {
            return update(existing.get(), observed);
        }
        
        try {
            return create(mac, observed, initialName);
        } catch (DataIntegrityViolationException e) {
            // created concurrently by another scan
            log.debug("Device {} appeared while creating it, updating instead", mac);
            Device concurrent = deviceRepository.findByMac(mac).orElseThrow(() -> e);
            return update(concurrent, observed);
        }
    }
    
    private Result create(String mac, DiscoveredDevice observed, String initialName) {
        Device device = Device.builder()
            .mac(mac)
            .ip(observed.ip())
            .type(observed.type())
            .name(initialName)
            .firmware(observed.firmware())
            .generation(observed.generation() != null ? Generation.fromNumber(observed.generation()) : Generation.GEN1)
            .status(observed.status())
            .lastSeen(observed.discoveredAt())
            .settings(new DeviceSettings().withDiscovery(observed.model(), observed.generation(), observed.authEnabled()))
            .build();
        Device saved = deviceRepository.save(device);
        
        metricsRegistry.recordDiscoveryUpsert(true);
        structuredLogger.discovery().deviceCreated(saved.getId(), mac, saved.getIp());
        log.info("Discovered new device {} at {} ({})", mac, saved.getIp(), saved.getType());
        return new Result(Outcome.CREATED, saved);
    }
    
    private Result update(Device device, DiscoveredDevice observed) {
        String previousIp = device.getIp();
        Generation generation = observed.generation() != null
            ? Generation.fromNumber(observed.generation())
            : device.getGeneration();
        DeviceSettings settings = device.getSettings() != null ? device.getSettings() : new DeviceSettings();
        DeviceSettings merged = settings.withDiscovery(observed.model(), observed.generation(), observed.authEnabled());
        
        boolean changed = !Objects.equals(previousIp, observed.ip())
            || !Objects.equals(device.getType(), observed.type())
            || !Objects.equals(device.getFirmware(), observed.firmware())
            || !Objects.equals(device.getStatus(), observed.status())
            || !Objects.equals(device.getLastSeen(), observed.discoveredAt())
            || device.getGeneration() != generation
            || !Objects.equals(settings, merged);
        if (!changed) {
            return new Result(Outcome.UNCHANGED, device);
        }
        
        device.setIp(observed.ip());
        device.setType(observed.type());
        device.setFirmware(observed.firmware());
        device.setStatus(observed.status());
        device.setLastSeen(observed.discoveredAt());
        device.setGeneration(generation);
        device.setSettings(merged);
        Device saved = deviceRepository.save(device);
        
        if (!Objects.equals(previousIp, observed.ip())) {
            clientCache.invalidate(previousIp, "address_changed");
            log.info("Device {} moved from {} to {}", saved.getMac(), previousIp, observed.ip());
        }
        metricsRegistry.recordDiscoveryUpsert(false);
        structuredLogger.discovery().deviceUpdated(saved.getId(), saved.getMac(), saved.getIp(), previousIp);
        return new Result(Outcome.UPDATED, saved);
    }
}
