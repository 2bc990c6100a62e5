package com.platform.fleetsync.device;

import com.platform.fleetsync.credential.DeviceClientCache;
import com.platform.fleetsync.credential.DeviceConnectionService;
import com.platform.fleetsync.discovery.DiscoveryProperties;
import com.platform.fleetsync.error.DuplicateResourceException;
import com.platform.fleetsync.error.FleetSyncException;
import com.platform.fleetsync.error.ResourceNotFoundException;
import com.platform.fleetsync.error.ValidationException;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.persistence.repository.ConfigHistoryJpaRepository;
import com.platform.fleetsync.persistence.repository.DeviceConfigurationJpaRepository;
import com.platform.fleetsync.persistence.repository.DriftReportJpaRepository;
import com.platform.fleetsync.persistence.repository.DriftTrendJpaRepository;
import com.platform.fleetsync.persistence.repository.ResolutionRequestJpaRepository;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.DeviceClientFactory;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.DeviceInfo;
import com.platform.fleetsync.protocol.DeviceStatus;
import com.platform.fleetsync.protocol.Generation;
import com.platform.fleetsync.protocol.ProtocolProperties;
import com.platform.fleetsync.protocol.RootCallContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Inventory and live operations on single devices.
 */
@Slf4j
@Service
public class DeviceService {
    
    private static final Set<String> SWITCH_ACTIONS = Set.of("on", "off", "toggle");
    
    private final DeviceRepository deviceRepository;
    private final DeviceConnectionService connectionService;
    private final DeviceClientCache clientCache;
    private final DeviceClientFactory clientFactory;
    private final RootCallContext rootContext;
    private final ProtocolProperties protocolProperties;
    private final DeviceConfigurationJpaRepository storedConfigRepository;
    private final ConfigHistoryJpaRepository historyRepository;
    private final DriftReportJpaRepository reportRepository;
    private final DriftTrendJpaRepository trendRepository;
    private final ResolutionRequestJpaRepository requestRepository;
    private final DiscoveryProperties discoveryProperties;
    private final StructuredLogger structuredLogger;
    
    public DeviceService(
            DeviceRepository deviceRepository,
            DeviceConnectionService connectionService,
            DeviceClientCache clientCache,
            DeviceClientFactory clientFactory,
            RootCallContext rootContext,
            ProtocolProperties protocolProperties,
            DeviceConfigurationJpaRepository storedConfigRepository,
            ConfigHistoryJpaRepository historyRepository,
            DriftReportJpaRepository reportRepository,
            DriftTrendJpaRepository trendRepository,
            ResolutionRequestJpaRepository requestRepository,
            DiscoveryProperties discoveryProperties,
            StructuredLogger structuredLogger) {
        this.deviceRepository = deviceRepository;
        this.connectionService = connectionService;
        this.clientCache = clientCache;
        this.clientFactory = clientFactory;
        this.rootContext = rootContext;
        this.protocolProperties = protocolProperties;
        this.storedConfigRepository = storedConfigRepository;
        this.historyRepository = historyRepository;
        this.reportRepository = reportRepository;
        this.trendRepository = trendRepository;
        this.requestRepository = requestRepository;
        this.discoveryProperties = discoveryProperties;
        this.structuredLogger = structuredLogger;
    }
    
    // ==================== Inventory ====================
    
    public List<Device> list() {
        return deviceRepository.findAll();
    }
    
    public Device get(Long id) {
        return deviceRepository.findById(id)
            .orElseThrow(() -> ResourceNotFoundException.device(id));
    }
    
    /**
     * Add a device by address. The device is contacted for its generation and identity.
     * 
     * @throws DuplicateResourceException when its hardware address is already known
     */
    public Device add(String ip, String name) {
        DeviceInfo info;
        try (CallContext ctx = rootContext.get().withTimeout(protocolProperties.getTestTimeout())) {
            info = clientFactory.describe(ctx, ip);
        }
        String mac = normalizeMac(info.getMac());
        if (mac.isEmpty()) {
            throw new ValidationException("ip", ip, "Device at " + ip + " did not report a hardware address");
        }
        if (deviceRepository.findByMac(mac).isPresent()) {
            throw new DuplicateResourceException("Device", mac);
        }
        
        Instant now = Instant.now();
        Device device = Device.builder()
            .mac(mac)
            .ip(ip)
            .type(info.deviceType())
            .name(name != null && !name.isBlank() ? name : discoveryProperties.initialName(info, mac))
            .firmware(info.getFirmware())
            .generation(Generation.fromNumber(info.getGeneration()))
            .status(Device.STATUS_ONLINE)
            .lastSeen(now)
            .settings(new DeviceSettings().withDiscovery(info.getModel(), info.getGeneration(), info.isAuthEnabled()))
            .build();
        Device saved = deviceRepository.save(device);
        
        structuredLogger.device().added(saved.getId(), ip, info.getGeneration());
        log.info("Device added: {} ({}, {}, gen{})", saved.getName(), mac, ip, info.getGeneration());
        return saved;
    }
    
    public Device rename(Long id, String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "Device name is required");
        }
        Device device = get(id);
        device.setName(name.trim());
        return deviceRepository.save(device);
    }
    
    /**
     * Delete a device together with its stored configuration, history, drift reports and trends.
     */
    @Transactional
    public void delete(Long id) {
        Device device = get(id);
        storedConfigRepository.deleteByDeviceId(id);
        historyRepository.deleteByDeviceId(id);
        reportRepository.deleteByDeviceId(id);
        trendRepository.deleteByDeviceId(id);
        requestRepository.deleteByDeviceId(id);
        deviceRepository.deleteById(id);
        clientCache.invalidate(device.getIp(), "device_deleted");
        
        structuredLogger.device().removed(id, device.getIp());
        log.info("[AUDIT] Device deleted: {} ({})", id, device.getMac());
    }
    
    // ==================== Live operations ====================
    
    public DeviceStatus getStatus(Long id) {
        Device device = get(id);
        DeviceStatus status = connectionService.execute(device, "get_status",
            protocolProperties.getStatusTimeout(), (client, ctx) -> client.getStatus(ctx));
        markSeen(device);
        return status;
    }
    
    /**
     * Run a control action. {@code on}, {@code off} and {@code toggle} act on
     * the given component channel; {@code reboot} restarts the device.
     */
    public void control(Long id, String action, String component, int channel) {
        String normalized = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
        if (!SWITCH_ACTIONS.contains(normalized) && !"reboot".equals(normalized)) {
            throw new ValidationException("action", action, "Unknown action: " + action);
        }
        Device device = get(id);
        String target = component == null || component.isBlank() ? "switch" : component;
        
        connectionService.execute(device, "control_" + normalized, protocolProperties.getControlTimeout(),
            (client, ctx) -> {
                if ("reboot".equals(normalized)) {
                    client.reboot(ctx);
                } else {
                    client.setComponentState(ctx, target, channel, normalized);
                }
                return null;
            });
        markSeen(device);
        log.info("Device control executed: {} {} on device {} channel {}", normalized, target, id, channel);
    }
    
    /**
     * Set a component to an arbitrary value, e.g. a brightness or a cover position.
     */
    public void setComponentState(Long id, String component, int channel, String value) {
        Device device = get(id);
        connectionService.execute(device, "set_" + component, protocolProperties.getControlTimeout(),
            (client, ctx) -> {
                client.setComponentState(ctx, component, channel, value);
                return null;
            });
        markSeen(device);
    }
    
    /**
     * Authenticated round trip. Failures are reported in the result, not thrown.
     */
    public ConnectionTestResult testConnection(Long id) {
        Device device = get(id);
        long start = System.currentTimeMillis();
        try {
            connectionService.testConnection(device, protocolProperties.getTestTimeout());
            markSeen(device);
            return new ConnectionTestResult(id, device.getIp(), true, device.getGeneration().number(),
                System.currentTimeMillis() - start, null, null);
        } catch (FleetSyncException e) {
            log.info("Connection test failed for device {}: {}", id, e.getMessage());
            return new ConnectionTestResult(id, device.getIp(), false, device.getGeneration().number(),
                System.currentTimeMillis() - start, e.getErrorCode().getCode(), e.getMessage());
        }
    }
    
    // ==================== Credentials ====================
    
    /**
     * Store a credential for the device after verifying it against the device.
     */
    public Device updateCredential(Long id, String username, String password) {
        DeviceCredential credential;
        try {
            credential = new DeviceCredential(username, password);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("credential", e.getMessage());
        }
        Device device = get(id);
        
        try (CallContext ctx = rootContext.get().withTimeout(protocolProperties.getTestTimeout())) {
            clientFactory.create(device.getIp(), device.getGeneration(), credential).testConnection(ctx);
        }
        
        device.setSettings(device.getSettings().withCredential(credential));
        Device saved = deviceRepository.save(device);
        clientCache.invalidate(device.getIp(), "credential_update");
        log.info("[AUDIT] Credential updated on device {} for user {}", id, username);
        return saved;
    }
    
    public Device clearCredential(Long id) {
        Device device = get(id);
        device.setSettings(device.getSettings().withoutCredential());
        Device saved = deviceRepository.save(device);
        clientCache.invalidate(device.getIp(), "credential_update");
        log.info("[AUDIT] Credential cleared on device {}", id);
        return saved;
    }
    
    // ==================== Helpers ====================
    
    private void markSeen(Device device) {
        device.setStatus(Device.STATUS_ONLINE);
        device.setLastSeen(Instant.now());
        deviceRepository.save(device);
    }
    
    /**
     * Upper-case hex without separators, the form devices report in {@code /shelly}.
     */
    public static String normalizeMac(String mac) {
        if (mac == null) {
            return "";
        }
        return mac.replaceAll("[^0-9A-Fa-f]", "").toUpperCase(Locale.ROOT);
    }
}
