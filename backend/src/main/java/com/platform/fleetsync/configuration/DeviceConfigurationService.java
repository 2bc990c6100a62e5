package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.platform.fleetsync.credential.DeviceConnectionService;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceRepository;
import com.platform.fleetsync.error.ErrorCode;
import com.platform.fleetsync.error.ResourceNotFoundException;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.persistence.EntityMappers;
import com.platform.fleetsync.persistence.entity.DeviceConfigurationEntity;
import com.platform.fleetsync.persistence.repository.ConfigHistoryJpaRepository;
import com.platform.fleetsync.persistence.repository.DeviceConfigurationJpaRepository;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.ProtocolProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-device configuration: overrides, the resolved desired configuration,
 * stored snapshots and their audit trail, and import/export against the device.
 */
@Slf4j
@Service
public class DeviceConfigurationService {
    
    private static final Set<String> SECRET_FIELDS = Set.of("password", "pass", "key", "auth_pass");
    private static final String MASK = "********";
    
    private final DeviceRepository deviceRepository;
    private final TemplateRepository templateRepository;
    private final HierarchyResolver hierarchyResolver;
    private final ConfigurationCodec codec;
    private final ConfigNormalizer normalizer;
    private final DeviceConnectionService connectionService;
    private final ProtocolProperties protocolProperties;
    private final DeviceConfigurationJpaRepository storedRepository;
    private final ConfigHistoryJpaRepository historyRepository;
    private final EntityMappers entityMappers;
    private final StructuredLogger structuredLogger;
    
    public DeviceConfigurationService(
            DeviceRepository deviceRepository,
            TemplateRepository templateRepository,
            HierarchyResolver hierarchyResolver,
            ConfigurationCodec codec,
            ConfigNormalizer normalizer,
            DeviceConnectionService connectionService,
            ProtocolProperties protocolProperties,
            DeviceConfigurationJpaRepository storedRepository,
            ConfigHistoryJpaRepository historyRepository,
            EntityMappers entityMappers,
            StructuredLogger structuredLogger) {
        this.deviceRepository = deviceRepository;
        this.templateRepository = templateRepository;
        this.hierarchyResolver = hierarchyResolver;
        this.codec = codec;
        this.normalizer = normalizer;
        this.connectionService = connectionService;
        this.protocolProperties = protocolProperties;
        this.storedRepository = storedRepository;
        this.historyRepository = historyRepository;
        this.entityMappers = entityMappers;
        this.structuredLogger = structuredLogger;
    }
    
    // ==================== Desired configuration ====================
    
    public ResolvedConfiguration getDesired(Long deviceId) {
        return resolve(loadDevice(deviceId));
    }
    
    public ResolvedConfiguration resolve(Device device) {
        return hierarchyResolver.resolve(templatesOf(device), device.getOverrides());
    }
    
    /**
     * Templates of a device in resolution order. Ids that no longer resolve are skipped.
     */
    public List<ConfigTemplate> templatesOf(Device device) {
        List<ConfigTemplate> templates = new ArrayList<>();
        for (Long templateId : device.getTemplateIds()) {
            templateRepository.findById(templateId).ifPresentOrElse(
                templates::add,
                () -> log.warn("Device {} references missing template {}", device.getId(), templateId));
        }
        return templates;
    }
    
    /**
     * Recompute and store the desired snapshot. A changed snapshot marks the
     * configuration as not applied.
     */
    public Device recomputeDesired(Device device, String changedBy, String action) {
        ObjectNode previous = device.getDesiredConfig();
        ObjectNode desired = resolve(device).config();
        if (desired.equals(previous)) {
            return deviceRepository.save(device);
        }
        device.setDesiredConfig(desired);
        device.setConfigApplied(false);
        Device saved = deviceRepository.save(device);
        recordHistory(saved.getId(), action, previous, desired, changedBy);
        structuredLogger.configuration().desiredChanged(saved.getId(), action, changedBy, desired.size());
        log.debug("Recomputed desired configuration for device {} ({} groups)", saved.getId(), desired.size());
        return saved;
    }
    
    // ==================== Overrides ====================
    
    public ObjectNode getOverrides(Long deviceId) {
        ObjectNode overrides = loadDevice(deviceId).getOverrides();
        return overrides != null ? overrides : JsonNodeFactory.instance.objectNode();
    }
    
    public ResolvedConfiguration setOverrides(Long deviceId, ObjectNode overrides, String changedBy) {
        codec.validate(overrides);
        Device device = loadDevice(deviceId);
        device.setOverrides(overrides == null || overrides.isEmpty() ? null : overrides.deepCopy());
        Device saved = recomputeDesired(device, changedBy, ConfigHistoryEntry.OVERRIDE);
        log.info("Overrides set on device {} by {}", deviceId, changedBy);
        return resolve(saved);
    }
    
    /**
     * Overlay {@code patch} onto the current override with the resolver's merge rules.
     */
    public ResolvedConfiguration patchOverrides(Long deviceId, ObjectNode patch, String changedBy) {
        codec.validate(patch);
        Device device = loadDevice(deviceId);
        ObjectNode merged = HierarchyResolver.overlay(device.getOverrides(), patch);
        codec.validate(merged);
        device.setOverrides(merged.isEmpty() ? null : merged);
        Device saved = recomputeDesired(device, changedBy, ConfigHistoryEntry.OVERRIDE);
        return resolve(saved);
    }
    
    public ResolvedConfiguration clearOverrides(Long deviceId, String changedBy) {
        Device device = loadDevice(deviceId);
        device.setOverrides(null);
        Device saved = recomputeDesired(device, changedBy, ConfigHistoryEntry.OVERRIDE);
        log.info("Overrides cleared on device {} by {}", deviceId, changedBy);
        return resolve(saved);
    }
    
    // ==================== Capability groups ====================
    
    public CapabilityView getCapability(Long deviceId, String groupKey) {
        CapabilityGroup group = CapabilityGroup.fromKey(groupKey);
        Device device = loadDevice(deviceId);
        ResolvedConfiguration resolved = resolve(device);
        
        Map<String, String> sources = new LinkedHashMap<>();
        resolved.sources().forEach((path, source) -> {
            if (path.equals(group.getKey()) || path.startsWith(group.getKey() + ".")) {
                sources.put(path, source);
            }
        });
        JsonNode override = device.getOverrides() != null ? device.getOverrides().get(group.getKey()) : null;
        return new CapabilityView(group.getKey(), resolved.config().get(group.getKey()), override, sources);
    }
    
    /**
     * Replace one group of the device override.
     */
    public CapabilityView setCapability(Long deviceId, String groupKey, ObjectNode value, String changedBy) {
        CapabilityGroup group = CapabilityGroup.fromKey(groupKey);
        codec.readGroup(group, value);
        
        Device device = loadDevice(deviceId);
        ObjectNode overrides = device.getOverrides() != null
            ? device.getOverrides().deepCopy()
            : JsonNodeFactory.instance.objectNode();
        if (value.isEmpty()) {
            overrides.remove(group.getKey());
        } else {
            overrides.set(group.getKey(), value.deepCopy());
        }
        device.setOverrides(overrides.isEmpty() ? null : overrides);
        recomputeDesired(device, changedBy, ConfigHistoryEntry.OVERRIDE);
        log.info("Capability {} set on device {} by {}", group.getKey(), deviceId, changedBy);
        return getCapability(deviceId, group.getKey());
    }
    
    // ==================== Live configuration ====================
    
    /**
     * Fetch the device's configuration and normalize it into the canonical schema.
     */
    public ObjectNode fetchLive(Device device) {
        return fetchLive(device, null);
    }
    
    public ObjectNode fetchLive(Device device, CallContext parent) {
        JsonNode raw = connectionService.execute(device, "get_configuration",
            protocolProperties.getConfigTimeout(), parent, (client, ctx) -> client.getConfiguration(ctx));
        return normalizer.normalize(device.getGeneration(), raw);
    }
    
    public StoredConfiguration getStored(Long deviceId) {
        loadDevice(deviceId);
        return storedRepository.findByDeviceId(deviceId)
            .map(entityMappers::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.CONFIGURATION_NOT_FOUND,
                "Stored configuration", String.valueOf(deviceId)));
    }
    
    public StoredConfiguration importFromDevice(Long deviceId, String changedBy) {
        Device device = loadDevice(deviceId);
        ObjectNode live = fetchLive(device);
        StoredConfiguration stored = store(device.getId(), live, ConfigHistoryEntry.IMPORT, changedBy);
        structuredLogger.device().configApplied(device.getId(), device.getIp(), ConfigHistoryEntry.IMPORT, live.size());
        log.info("Imported configuration from device {} ({} groups)", deviceId, live.size());
        return stored;
    }
    
    /**
     * Push the resolved desired configuration to the device.
     */
    public StoredConfiguration exportToDevice(Long deviceId, String changedBy) {
        Device device = loadDevice(deviceId);
        ObjectNode desired = resolve(device).config();
        connectionService.execute(device, "apply_configuration", protocolProperties.getConfigTimeout(),
            (client, ctx) -> {
                client.applyConfiguration(ctx, desired);
                return null;
            });
        
        Instant now = Instant.now();
        device.setDesiredConfig(desired);
        device.setConfigApplied(true);
        device.setLastSynced(now);
        deviceRepository.save(device);
        
        StoredConfiguration stored = store(device.getId(), desired, ConfigHistoryEntry.EXPORT, changedBy);
        structuredLogger.device().configApplied(device.getId(), device.getIp(), ConfigHistoryEntry.EXPORT, desired.size());
        log.info("[AUDIT] Exported desired configuration to device {} by {}", deviceId, changedBy);
        return stored;
    }
    
    private StoredConfiguration store(Long deviceId, ObjectNode config, String action, String changedBy) {
        DeviceConfigurationEntity entity = storedRepository.findByDeviceId(deviceId)
            .orElseGet(() -> DeviceConfigurationEntity.builder().deviceId(deviceId).build());
        ObjectNode previous = entity.getConfigJson() != null
            ? entityMappers.readObject(entity.getConfigJson(), "stored configuration of device " + deviceId, "config")
            : null;
        entity.setConfigJson(entityMappers.write(config));
        entity.setLastSynced(Instant.now());
        StoredConfiguration saved = entityMappers.toDomain(storedRepository.save(entity));
        recordHistory(deviceId, action, previous, config, changedBy);
        return saved;
    }
    
    // ==================== History and status ====================
    
    public List<ConfigHistoryEntry> getHistory(Long deviceId, int limit) {
        loadDevice(deviceId);
        return historyRepository.findByDeviceIdOrderByCreatedAtDescIdDesc(deviceId, PageRequest.of(0, Math.max(1, limit)))
            .stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    public ConfigStatus getStatus(Long deviceId) {
        Device device = loadDevice(deviceId);
        return new ConfigStatus(
            device.getId(),
            device.isConfigApplied(),
            device.getOverrides() != null && !device.getOverrides().isEmpty(),
            device.getTemplateIds().size(),
            device.getSyncStatus(),
            device.getLastSynced(),
            device.getUpdatedAt());
    }
    
    void recordHistory(Long deviceId, String action, ObjectNode oldConfig, ObjectNode newConfig, String changedBy) {
        ConfigHistoryEntry entry = ConfigHistoryEntry.builder()
            .deviceId(deviceId)
            .action(action)
            .oldConfig(maskSecrets(oldConfig))
            .newConfig(maskSecrets(newConfig))
            .changedBy(changedBy)
            .createdAt(Instant.now())
            .build();
        historyRepository.save(entityMappers.toEntity(entry));
    }
    
    /**
     * Copy of {@code config} with every secret-named field replaced by a mask.
     */
    static ObjectNode maskSecrets(ObjectNode config) {
        if (config == null) {
            return null;
        }
        ObjectNode copy = config.deepCopy();
        maskInPlace(copy);
        return copy;
    }
    
    private static void maskInPlace(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> it = object.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (SECRET_FIELDS.contains(entry.getKey()) && entry.getValue().isValueNode() && !entry.getValue().isNull()) {
                    entry.setValue(TextNode.valueOf(MASK));
                } else {
                    maskInPlace(entry.getValue());
                }
            }
        } else if (node != null && node.isArray()) {
            node.forEach(DeviceConfigurationService::maskInPlace);
        }
    }
    
    private Device loadDevice(Long deviceId) {
        return deviceRepository.findById(deviceId)
            .orElseThrow(() -> ResourceNotFoundException.device(deviceId));
    }
}
