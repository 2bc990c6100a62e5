package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceRepository;
import com.platform.fleetsync.error.DuplicateResourceException;
import com.platform.fleetsync.error.ErrorCode;
import com.platform.fleetsync.error.FleetSyncException;
import com.platform.fleetsync.error.ResourceConflictException;
import com.platform.fleetsync.error.ResourceNotFoundException;
import com.platform.fleetsync.error.ValidationException;
import com.platform.fleetsync.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Template CRUD and assignment of templates to devices.
 */
@Slf4j
@Service
public class TemplateService {
    
    public static final Set<String> SCOPES = Set.of("global", "group", "device_type");
    
    private final TemplateRepository templateRepository;
    private final DeviceRepository deviceRepository;
    private final ConfigurationCodec codec;
    private final DeviceConfigurationService configurationService;
    private final StructuredLogger structuredLogger;
    
    public TemplateService(
            TemplateRepository templateRepository,
            DeviceRepository deviceRepository,
            ConfigurationCodec codec,
            DeviceConfigurationService configurationService,
            StructuredLogger structuredLogger) {
        this.templateRepository = templateRepository;
        this.deviceRepository = deviceRepository;
        this.codec = codec;
        this.configurationService = configurationService;
        this.structuredLogger = structuredLogger;
    }
    
    // ==================== CRUD ====================
    
    public List<ConfigTemplate> list(String scope, String deviceType) {
        List<ConfigTemplate> templates = deviceType == null || deviceType.isBlank()
            ? templateRepository.findAll()
            : templateRepository.findForDeviceType(deviceType);
        if (scope == null || scope.isBlank()) {
            return templates;
        }
        return templates.stream()
            .filter(t -> scope.equalsIgnoreCase(t.getScope()))
            .toList();
    }
    
    public ConfigTemplate get(Long id) {
        return templateRepository.findById(id)
            .orElseThrow(() -> ResourceNotFoundException.template(id));
    }
    
    public ConfigTemplate create(ConfigTemplate template) {
        validate(template);
        if (templateRepository.existsByName(template.getName())) {
            throw new DuplicateResourceException("Template", template.getName());
        }
        if (template.getConfig() == null) {
            template.setConfig(JsonNodeFactory.instance.objectNode());
        }
        template.setId(null);
        ConfigTemplate saved = templateRepository.save(template);
        log.info("Template created: {} ({}, scope {})", saved.getName(), saved.getId(), saved.getScope());
        return saved;
    }
    
    /**
     * Replace a template's content and recompute every device that uses it.
     */
    public ConfigTemplate update(Long id, ConfigTemplate changes, String changedBy) {
        ConfigTemplate existing = get(id);
        validate(changes);
        if (!existing.getName().equals(changes.getName())) {
            templateRepository.findByName(changes.getName())
                .filter(other -> !other.getId().equals(id))
                .ifPresent(other -> {
                    throw new DuplicateResourceException("Template", changes.getName());
                });
        }
        
        ConfigTemplate updated = existing.toBuilder()
            .name(changes.getName())
            .description(changes.getDescription())
            .scope(changes.getScope())
            .deviceType(changes.getDeviceType())
            .config(changes.getConfig() != null ? changes.getConfig() : JsonNodeFactory.instance.objectNode())
            .build();
        ConfigTemplate saved = templateRepository.save(updated);
        
        int affected = recomputeAffectedDevices(id, changedBy);
        structuredLogger.configuration().templateChanged(id, saved.getName(), changedBy, affected);
        log.info("Template updated: {} ({}), {} devices recomputed", saved.getName(), id, affected);
        return saved;
    }
    
    /**
     * @throws ResourceConflictException while any device still uses the template
     */
    public void delete(Long id) {
        get(id);
        List<Long> affected = devicesUsing(id);
        if (!affected.isEmpty()) {
            throw new ResourceConflictException(
                "Template " + id + " is used by " + affected.size() + " device(s)");
        }
        templateRepository.deleteById(id);
        log.info("Template deleted: {}", id);
    }
    
    // ==================== Device assignment ====================
    
    public List<ConfigTemplate> getDeviceTemplates(Long deviceId) {
        return configurationService.templatesOf(loadDevice(deviceId));
    }
    
    /**
     * Add a template to the device's list. A template already present stays where
     * it is; {@code position} outside the list appends.
     */
    public Device applyToDevice(Long deviceId, Long templateId, Integer position, String changedBy) {
        Device device = loadDevice(deviceId);
        ConfigTemplate template = get(templateId);
        checkCompatible(template, device);
        
        List<Long> ids = new ArrayList<>(device.getTemplateIds());
        if (ids.contains(templateId)) {
            log.debug("Template {} already applied to device {}", templateId, deviceId);
            return device;
        }
        if (position == null || position < 0 || position >= ids.size()) {
            ids.add(templateId);
        } else {
            ids.add(position, templateId);
        }
        device.setTemplateIds(ids);
        Device saved = configurationService.recomputeDesired(device, changedBy, ConfigHistoryEntry.TEMPLATE);
        log.info("[AUDIT] Template {} applied to device {} by {}", templateId, deviceId, changedBy);
        return saved;
    }
    
    /**
     * Replace the device's template list with {@code templateIds}, in order.
     */
    public Device setDeviceTemplates(Long deviceId, List<Long> templateIds, String changedBy) {
        Device device = loadDevice(deviceId);
        Set<Long> distinct = new LinkedHashSet<>(templateIds);
        if (distinct.size() != templateIds.size()) {
            throw new ValidationException("template_ids", templateIds, "Template ids must not repeat");
        }
        for (Long templateId : distinct) {
            checkCompatible(get(templateId), device);
        }
        device.setTemplateIds(new ArrayList<>(distinct));
        Device saved = configurationService.recomputeDesired(device, changedBy, ConfigHistoryEntry.TEMPLATE);
        log.info("[AUDIT] Templates of device {} set to {} by {}", deviceId, distinct, changedBy);
        return saved;
    }
    
    public Device removeFromDevice(Long deviceId, Long templateId, String changedBy) {
        Device device = loadDevice(deviceId);
        List<Long> ids = new ArrayList<>(device.getTemplateIds());
        if (!ids.remove(templateId)) {
            throw new ResourceNotFoundException("Template assignment", deviceId + "/" + templateId);
        }
        device.setTemplateIds(ids);
        Device saved = configurationService.recomputeDesired(device, changedBy, ConfigHistoryEntry.TEMPLATE);
        log.info("[AUDIT] Template {} removed from device {} by {}", templateId, deviceId, changedBy);
        return saved;
    }
    
    // ==================== Helpers ====================
    
    private void validate(ConfigTemplate template) {
        if (template.getName() == null || template.getName().isBlank()) {
            throw new ValidationException("name", "Template name is required");
        }
        String scope = template.getScope() == null ? "global" : template.getScope();
        if (!SCOPES.contains(scope)) {
            throw new ValidationException("scope", scope, "Scope must be one of " + SCOPES);
        }
        template.setScope(scope);
        if ("device_type".equals(scope)
                && (template.getDeviceType() == null || template.getDeviceType().isBlank()
                    || ConfigTemplate.ALL_DEVICE_TYPES.equals(template.getDeviceType()))) {
            throw new ValidationException("device_type", "A device_type template needs a concrete device type");
        }
        if (template.getDeviceType() == null || template.getDeviceType().isBlank()) {
            template.setDeviceType(ConfigTemplate.ALL_DEVICE_TYPES);
        }
        codec.validate(template.getConfig());
    }
    
    private void checkCompatible(ConfigTemplate template, Device device) {
        String type = device.getModel() != null ? device.getModel() : device.getType();
        if (!template.appliesTo(type) && !template.appliesTo(device.getType())) {
            throw new ValidationException(ErrorCode.INCOMPATIBLE_TEMPLATE, String.format(
                "Template %s targets %s, device %d is %s",
                template.getName(), template.getDeviceType(), device.getId(), type));
        }
    }
    
    private List<Long> devicesUsing(Long templateId) {
        List<Long> affected = new ArrayList<>();
        for (Long deviceId : deviceRepository.findAllIds()) {
            try {
                deviceRepository.findById(deviceId)
                    .filter(d -> d.getTemplateIds().contains(templateId))
                    .ifPresent(d -> affected.add(d.getId()));
            } catch (ValidationException e) {
                log.warn("Skipping device {} while scanning template usage: {}", deviceId, e.getMessage());
            }
        }
        return affected;
    }
    
    private int recomputeAffectedDevices(Long templateId, String changedBy) {
        int count = 0;
        for (Long deviceId : devicesUsing(templateId)) {
            try {
                configurationService.recomputeDesired(loadDevice(deviceId), changedBy, ConfigHistoryEntry.TEMPLATE);
                count++;
            } catch (FleetSyncException e) {
                log.warn("Failed to recompute device {} after template {} changed: {}",
                    deviceId, templateId, e.getMessage());
            }
        }
        return count;
    }
    
    private Device loadDevice(Long deviceId) {
        return deviceRepository.findById(deviceId)
            .orElseThrow(() -> ResourceNotFoundException.device(deviceId));
    }
}
