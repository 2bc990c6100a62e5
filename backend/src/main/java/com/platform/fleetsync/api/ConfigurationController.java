package com.platform.fleetsync.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.configuration.CapabilityView;
import com.platform.fleetsync.configuration.ConfigHistoryEntry;
import com.platform.fleetsync.configuration.ConfigStatus;
import com.platform.fleetsync.configuration.ConfigTemplate;
import com.platform.fleetsync.configuration.DeviceConfigurationService;
import com.platform.fleetsync.configuration.ResolvedConfiguration;
import com.platform.fleetsync.configuration.StoredConfiguration;
import com.platform.fleetsync.configuration.TemplateService;
import com.platform.fleetsync.device.Device;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for a device's configuration: stored, desired, overrides,
 * capability groups, templates and history.
 */
@RestController
@RequestMapping("/api/devices/{deviceId}/config")
@RequiredArgsConstructor
public class ConfigurationController {
    
    private final DeviceConfigurationService configurationService;
    private final TemplateService templateService;
    
    /**
     * Last configuration imported from or exported to the device.
     */
    @GetMapping
    public StoredConfiguration getStored(@PathVariable Long deviceId) {
        return configurationService.getStored(deviceId);
    }
    
    @GetMapping("/desired")
    public ResolvedConfiguration getDesired(@PathVariable Long deviceId) {
        return configurationService.getDesired(deviceId);
    }
    
    @GetMapping("/status")
    public ConfigStatus getStatus(@PathVariable Long deviceId) {
        return configurationService.getStatus(deviceId);
    }
    
    @GetMapping("/history")
    public List<ConfigHistoryEntry> getHistory(
            @PathVariable Long deviceId,
            @RequestParam(defaultValue = "50") int limit) {
        return configurationService.getHistory(deviceId, Math.max(1, Math.min(limit, 500)));
    }
    
    @PostMapping("/import")
    public StoredConfiguration importFromDevice(
            @PathVariable Long deviceId,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return configurationService.importFromDevice(deviceId, actor);
    }
    
    @PostMapping("/export")
    public StoredConfiguration exportToDevice(
            @PathVariable Long deviceId,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return configurationService.exportToDevice(deviceId, actor);
    }
    
    // ==================== Overrides ====================
    
    /**
     * The device-level override; an empty object when none is set.
     */
    @GetMapping("/overrides")
    public ObjectNode getOverrides(@PathVariable Long deviceId) {
        return configurationService.getOverrides(deviceId);
    }
    
    @PutMapping("/overrides")
    public ResolvedConfiguration setOverrides(
            @PathVariable Long deviceId,
            @RequestBody ObjectNode overrides,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return configurationService.setOverrides(deviceId, overrides, actor);
    }
    
    @PatchMapping("/overrides")
    public ResolvedConfiguration patchOverrides(
            @PathVariable Long deviceId,
            @RequestBody ObjectNode patch,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return configurationService.patchOverrides(deviceId, patch, actor);
    }
    
    @DeleteMapping("/overrides")
    public ResolvedConfiguration clearOverrides(
            @PathVariable Long deviceId,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return configurationService.clearOverrides(deviceId, actor);
    }
    
    // ==================== Capability groups ====================
    
    @GetMapping("/capabilities/{group}")
    public CapabilityView getCapability(@PathVariable Long deviceId, @PathVariable String group) {
        return configurationService.getCapability(deviceId, group);
    }
    
    @PutMapping("/capabilities/{group}")
    public CapabilityView setCapability(
            @PathVariable Long deviceId,
            @PathVariable String group,
            @RequestBody ObjectNode value,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return configurationService.setCapability(deviceId, group, value, actor);
    }
    
    // ==================== Templates ====================
    
    @GetMapping("/templates")
    public List<ConfigTemplate> getTemplates(@PathVariable Long deviceId) {
        return templateService.getDeviceTemplates(deviceId);
    }
    
    /**
     * Replace the device's template list with the given order.
     */
    @PutMapping("/templates")
    public Device setTemplates(
            @PathVariable Long deviceId,
            @Valid @RequestBody ApiRequests.TemplateOrderRequest request,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return templateService.setDeviceTemplates(deviceId, request.getTemplateIds(), actor);
    }
    
    @PostMapping("/templates/{templateId}")
    public Device applyTemplate(
            @PathVariable Long deviceId,
            @PathVariable Long templateId,
            @RequestParam(required = false) Integer position,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return templateService.applyToDevice(deviceId, templateId, position, actor);
    }
    
    @DeleteMapping("/templates/{templateId}")
    public Device removeTemplate(
            @PathVariable Long deviceId,
            @PathVariable Long templateId,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return templateService.removeFromDevice(deviceId, templateId, actor);
    }
}
