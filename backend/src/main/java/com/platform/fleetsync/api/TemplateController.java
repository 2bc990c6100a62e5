package com.platform.fleetsync.api;

import com.platform.fleetsync.configuration.ConfigTemplate;
import com.platform.fleetsync.configuration.TemplateService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for configuration templates.
 */
@RestController
@RequestMapping("/api/templates")
@RequiredArgsConstructor
public class TemplateController {
    
    private final TemplateService templateService;
    
    @GetMapping
    public List<ConfigTemplate> getAllTemplates(
            @RequestParam(required = false) String scope,
            @RequestParam(name = "device_type", required = false) String deviceType) {
        return templateService.list(scope, deviceType);
    }
    
    @GetMapping("/{id}")
    public ConfigTemplate getTemplate(@PathVariable Long id) {
        return templateService.get(id);
    }
    
    @PostMapping
    public ResponseEntity<ConfigTemplate> createTemplate(@Valid @RequestBody ApiRequests.TemplateRequest request) {
        ConfigTemplate created = templateService.create(toTemplate(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
    
    /**
     * Replace a template. Devices using it get their desired configuration recomputed.
     */
    @PutMapping("/{id}")
    public ConfigTemplate updateTemplate(
            @PathVariable Long id,
            @Valid @RequestBody ApiRequests.TemplateRequest request,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return templateService.update(id, toTemplate(request), actor);
    }
    
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable Long id) {
        templateService.delete(id);
        return ResponseEntity.noContent().build();
    }
    
    private static ConfigTemplate toTemplate(ApiRequests.TemplateRequest request) {
        return ConfigTemplate.builder()
            .name(request.getName())
            .description(request.getDescription())
            .scope(request.getScope() != null ? request.getScope() : "global")
            .deviceType(request.getDeviceType())
            .config(request.getConfig())
            .build();
    }
}
