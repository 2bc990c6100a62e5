package com.platform.fleetsync.api;

import com.platform.fleetsync.resolution.ResolutionMetrics;
import com.platform.fleetsync.resolution.ResolutionPolicy;
import com.platform.fleetsync.resolution.ResolutionRequest;
import com.platform.fleetsync.resolution.ResolutionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for resolution policies and the requests raised from drift.
 */
@RestController
@RequestMapping("/api/resolution")
@RequiredArgsConstructor
public class ResolutionController {
    
    private final ResolutionService resolutionService;
    
    // ==================== Policies ====================
    
    @GetMapping("/policies")
    public List<ResolutionPolicy> getAllPolicies() {
        return resolutionService.listPolicies();
    }
    
    @GetMapping("/policies/{id}")
    public ResolutionPolicy getPolicy(@PathVariable Long id) {
        return resolutionService.getPolicy(id);
    }
    
    @PostMapping("/policies")
    public ResponseEntity<ResolutionPolicy> createPolicy(@Valid @RequestBody ApiRequests.PolicyRequest request) {
        ResolutionPolicy created = resolutionService.createPolicy(toPolicy(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
    
    @PutMapping("/policies/{id}")
    public ResolutionPolicy updatePolicy(@PathVariable Long id, @Valid @RequestBody ApiRequests.PolicyRequest request) {
        return resolutionService.updatePolicy(id, toPolicy(request));
    }
    
    @DeleteMapping("/policies/{id}")
    public ResponseEntity<Void> deletePolicy(@PathVariable Long id) {
        resolutionService.deletePolicy(id);
        return ResponseEntity.noContent().build();
    }
    
    // ==================== Requests ====================
    
    @GetMapping("/requests")
    public List<ResolutionRequest> getRequests(
            @RequestParam(required = false) String status,
            @RequestParam(name = "device_id", required = false) Long deviceId,
            @RequestParam(defaultValue = "100") int limit) {
        return resolutionService.listRequests(status, deviceId, Math.max(1, Math.min(limit, 500)));
    }
    
    @GetMapping("/requests/{id}")
    public ResolutionRequest getRequest(@PathVariable Long id) {
        return resolutionService.getRequest(id);
    }
    
    @PostMapping("/requests/{id}/approve")
    public ResolutionRequest approve(
            @PathVariable Long id,
            @Valid @RequestBody(required = false) ApiRequests.DecisionRequest request,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return resolutionService.approve(id, actor, request != null ? request.getReason() : null);
    }
    
    @PostMapping("/requests/{id}/reject")
    public ResolutionRequest reject(
            @PathVariable Long id,
            @Valid @RequestBody(required = false) ApiRequests.DecisionRequest request,
            @RequestHeader(value = ApiHeaders.ACTOR, defaultValue = ApiHeaders.DEFAULT_ACTOR) String actor) {
        return resolutionService.reject(id, actor, request != null ? request.getReason() : null);
    }
    
    @GetMapping("/metrics")
    public ResolutionMetrics getMetrics() {
        return resolutionService.metrics();
    }
    
    private static ResolutionPolicy toPolicy(ApiRequests.PolicyRequest request) {
        return ResolutionPolicy.builder()
            .name(request.getName())
            .category(request.getCategory())
            .strategy(request.getStrategy())
            .enabled(request.getEnabled() == null || request.getEnabled())
            .priority(request.getPriority())
            .description(request.getDescription())
            .build();
    }
}
