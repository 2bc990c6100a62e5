package com.platform.fleetsync.resolution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.configuration.DeviceConfigurationService;
import com.platform.fleetsync.drift.FieldDelta;
import com.platform.fleetsync.error.DuplicateResourceException;
import com.platform.fleetsync.error.FleetSyncException;
import com.platform.fleetsync.error.ResourceConflictException;
import com.platform.fleetsync.error.ResourceNotFoundException;
import com.platform.fleetsync.error.ValidationException;
import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.persistence.repository.DriftScheduleRunJpaRepository;
import com.platform.fleetsync.persistence.repository.DriftTrendJpaRepository;
import com.platform.fleetsync.schedule.DriftScheduleRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolution policies, the requests raised for drifted fields, and their decisions.
 * 
 * Approving a request applies its strategy right away: {@code restore} pushes the
 * resolved desired configuration back to the device, {@code update} adopts the
 * live value as a device override. The result is recorded on the request.
 */
@Slf4j
@Service
public class ResolutionService {
    
    private final ResolutionRepository repository;
    private final DriftTrendJpaRepository trendJpaRepository;
    private final DriftScheduleRunJpaRepository runJpaRepository;
    private final DeviceConfigurationService configurationService;
    private final MetricsRegistry metricsRegistry;
    
    public ResolutionService(
            ResolutionRepository repository,
            DriftTrendJpaRepository trendJpaRepository,
            DriftScheduleRunJpaRepository runJpaRepository,
            DeviceConfigurationService configurationService,
            MetricsRegistry metricsRegistry) {
        this.repository = repository;
        this.trendJpaRepository = trendJpaRepository;
        this.runJpaRepository = runJpaRepository;
        this.configurationService = configurationService;
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Policies ====================
    
    public List<ResolutionPolicy> listPolicies() {
        return repository.findAllPolicies();
    }
    
    public ResolutionPolicy getPolicy(Long id) {
        return repository.findPolicy(id)
            .orElseThrow(() -> new ResourceNotFoundException("ResolutionPolicy", id));
    }
    
    public ResolutionPolicy createPolicy(ResolutionPolicy policy) {
        validate(policy);
        if (repository.policyNameExists(policy.getName())) {
            throw new DuplicateResourceException("ResolutionPolicy", policy.getName());
        }
        policy.setId(null);
        ResolutionPolicy saved = repository.savePolicy(policy);
        log.info("Resolution policy created: {} ({} -> {})", saved.getName(), saved.getCategory(), saved.getStrategy());
        return saved;
    }
    
    public ResolutionPolicy updatePolicy(Long id, ResolutionPolicy changes) {
        ResolutionPolicy existing = getPolicy(id);
        validate(changes);
        if (!existing.getName().equals(changes.getName()) && repository.policyNameExists(changes.getName())) {
            throw new DuplicateResourceException("ResolutionPolicy", changes.getName());
        }
        ResolutionPolicy updated = existing.toBuilder()
            .name(changes.getName())
            .category(changes.getCategory())
            .strategy(changes.getStrategy())
            .enabled(changes.isEnabled())
            .priority(changes.getPriority())
            .description(changes.getDescription())
            .build();
        return repository.savePolicy(updated);
    }
    
    public void deletePolicy(Long id) {
        if (!repository.deletePolicy(id)) {
            throw new ResourceNotFoundException("ResolutionPolicy", id);
        }
        log.info("Resolution policy deleted: {}", id);
    }
    
    private void validate(ResolutionPolicy policy) {
        if (policy.getName() == null || policy.getName().isBlank()) {
            throw new ValidationException("name", "Policy name is required");
        }
        if (!ResolutionPolicy.CATEGORIES.contains(policy.getCategory())) {
            throw new ValidationException("category", policy.getCategory(),
                "Category must be one of " + ResolutionPolicy.CATEGORIES);
        }
        if (!ResolutionPolicy.STRATEGIES.contains(policy.getStrategy())) {
            throw new ValidationException("strategy", policy.getStrategy(),
                "Strategy must be one of " + ResolutionPolicy.STRATEGIES);
        }
        if (policy.getPriority() == null) {
            policy.setPriority("medium");
        } else if (!ResolutionPolicy.PRIORITIES.contains(policy.getPriority())) {
            throw new ValidationException("priority", policy.getPriority(),
                "Priority must be one of " + ResolutionPolicy.PRIORITIES);
        }
    }
    
    // ==================== Requests ====================
    
    /**
     * Raise a pending request for each drifted field covered by an enabled,
     * non-ignore policy. A field that already has a pending request is skipped.
     *
     * @return number of requests created
     */
    public int raiseRequests(Long deviceId, List<FieldDelta> deltas) {
        int created = 0;
        for (FieldDelta delta : deltas) {
            if (!delta.kind().isDrift()) {
                continue;
            }
            Optional<ResolutionPolicy> policy = policyFor(delta.category());
            if (policy.isEmpty() || repository.hasPendingRequest(deviceId, delta.path())) {
                continue;
            }
            repository.saveRequest(ResolutionRequest.builder()
                .deviceId(deviceId)
                .policyId(policy.get().getId())
                .path(delta.path())
                .category(delta.category())
                .severity(delta.severity())
                .strategy(policy.get().getStrategy())
                .expected(delta.expected())
                .actual(delta.actual())
                .status(ResolutionRequest.PENDING)
                .build());
            created++;
        }
        if (created > 0) {
            metricsRegistry.incrementCounter("fleetsync.resolution.requests.created");
            log.info("Raised {} resolution request(s) for device {}", created, deviceId);
        }
        return created;
    }
    
    /**
     * Highest-priority enabled policy for the category, ignoring {@code ignore} policies.
     */
    Optional<ResolutionPolicy> policyFor(String category) {
        List<ResolutionPolicy> policies = repository.findEnabledPolicies(category);
        boolean ignored = policies.stream()
            .anyMatch(p -> ResolutionPolicy.STRATEGY_IGNORE.equals(p.getStrategy()));
        if (ignored) {
            return Optional.empty();
        }
        return policies.stream()
            .max(Comparator.comparingInt(ResolutionPolicy::priorityRank));
    }
    
    public List<ResolutionRequest> listRequests(String status, Long deviceId, int limit) {
        return repository.findRequests(status, deviceId, limit);
    }
    
    public ResolutionRequest getRequest(Long id) {
        return repository.findRequest(id)
            .orElseThrow(() -> new ResourceNotFoundException("ResolutionRequest", id));
    }
    
    /**
     * Approve a pending request and apply its strategy. A failed application
     * leaves the request approved with outcome {@code failed} and the error as detail.
     */
    public ResolutionRequest approve(Long id, String decidedBy, String reason) {
        ResolutionRequest approved = decide(id, ResolutionRequest.APPROVED, decidedBy, reason);
        return execute(approved, decidedBy);
    }
    
    public ResolutionRequest reject(Long id, String decidedBy, String reason) {
        return decide(id, ResolutionRequest.REJECTED, decidedBy, reason);
    }
    
    private ResolutionRequest decide(Long id, String status, String decidedBy, String reason) {
        ResolutionRequest request = getRequest(id);
        if (!ResolutionRequest.PENDING.equals(request.getStatus())) {
            throw new ResourceConflictException(
                "Resolution request " + id + " is already " + request.getStatus());
        }
        request.setStatus(status);
        request.setDecidedAt(Instant.now());
        request.setDecidedBy(decidedBy);
        request.setDecisionReason(reason);
        ResolutionRequest saved = repository.saveRequest(request);
        
        metricsRegistry.incrementCounter("fleetsync.resolution.decisions", "status", status);
        log.info("[AUDIT] Resolution request {} {} by {} (device {}, path {})",
            id, status, decidedBy, saved.getDeviceId(), saved.getPath());
        return saved;
    }
    
    private ResolutionRequest execute(ResolutionRequest request, String decidedBy) {
        String outcome;
        String detail;
        try {
            if (ResolutionPolicy.STRATEGY_RESTORE.equals(request.getStrategy())) {
                configurationService.exportToDevice(request.getDeviceId(), decidedBy);
                outcome = ResolutionRequest.OUTCOME_RESTORED;
                detail = "desired configuration re-applied to device";
            } else if (ResolutionPolicy.STRATEGY_UPDATE.equals(request.getStrategy())) {
                JsonNode live = request.getActual();
                if (live == null || live.isNull() || live.isMissingNode()) {
                    outcome = ResolutionRequest.OUTCOME_FAILED;
                    detail = "device reports no value at " + request.getPath();
                } else {
                    configurationService.patchOverrides(request.getDeviceId(), patchFor(request.getPath(), live), decidedBy);
                    outcome = ResolutionRequest.OUTCOME_UPDATED;
                    detail = "override set to live value " + live;
                }
            } else {
                outcome = ResolutionRequest.OUTCOME_FAILED;
                detail = "strategy " + request.getStrategy() + " cannot be applied";
            }
        } catch (FleetSyncException e) {
            log.warn("Resolution request {} approved but {} failed for device {}: [{}] {}",
                request.getId(), request.getStrategy(), request.getDeviceId(), e.getErrorCode(), e.getMessage());
            outcome = ResolutionRequest.OUTCOME_FAILED;
            detail = e.getErrorCode() + ": " + e.getMessage();
        }
        
        request.setOutcome(outcome);
        request.setOutcomeDetail(detail);
        request.setExecutedAt(Instant.now());
        ResolutionRequest saved = repository.saveRequest(request);
        metricsRegistry.incrementCounter("fleetsync.resolution.executions", "outcome", outcome);
        log.info("[AUDIT] Resolution request {} {} (device {}, path {}): {}",
            saved.getId(), outcome, saved.getDeviceId(), saved.getPath(), detail);
        return saved;
    }
    
    /**
     * Nested patch placing {@code value} at a dotted path. Numeric segments
     * address array elements; preceding slots are null so the merge keeps them.
     */
    static ObjectNode patchFor(String path, JsonNode value) {
        String[] segments = path.split("\\.");
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        JsonNode container = root;
        for (int i = 0; i < segments.length; i++) {
            JsonNode child;
            if (i == segments.length - 1) {
                child = value.deepCopy();
            } else if (isIndex(segments[i + 1])) {
                child = JsonNodeFactory.instance.arrayNode();
            } else {
                child = JsonNodeFactory.instance.objectNode();
            }
            if (container instanceof ArrayNode array) {
                int index = Integer.parseInt(segments[i]);
                while (array.size() < index) {
                    array.addNull();
                }
                array.add(child);
            } else {
                ((ObjectNode) container).set(segments[i], child);
            }
            container = child;
        }
        return root;
    }
    
    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
    }
    
    // ==================== Metrics ====================
    
    public ResolutionMetrics metrics() {
        return new ResolutionMetrics(
            repository.countRequests(ResolutionRequest.PENDING),
            repository.countRequests(ResolutionRequest.APPROVED),
            repository.countRequests(ResolutionRequest.REJECTED),
            trendJpaRepository.countByResolved(false),
            trendJpaRepository.countByResolved(true),
            runJpaRepository.countByStatus(DriftScheduleRun.COMPLETED),
            runJpaRepository.countByStatus(DriftScheduleRun.FAILED)
        );
    }
}
