package com.platform.fleetsync.resolution;

import com.platform.fleetsync.persistence.EntityMappers;
import com.platform.fleetsync.persistence.repository.ResolutionPolicyJpaRepository;
import com.platform.fleetsync.persistence.repository.ResolutionRequestJpaRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Repository for resolution policies and the requests they produce.
 */
@Component
public class ResolutionRepository {
    
    private final ResolutionPolicyJpaRepository policyJpaRepository;
    private final ResolutionRequestJpaRepository requestJpaRepository;
    private final EntityMappers entityMappers;
    
    public ResolutionRepository(
            ResolutionPolicyJpaRepository policyJpaRepository,
            ResolutionRequestJpaRepository requestJpaRepository,
            EntityMappers entityMappers) {
        this.policyJpaRepository = policyJpaRepository;
        this.requestJpaRepository = requestJpaRepository;
        this.entityMappers = entityMappers;
    }
    
    // ==================== Policies ====================
    
    public ResolutionPolicy savePolicy(ResolutionPolicy policy) {
        return entityMappers.toDomain(policyJpaRepository.save(entityMappers.toEntity(policy)));
    }
    
    public Optional<ResolutionPolicy> findPolicy(Long id) {
        return policyJpaRepository.findById(id).map(entityMappers::toDomain);
    }
    
    public List<ResolutionPolicy> findAllPolicies() {
        return policyJpaRepository.findAllByOrderByNameAsc().stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    public List<ResolutionPolicy> findEnabledPolicies(String category) {
        return policyJpaRepository.findByCategoryAndEnabledTrue(category).stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    public boolean policyNameExists(String name) {
        return policyJpaRepository.existsByName(name);
    }
    
    public boolean deletePolicy(Long id) {
        if (policyJpaRepository.existsById(id)) {
            policyJpaRepository.deleteById(id);
            return true;
        }
        return false;
    }
    
    // ==================== Requests ====================
    
    public ResolutionRequest saveRequest(ResolutionRequest request) {
        return entityMappers.toDomain(requestJpaRepository.save(entityMappers.toEntity(request)));
    }
    
    public Optional<ResolutionRequest> findRequest(Long id) {
        return requestJpaRepository.findById(id).map(entityMappers::toDomain);
    }
    
    public List<ResolutionRequest> findRequests(String status, Long deviceId, int limit) {
        return requestJpaRepository.findFiltered(status, deviceId, PageRequest.of(0, limit)).stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    public boolean hasPendingRequest(Long deviceId, String path) {
        return requestJpaRepository.existsByDeviceIdAndPathAndStatus(deviceId, path, ResolutionRequest.PENDING);
    }
    
    public long countRequests(String status) {
        return requestJpaRepository.countByStatus(status);
    }
}
