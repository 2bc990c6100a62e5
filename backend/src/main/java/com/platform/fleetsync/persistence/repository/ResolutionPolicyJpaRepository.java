package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.ResolutionPolicyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResolutionPolicyJpaRepository extends JpaRepository<ResolutionPolicyEntity, Long> {
    
    boolean existsByName(String name);
    
    List<ResolutionPolicyEntity> findByCategoryAndEnabledTrue(String category);
    
    List<ResolutionPolicyEntity> findAllByOrderByNameAsc();
}
