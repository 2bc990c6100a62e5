package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.ConfigHistoryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Configuration audit trail.
 */
@Repository
public interface ConfigHistoryJpaRepository extends JpaRepository<ConfigHistoryEntity, Long> {
    
    List<ConfigHistoryEntity> findByDeviceIdOrderByCreatedAtDescIdDesc(Long deviceId, Pageable pageable);
    
    void deleteByDeviceId(Long deviceId);
}
