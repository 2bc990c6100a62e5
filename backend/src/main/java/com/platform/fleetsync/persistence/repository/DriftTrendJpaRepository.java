package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.DriftTrendEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DriftTrendJpaRepository extends JpaRepository<DriftTrendEntity, Long> {
    
    Optional<DriftTrendEntity> findFirstByDeviceIdAndPathAndResolvedFalse(Long deviceId, String path);
    
    /**
     * Trends ordered by last occurrence, with optional device and resolved filters.
     */
    @Query("SELECT t FROM DriftTrendEntity t " +
           "WHERE (:deviceId IS NULL OR t.deviceId = :deviceId) " +
           "AND (:resolved IS NULL OR t.resolved = :resolved) " +
           "ORDER BY t.lastSeen DESC, t.id DESC")
    List<DriftTrendEntity> findFiltered(
        @Param("deviceId") Long deviceId,
        @Param("resolved") Boolean resolved,
        Pageable pageable
    );
    
    long countByResolved(boolean resolved);
    
    void deleteByDeviceId(Long deviceId);
}
