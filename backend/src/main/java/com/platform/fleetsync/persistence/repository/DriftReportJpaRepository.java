package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.DriftReportEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DriftReportJpaRepository extends JpaRepository<DriftReportEntity, Long> {
    
    /**
     * Newest reports first, optionally for one device.
     */
    @Query("SELECT r FROM DriftReportEntity r " +
           "WHERE (:deviceId IS NULL OR r.deviceId = :deviceId) " +
           "ORDER BY r.checkedAt DESC, r.id DESC")
    List<DriftReportEntity> findFiltered(@Param("deviceId") Long deviceId, Pageable pageable);
    
    void deleteByDeviceId(Long deviceId);
}
