package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.ResolutionRequestEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResolutionRequestJpaRepository extends JpaRepository<ResolutionRequestEntity, Long> {
    
    boolean existsByDeviceIdAndPathAndStatus(Long deviceId, String path, String status);
    
    @Query("SELECT r FROM ResolutionRequestEntity r " +
           "WHERE (:status IS NULL OR r.status = :status) " +
           "AND (:deviceId IS NULL OR r.deviceId = :deviceId) " +
           "ORDER BY r.createdAt DESC, r.id DESC")
    List<ResolutionRequestEntity> findFiltered(
        @Param("status") String status,
        @Param("deviceId") Long deviceId,
        Pageable pageable
    );
    
    long countByStatus(String status);
    
    void deleteByDeviceId(Long deviceId);
}
