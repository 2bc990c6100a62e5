package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.DriftScheduleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DriftScheduleJpaRepository extends JpaRepository<DriftScheduleEntity, Long> {
    
    boolean existsByName(String name);
    
    /**
     * Enabled schedules whose next run is due.
     */
    List<DriftScheduleEntity> findByEnabledTrueAndNextRunLessThanEqualOrderByNextRunAsc(Instant now);
    
}
