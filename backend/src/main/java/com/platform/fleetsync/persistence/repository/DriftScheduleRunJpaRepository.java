package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.DriftScheduleRunEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DriftScheduleRunJpaRepository extends JpaRepository<DriftScheduleRunEntity, Long> {
    
    List<DriftScheduleRunEntity> findByScheduleIdOrderByStartedAtDescIdDesc(Long scheduleId, Pageable pageable);
    
    long countByStatus(String status);
    
    void deleteByScheduleId(Long scheduleId);
}
