package com.platform.fleetsync.schedule;

import com.platform.fleetsync.persistence.EntityMappers;
import com.platform.fleetsync.persistence.repository.DriftScheduleJpaRepository;
import com.platform.fleetsync.persistence.repository.DriftScheduleRunJpaRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for drift schedules and their run history.
 */
@Component
public class DriftScheduleRepository {
    
    private final DriftScheduleJpaRepository scheduleJpaRepository;
    private final DriftScheduleRunJpaRepository runJpaRepository;
    private final EntityMappers entityMappers;
    
    public DriftScheduleRepository(
            DriftScheduleJpaRepository scheduleJpaRepository,
            DriftScheduleRunJpaRepository runJpaRepository,
            EntityMappers entityMappers) {
        this.scheduleJpaRepository = scheduleJpaRepository;
        this.runJpaRepository = runJpaRepository;
        this.entityMappers = entityMappers;
    }
    
    public DriftSchedule save(DriftSchedule schedule) {
        return entityMappers.toDomain(scheduleJpaRepository.save(entityMappers.toEntity(schedule)));
    }
    
    public Optional<DriftSchedule> findById(Long id) {
        return scheduleJpaRepository.findById(id).map(entityMappers::toDomain);
    }
    
    public List<DriftSchedule> findAll() {
        return scheduleJpaRepository.findAll().stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    /**
     * Enabled schedules whose next run is at or before {@code now}, earliest first.
     */
    public List<DriftSchedule> findDue(Instant now) {
        return scheduleJpaRepository.findByEnabledTrueAndNextRunLessThanEqualOrderByNextRunAsc(now).stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    public boolean existsByName(String name) {
        return scheduleJpaRepository.existsByName(name);
    }
    
    /**
     * Delete a schedule together with its run history.
     */
    @Transactional
    public boolean deleteById(Long id) {
        if (!scheduleJpaRepository.existsById(id)) {
            return false;
        }
        runJpaRepository.deleteByScheduleId(id);
        scheduleJpaRepository.deleteById(id);
        return true;
    }
    
    // ==================== Runs ====================
    
    public DriftScheduleRun saveRun(DriftScheduleRun run) {
        return entityMappers.toDomain(runJpaRepository.save(entityMappers.toEntity(run)));
    }
    
    public List<DriftScheduleRun> findRuns(Long scheduleId, int limit) {
        return runJpaRepository.findByScheduleIdOrderByStartedAtDescIdDesc(scheduleId, PageRequest.of(0, limit)).stream()
            .map(entityMappers::toDomain)
            .toList();
    }
}
