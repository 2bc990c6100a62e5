package com.platform.fleetsync.drift;

import com.platform.fleetsync.error.ResourceNotFoundException;
import com.platform.fleetsync.persistence.EntityMappers;
import com.platform.fleetsync.persistence.entity.DriftTrendEntity;
import com.platform.fleetsync.persistence.repository.DriftTrendJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Links repeated drift of the same field on the same device across checks.
 * 
 * One open trend exists per (device, path). Each recurrence bumps its
 * occurrence count and refreshes severity. Once resolved, a later recurrence
 * opens a new trend.
 */
@Slf4j
@Service
public class DriftTrendService {
    
    private final DriftTrendJpaRepository jpaRepository;
    private final EntityMappers entityMappers;
    
    public DriftTrendService(DriftTrendJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }
    
    /**
     * Record every drifted field of one check. Extra fields do not open trends.
     *
     * @return number of trends touched
     */
    public int record(Long deviceId, List<FieldDelta> deltas, Instant seenAt) {
        int touched = 0;
        for (FieldDelta delta : deltas) {
            if (!delta.kind().isDrift()) {
                continue;
            }
            Optional<DriftTrendEntity> open = jpaRepository.findFirstByDeviceIdAndPathAndResolvedFalse(deviceId, delta.path());
            DriftTrendEntity entity;
            if (open.isPresent()) {
                entity = open.get();
                entity.setOccurrences(entity.getOccurrences() + 1);
                entity.setLastSeen(seenAt);
                entity.setSeverity(delta.severity());
                entity.setCategory(delta.category());
            } else {
                entity = entityMappers.toEntity(DriftTrend.builder()
                    .deviceId(deviceId)
                    .path(delta.path())
                    .category(delta.category())
                    .severity(delta.severity())
                    .occurrences(1)
                    .firstSeen(seenAt)
                    .lastSeen(seenAt)
                    .build());
            }
            jpaRepository.save(entity);
            touched++;
        }
        return touched;
    }
    
    public DriftTrend markResolved(Long trendId) {
        DriftTrendEntity entity = jpaRepository.findById(trendId)
            .orElseThrow(() -> ResourceNotFoundException.trend(trendId));
        if (entity.isResolved()) {
            return entityMappers.toDomain(entity);
        }
        entity.setResolved(true);
        entity.setResolvedAt(Instant.now());
        DriftTrend resolved = entityMappers.toDomain(jpaRepository.save(entity));
        log.info("Drift trend {} resolved (device {}, path {}, {} occurrences)",
            trendId, resolved.getDeviceId(), resolved.getPath(), resolved.getOccurrences());
        return resolved;
    }
    
    /**
     * Trends by most recent occurrence. Null filters match everything.
     */
    public List<DriftTrend> query(Long deviceId, Boolean resolved, int limit) {
        return jpaRepository.findFiltered(deviceId, resolved, PageRequest.of(0, limit)).stream()
            .map(entityMappers::toDomain)
            .toList();
    }
}
