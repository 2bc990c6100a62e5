package com.platform.fleetsync.device;

import com.platform.fleetsync.persistence.EntityMappers;
import com.platform.fleetsync.persistence.entity.DeviceEntity;
import com.platform.fleetsync.persistence.repository.DeviceJpaRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Repository for devices.
 * Delegates to JPA repository for persistent storage.
 */
@Component
public class DeviceRepository {
    
    private final DeviceJpaRepository jpaRepository;
    private final EntityMappers entityMappers;
    
    public DeviceRepository(DeviceJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }
    
    public Device save(Device device) {
        DeviceEntity entity = entityMappers.toEntity(device);
        entity = jpaRepository.save(entity);
        return entityMappers.toDomain(entity);
    }
    
    public Optional<Device> findById(Long id) {
        return jpaRepository.findById(id)
            .map(entityMappers::toDomain);
    }
    
    public Optional<Device> findByMac(String mac) {
        return jpaRepository.findByMac(mac)
            .map(entityMappers::toDomain);
    }
    
    public Optional<Device> findByIp(String ip) {
        return jpaRepository.findByIp(ip)
            .map(entityMappers::toDomain);
    }
    
    /**
     * All devices ordered by id. A single malformed row fails the whole call;
     * use {@link #findAllIds()} with {@link #findById(Long)} to isolate rows.
     */
    public List<Device> findAll() {
        return jpaRepository.findAllByOrderByIdAsc().stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    public List<Long> findAllIds() {
        return jpaRepository.findAllIds();
    }
    
    public boolean deleteById(Long id) {
        if (jpaRepository.existsById(id)) {
            jpaRepository.deleteById(id);
            return true;
        }
        return false;
    }
    
    public boolean existsById(Long id) {
        return jpaRepository.existsById(id);
    }
    
    public long count() {
        return jpaRepository.count();
    }
    
    public long countBySyncStatus(String syncStatus) {
        return jpaRepository.countBySyncStatus(syncStatus);
    }
}
