package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.DeviceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DeviceJpaRepository extends JpaRepository<DeviceEntity, Long> {
    
    Optional<DeviceEntity> findByMac(String mac);
    
    Optional<DeviceEntity> findByIp(String ip);
    
    List<DeviceEntity> findAllByOrderByIdAsc();
    
    long countBySyncStatus(String syncStatus);
    
    @Query("SELECT d.id FROM DeviceEntity d ORDER BY d.id ASC")
    List<Long> findAllIds();
}
