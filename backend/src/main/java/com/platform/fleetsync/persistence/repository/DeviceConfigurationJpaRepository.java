package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.DeviceConfigurationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DeviceConfigurationJpaRepository extends JpaRepository<DeviceConfigurationEntity, Long> {
    
    Optional<DeviceConfigurationEntity> findByDeviceId(Long deviceId);
    
    void deleteByDeviceId(Long deviceId);
}
