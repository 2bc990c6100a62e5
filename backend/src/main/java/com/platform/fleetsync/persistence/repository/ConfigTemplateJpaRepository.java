package com.platform.fleetsync.persistence.repository;

import com.platform.fleetsync.persistence.entity.ConfigTemplateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConfigTemplateJpaRepository extends JpaRepository<ConfigTemplateEntity, Long> {
    
    Optional<ConfigTemplateEntity> findByName(String name);
    
    boolean existsByName(String name);
    
    /**
     * Templates usable for a device type: exact match or "all". A null type returns every template.
     */
    @Query("SELECT t FROM ConfigTemplateEntity t " +
           "WHERE (:deviceType IS NULL OR t.deviceType = 'all' OR LOWER(t.deviceType) = LOWER(:deviceType)) " +
           "ORDER BY t.name ASC")
    List<ConfigTemplateEntity> findForDeviceType(@Param("deviceType") String deviceType);
}
