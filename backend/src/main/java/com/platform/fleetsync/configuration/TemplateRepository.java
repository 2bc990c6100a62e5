package com.platform.fleetsync.configuration;

import com.platform.fleetsync.persistence.EntityMappers;
import com.platform.fleetsync.persistence.entity.ConfigTemplateEntity;
import com.platform.fleetsync.persistence.repository.ConfigTemplateJpaRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Repository for configuration templates.
 */
@Component
public class TemplateRepository {
    
    private final ConfigTemplateJpaRepository jpaRepository;
    private final EntityMappers entityMappers;
    
    public TemplateRepository(ConfigTemplateJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }
    
    public ConfigTemplate save(ConfigTemplate template) {
        ConfigTemplateEntity entity = entityMappers.toEntity(template);
        entity = jpaRepository.save(entity);
        return entityMappers.toDomain(entity);
    }
    
    public Optional<ConfigTemplate> findById(Long id) {
        return jpaRepository.findById(id)
            .map(entityMappers::toDomain);
    }
    
    public Optional<ConfigTemplate> findByName(String name) {
        return jpaRepository.findByName(name)
            .map(entityMappers::toDomain);
    }
    
    public List<ConfigTemplate> findAll() {
        return jpaRepository.findForDeviceType(null).stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    /**
     * Templates usable for a device type: exact match or "all".
     */
    public List<ConfigTemplate> findForDeviceType(String deviceType) {
        return jpaRepository.findForDeviceType(deviceType).stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    public boolean existsByName(String name) {
        return jpaRepository.existsByName(name);
    }
    
    public boolean deleteById(Long id) {
        if (jpaRepository.existsById(id)) {
            jpaRepository.deleteById(id);
            return true;
        }
        return false;
    }
}
