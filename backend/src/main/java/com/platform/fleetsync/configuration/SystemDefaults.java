package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Bottom layer of every desired configuration, loaded once from
 * {@code fleetsync.defaults.location}.
 */
@Slf4j
@Component
public class SystemDefaults {
    
    private final ObjectNode defaults;
    
    @Autowired
    public SystemDefaults(
            ObjectMapper objectMapper,
            ConfigurationCodec codec,
            @Value("${fleetsync.defaults.location:classpath:system-defaults.json}") Resource location) {
        this.defaults = load(objectMapper, location);
        codec.validate(defaults);
        log.info("Loaded system defaults from {} ({} groups)", location.getDescription(), defaults.size());
    }
    
    private SystemDefaults(ObjectNode defaults) {
        this.defaults = defaults.deepCopy();
    }
    
    public static SystemDefaults of(ObjectNode defaults) {
        return new SystemDefaults(defaults);
    }
    
    /**
     * A copy; callers may mutate it.
     */
    public ObjectNode get() {
        return defaults.deepCopy();
    }
    
    private static ObjectNode load(ObjectMapper objectMapper, Resource location) {
        if (!location.exists()) {
            log.warn("System defaults {} not found, using an empty baseline", location.getDescription());
            return objectMapper.createObjectNode();
        }
        try (InputStream in = location.getInputStream()) {
            JsonNode node = objectMapper.readTree(in);
            if (node == null || node.isMissingNode() || node.isNull()) {
                return objectMapper.createObjectNode();
            }
            if (!(node instanceof ObjectNode objectNode)) {
                throw ValidationException.configuration("defaults", "System defaults must be a JSON object");
            }
            return objectNode;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read system defaults from " + location.getDescription(), e);
        }
    }
}
