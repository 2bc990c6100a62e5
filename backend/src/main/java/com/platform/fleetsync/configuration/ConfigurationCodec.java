package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.configuration.capability.ConfigSection;
import com.platform.fleetsync.error.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads and validates canonical configuration documents against the typed
 * capability groups. Documents stay {@link ObjectNode}s everywhere else; the
 * typed view exists for validation and group-level access.
 */
@Slf4j
@Component
public class ConfigurationCodec {
    
    private final ObjectMapper objectMapper;
    private final Validator validator;
    
    public ConfigurationCodec(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }
    
    /**
     * Validate every group of a canonical document.
     * 
     * @throws ValidationException naming the first offending path
     */
    public void validate(ObjectNode config) {
        if (config == null) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = config.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!CapabilityGroup.isKnown(entry.getKey())) {
                throw ValidationException.configuration(entry.getKey(),
                    "Unknown configuration group '" + entry.getKey() + "'");
            }
            if (entry.getValue().isNull()) {
                continue;
            }
            readGroup(CapabilityGroup.fromKey(entry.getKey()), entry.getValue());
        }
    }
    
    /**
     * Typed, validated view of one group; null when the document does not set it.
     */
    public <T extends ConfigSection> T readGroup(ObjectNode config, CapabilityGroup group, Class<T> type) {
        JsonNode node = config == null ? null : config.get(group.getKey());
        if (node == null || node.isNull()) {
            return null;
        }
        return type.cast(readGroup(group, node));
    }
    
    public ConfigSection readGroup(CapabilityGroup group, JsonNode node) {
        if (!node.isObject()) {
            throw ValidationException.configuration(group.getKey(),
                "Configuration group '" + group.getKey() + "' must be an object");
        }
        ConfigSection section;
        try {
            section = objectMapper.treeToValue(node, group.getType());
        } catch (JsonProcessingException e) {
            throw ValidationException.configuration(group.getKey(),
                "Invalid '" + group.getKey() + "' configuration: " + e.getOriginalMessage());
        }
        
        Set<ConstraintViolation<ConfigSection>> violations = validator.validate(section);
        if (!violations.isEmpty()) {
            ConstraintViolation<ConfigSection> first = violations.stream()
                .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .orElseThrow();
            String path = group.getKey() + "." + toSchemaPath(first.getPropertyPath().toString());
            log.debug("Rejected configuration at {}: {} ({} violations)", path, first.getMessage(), violations.size());
            throw new ValidationException(path, first.getInvalidValue(), path + ": " + first.getMessage());
        }
        return section;
    }
    
    /**
     * {@code relays[0].defaultState} becomes {@code relays.0.default_state}.
     */
    static String toSchemaPath(String propertyPath) {
        return propertyPath
            .replaceAll("\\[(\\d+)]", ".$1")
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .toLowerCase(Locale.ROOT);
    }
}
