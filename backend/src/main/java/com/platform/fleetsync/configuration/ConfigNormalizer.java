package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.protocol.Generation;
import com.platform.fleetsync.protocol.gen1.Gen1SettingsMapper;
import com.platform.fleetsync.protocol.gen2.Gen2ConfigMapper;
import org.springframework.stereotype.Component;

/**
 * Brings a device's own configuration document into the canonical schema.
 */
@Component
public class ConfigNormalizer {
    
    public ObjectNode normalize(Generation generation, JsonNode deviceConfig) {
        return switch (generation) {
            case GEN1 -> Gen1SettingsMapper.toCanonical(deviceConfig);
            case GEN2 -> Gen2ConfigMapper.toCanonical(deviceConfig);
        };
    }
}
