package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last configuration imported from or exported to a device, canonical schema.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredConfiguration {
    
    private Long id;
    private Long deviceId;
    private ObjectNode config;
    private Instant lastSynced;
    private Instant updatedAt;
}
