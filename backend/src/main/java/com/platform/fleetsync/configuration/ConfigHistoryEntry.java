package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One audited configuration change. Secrets are masked before storage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigHistoryEntry {
    
    public static final String IMPORT = "import";
    public static final String EXPORT = "export";
    public static final String OVERRIDE = "override";
    public static final String TEMPLATE = "template";
    
    private Long id;
    private Long deviceId;
    private String action;
    private ObjectNode oldConfig;
    private ObjectNode newConfig;
    private String changedBy;
    private Instant createdAt;
}
