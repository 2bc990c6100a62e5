package com.platform.fleetsync.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity reported by a device. Gen1 devices report {@code type}, Gen2 devices {@code model}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceInfo {
    private String id;
    private String mac;
    private String model;
    private String type;
    private int generation;
    private String firmware;
    private String app;
    private boolean authEnabled;
    private String ip;
    
    /**
     * Model for Gen2, type for Gen1.
     */
    public String deviceType() {
        if (model != null && !model.isBlank()) {
            return model;
        }
        return type;
    }
}
