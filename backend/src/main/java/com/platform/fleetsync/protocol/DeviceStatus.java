package com.platform.fleetsync.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Live operational status of a device, with the raw payload kept for device-specific fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatus {
    private String ip;
    private int generation;
    private Long uptimeSeconds;
    private Double temperature;
    private boolean wifiConnected;
    private String wifiSsid;
    private Integer wifiRssi;
    
    @Builder.Default
    private List<SwitchState> switches = new ArrayList<>();
    
    private JsonNode raw;
    
    public record SwitchState(int id, boolean output, Double power) {
    }
}
