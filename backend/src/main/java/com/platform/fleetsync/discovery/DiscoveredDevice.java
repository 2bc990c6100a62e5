package com.platform.fleetsync.discovery;

import com.platform.fleetsync.protocol.DeviceInfo;

import java.time.Instant;

/**
 * One device as observed by a scan.
 *
 * @param model         discovery-owned settings field
 * @param generation    protocol generation, discovery-owned
 * @param authEnabled   whether the device requires authentication, discovery-owned
 */
public record DiscoveredDevice(
    String ip,
    String mac,
    String type,
    String firmware,
    String status,
    Instant discoveredAt,
    String model,
    Integer generation,
    Boolean authEnabled
) {
    
    public static DiscoveredDevice from(DeviceInfo info, String ip, String status, Instant discoveredAt) {
        return new DiscoveredDevice(ip, info.getMac(), info.deviceType(), info.getFirmware(), status,
            discoveredAt, info.getModel() != null ? info.getModel() : info.getType(),
            info.getGeneration() > 0 ? info.getGeneration() : null, info.isAuthEnabled());
    }
}
