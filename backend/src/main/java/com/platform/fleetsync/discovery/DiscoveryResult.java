package com.platform.fleetsync.discovery;

import com.platform.fleetsync.device.Device;

import java.util.List;

/**
 * Outcome of one network scan.
 *
 * @param scanned hosts scanned
 * @param found   hosts that answered as a device
 * @param skipped devices that answered without a hardware address
 */
public record DiscoveryResult(
    String range,
    int scanned,
    int found,
    int created,
    int updated,
    int unchanged,
    int skipped,
    long durationMs,
    List<Device> devices
) {
}
