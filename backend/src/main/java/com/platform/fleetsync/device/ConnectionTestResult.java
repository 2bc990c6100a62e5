package com.platform.fleetsync.device;

/**
 * Outcome of an authenticated round trip to a device.
 */
public record ConnectionTestResult(
    Long deviceId,
    String ip,
    boolean success,
    int generation,
    long durationMs,
    String errorCode,
    String error
) {
}
