package com.platform.fleetsync.observability;

/**
 * Event types emitted by {@link StructuredLogger}.
 */
public enum LogEventType {
    
    // Device
    DEVICE_CALL_FAILED,
    DEVICE_ADDED,
    DEVICE_REMOVED,
    DEVICE_CONFIG_APPLIED,
    
    // Credentials
    CREDENTIAL_TRANSITION,
    CREDENTIAL_FALLBACK_PERSISTED,
    CREDENTIAL_RECOVERY_FAILED,
    
    // Drift
    DRIFT_DETECTED,
    DRIFT_BULK_COMPLETED,
    DRIFT_SCHEDULE_RUN,
    
    // Configuration
    CONFIG_DESIRED_CHANGED,
    CONFIG_TEMPLATE_CHANGED,
    
    // Discovery
    DISCOVERY_DEVICE_CREATED,
    DISCOVERY_DEVICE_UPDATED,
    DISCOVERY_SCAN_COMPLETED
}
