package com.platform.fleetsync.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for device, credential, configuration, drift and discovery events.
 * 
 * All events are JSON-formatted and machine-parsable. Callers never pass
 * credential material; only device identity and outcome.
 */
@Component
public class StructuredLogger {
    
    @Value("${spring.application.name:device-fleet-sync}")
    private String serviceName;
    
    @Value("${fleetsync.environment:development}")
    private String environment;
    
    public DeviceLogger device() {
        return new DeviceLogger(serviceName, environment);
    }
    
    public CredentialLogger credential() {
        return new CredentialLogger(serviceName, environment);
    }
    
    public ConfigurationLogger configuration() {
        return new ConfigurationLogger(serviceName, environment);
    }
    
    public DriftLogger drift() {
        return new DriftLogger(serviceName, environment);
    }
    
    public DiscoveryLogger discovery() {
        return new DiscoveryLogger(serviceName, environment);
    }
    
    // ==================== DEVICE LOGGER ====================
    
    public static class DeviceLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.device");
        private final String service;
        private final String environment;
        
        DeviceLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void callFailed(Long deviceId, String deviceIp, int generation, String operation,
                String errorCode, String errorMessage, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DEVICE_CALL_FAILED, "WARN")
                .deviceId(deviceId)
                .deviceIp(deviceIp)
                .generation(generation)
                .operation(operation)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .durationMs(durationMs)
                .build();
            log.warn(event.toJson());
        }
        
        public void added(Long deviceId, String deviceIp, int generation) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DEVICE_ADDED, "INFO")
                .deviceId(deviceId)
                .deviceIp(deviceIp)
                .generation(generation)
                .build();
            log.info(event.toJson());
        }
        
        public void removed(Long deviceId, String deviceIp) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DEVICE_REMOVED, "INFO")
                .deviceId(deviceId)
                .deviceIp(deviceIp)
                .build();
            log.info(event.toJson());
        }
        
        public void configApplied(Long deviceId, String deviceIp, String source, int groups) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DEVICE_CONFIG_APPLIED, "INFO")
                .deviceId(deviceId)
                .deviceIp(deviceIp)
                .operation("apply_configuration")
                .success(true)
                .context(Map.of("source", source, "groups", groups))
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== CREDENTIAL LOGGER ====================
    
    public static class CredentialLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.credential");
        private final String service;
        private final String environment;
        
        CredentialLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void transition(Long deviceId, String deviceIp, String fromState, String toState) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.CREDENTIAL_TRANSITION, "INFO")
                .deviceId(deviceId)
                .deviceIp(deviceIp)
                .context(Map.of("from", fromState, "to", toState))
                .build();
            log.info(event.toJson());
        }
        
        public void fallbackPersisted(Long deviceId, String deviceIp) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.CREDENTIAL_FALLBACK_PERSISTED, "INFO")
                .deviceId(deviceId)
                .deviceIp(deviceIp)
                .success(true)
                .build();
            log.info(event.toJson());
        }
        
        public void recoveryFailed(Long deviceId, String deviceIp, int attempts, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.CREDENTIAL_RECOVERY_FAILED, "WARN")
                .deviceId(deviceId)
                .deviceIp(deviceIp)
                .success(false)
                .errorMessage(errorMessage)
                .context(Map.of("attempts", attempts))
                .build();
            log.warn(event.toJson());
        }
    }
    
    // ==================== DRIFT LOGGER ====================
    
    public static class DriftLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.drift");
        private final String service;
        private final String environment;
        
        DriftLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void detected(Long deviceId, String deviceIp, int differences) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DRIFT_DETECTED, "INFO")
                .deviceId(deviceId)
                .deviceIp(deviceIp)
                .context(Map.of("differences", differences))
                .build();
            log.info(event.toJson());
        }
        
        public void bulkCompleted(int total, int inSync, int drifted, int errors, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DRIFT_BULK_COMPLETED, "INFO")
                .durationMs(durationMs)
                .context(Map.of("total", total, "in_sync", inSync, "drifted", drifted, "errors", errors))
                .build();
            log.info(event.toJson());
        }
        
        public void scheduleRun(Long scheduleId, String status, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DRIFT_SCHEDULE_RUN, "INFO")
                .success("completed".equals(status))
                .durationMs(durationMs)
                .context(Map.of("schedule_id", scheduleId, "status", status))
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== CONFIGURATION LOGGER ====================
    
    public static class ConfigurationLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.configuration");
        private final String service;
        private final String environment;
        
        ConfigurationLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void desiredChanged(Long deviceId, String action, String actor, int groups) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.CONFIG_DESIRED_CHANGED, "INFO")
                .deviceId(deviceId)
                .actor(actor)
                .operation(action)
                .context(Map.of("groups", groups))
                .build();
            log.info(event.toJson());
        }
        
        public void templateChanged(Long templateId, String name, String actor, int affectedDevices) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.CONFIG_TEMPLATE_CHANGED, "INFO")
                .actor(actor)
                .context(Map.of("template_id", templateId, "name", name, "affected_devices", affectedDevices))
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== DISCOVERY LOGGER ====================
    
    public static class DiscoveryLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.discovery");
        private final String service;
        private final String environment;
        
        DiscoveryLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void deviceCreated(Long deviceId, String mac, String ip) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DISCOVERY_DEVICE_CREATED, "INFO")
                .deviceId(deviceId)
                .mac(mac)
                .deviceIp(ip)
                .build();
            log.info(event.toJson());
        }
        
        public void deviceUpdated(Long deviceId, String mac, String ip, String previousIp) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DISCOVERY_DEVICE_UPDATED, "INFO")
                .deviceId(deviceId)
                .mac(mac)
                .deviceIp(ip)
                .context(Map.of("previous_ip", previousIp == null ? "" : previousIp))
                .build();
            log.info(event.toJson());
        }
        
        public void scanCompleted(String range, int scanned, int found, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DISCOVERY_SCAN_COMPLETED, "INFO")
                .durationMs(durationMs)
                .context(Map.of("range", range, "scanned", scanned, "found", found))
                .build();
            log.info(event.toJson());
        }
    }
}
