package com.platform.fleetsync.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log event schema.
 * 
 * Mandatory fields:
 * - timestamp (RFC3339)
 * - level
 * - service
 * - event_type
 * 
 * correlation_id is copied from MDC when a request is in flight.
 * Credentials never appear in any field.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {
    
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    
    private String timestamp;
    private String level;
    private String service;
    private String environment;
    private LogEventType eventType;
    
    private String correlationId;
    
    /**
     * Who triggered the change, for configuration events.
     */
    private String actor;
    
    private Long deviceId;
    private String deviceIp;
    private String mac;
    private Integer generation;
    private String operation;
    private Boolean success;
    private Long durationMs;
    private String errorCode;
    private String errorMessage;
    private String message;
    
    private Map<String, Object> context;
    
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return String.format("{\"event_type\":\"%s\",\"message\":\"%s\",\"error\":\"serialization_failed\"}",
                eventType, message);
        }
    }
    
    public static StructuredLogEventBuilder fromContext(
            String service, String environment, LogEventType eventType, String level) {
        
        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .environment(environment)
            .eventType(eventType)
            .correlationId(MDC.get("correlationId"));
    }
}
