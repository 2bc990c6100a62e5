package com.platform.fleetsync.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.api.validation.SafeText;
import jakarta.validation.constraints.*;
import lombok.Data;

import java.util.List;

/**
 * Validated request bodies for the HTTP API.
 */
public class ApiRequests {
    
    private static final String IPV4 =
        "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$";
    
    // ==================== Devices ====================
    
    @Data
    public static class AddDeviceRequest {
        
        @NotBlank(message = "IP address is required")
        @Pattern(regexp = IPV4, message = "Invalid IPv4 address")
        private String ip;
        
        @SafeText(maxLength = 64)
        private String name;
    }
    
    @Data
    public static class RenameDeviceRequest {
        
        @NotBlank(message = "Name is required")
        @SafeText(maxLength = 64)
        private String name;
    }
    
    @Data
    public static class ControlRequest {
        
        @NotBlank(message = "Action is required")
        @Pattern(regexp = "^(on|off|toggle|reboot)$", message = "Action must be on, off, toggle or reboot")
        private String action;
        
        @Pattern(regexp = "^(switch|light|cover)$", message = "Component must be switch, light or cover")
        private String component = "switch";
        
        @Min(value = 0, message = "Channel must be non-negative")
        @Max(value = 15, message = "Channel cannot exceed 15")
        private int channel = 0;
    }
    
    @Data
    public static class ComponentStateRequest {
        
        @NotBlank(message = "Value is required")
        @Size(max = 16, message = "Value too long")
        private String value;
    }
    
    @Data
    public static class CredentialRequest {
        
        @NotBlank(message = "Username is required")
        @Size(max = 64, message = "Username cannot exceed 64 characters")
        @SafeText(maxLength = 64)
        private String username;
        
        @NotBlank(message = "Password is required")
        @Size(max = 128, message = "Password cannot exceed 128 characters")
        private String password;
    }
    
    // ==================== Configuration ====================
    
    @Data
    public static class TemplateRequest {
        
        @NotBlank(message = "Template name is required")
        @Size(min = 1, max = 100, message = "Name must be 1-100 characters")
        @SafeText(maxLength = 100)
        private String name;
        
        @SafeText(maxLength = 500, allowNewlines = true)
        private String description;
        
        @Pattern(regexp = "^(global|group|device_type)$", message = "Scope must be global, group or device_type")
        private String scope;
        
        @Size(max = 64, message = "Device type cannot exceed 64 characters")
        private String deviceType;
        
        private ObjectNode config;
    }
    
    @Data
    public static class TemplateOrderRequest {
        
        @NotNull(message = "Template ids are required")
        private List<@NotNull @Positive Long> templateIds;
    }
    
    // ==================== Drift ====================
    
    @Data
    public static class BulkDriftRequest {
        
        /**
         * Null or empty checks every device.
         */
        private List<@NotNull @Positive Long> deviceIds;
    }
    
    @Data
    public static class ScheduleRequest {
        
        @NotBlank(message = "Schedule name is required")
        @Size(max = 100, message = "Name cannot exceed 100 characters")
        @SafeText(maxLength = 100)
        private String name;
        
        @SafeText(maxLength = 500, allowNewlines = true)
        private String description;
        
        private Boolean enabled;
        
        @NotNull(message = "Interval is required")
        @Positive(message = "Interval must be positive")
        private Long intervalSeconds;
        
        private List<@NotNull @Positive Long> deviceIds;
    }
    
    // ==================== Discovery ====================
    
    @Data
    public static class DiscoveryRequest {
        
        @NotBlank(message = "Network range is required")
        @Pattern(regexp = "^[0-9./\\-\\s]{7,40}$", message = "Invalid network range format")
        private String range;
    }
    
    // ==================== Resolution ====================
    
    @Data
    public static class PolicyRequest {
        
        @NotBlank(message = "Policy name is required")
        @Size(max = 100, message = "Name cannot exceed 100 characters")
        @SafeText(maxLength = 100)
        private String name;
        
        @NotBlank(message = "Category is required")
        @Pattern(regexp = "^(network|security|system|device)$", message = "Invalid category")
        private String category;
        
        @NotBlank(message = "Strategy is required")
        @Pattern(regexp = "^(restore|update|ignore)$", message = "Strategy must be restore, update or ignore")
        private String strategy;
        
        private Boolean enabled;
        
        @Pattern(regexp = "^(low|medium|high|critical)$", message = "Invalid priority")
        private String priority;
        
        @SafeText(maxLength = 500, allowNewlines = true)
        private String description;
    }
    
    @Data
    public static class DecisionRequest {
        
        @SafeText(maxLength = 500, allowNewlines = true)
        private String reason;
    }
}
