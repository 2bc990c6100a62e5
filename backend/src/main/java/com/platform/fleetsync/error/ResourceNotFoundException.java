package com.platform.fleetsync.error;

/**
 * Exception for unknown device, template, schedule or trend ids.
 */
public class ResourceNotFoundException extends FleetSyncException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(String resourceType, Object resourceId) {
        this(ErrorCode.RESOURCE_NOT_FOUND, resourceType, resourceId);
    }
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, Object resourceId) {
        super(errorCode, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
    }
    
    public static ResourceNotFoundException device(Long deviceId) {
        return new ResourceNotFoundException(ErrorCode.DEVICE_NOT_FOUND, "Device", deviceId);
    }
    
    public static ResourceNotFoundException template(Long templateId) {
        return new ResourceNotFoundException(ErrorCode.TEMPLATE_NOT_FOUND, "ConfigTemplate", templateId);
    }
    
    public static ResourceNotFoundException schedule(Long scheduleId) {
        return new ResourceNotFoundException(ErrorCode.SCHEDULE_NOT_FOUND, "DriftSchedule", scheduleId);
    }
    
    public static ResourceNotFoundException trend(Long trendId) {
        return new ResourceNotFoundException(ErrorCode.TREND_NOT_FOUND, "DriftTrend", trendId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
