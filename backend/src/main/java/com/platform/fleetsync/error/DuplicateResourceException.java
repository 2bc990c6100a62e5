package com.platform.fleetsync.error;

/**
 * Exception for unique-name collisions (template names, schedule names).
 */
public class DuplicateResourceException extends FleetSyncException {
    
    private final String resourceType;
    private final String name;
    
    public DuplicateResourceException(String resourceType, String name) {
        super(ErrorCode.DUPLICATE_RESOURCE, String.format("%s already exists: %s", resourceType, name));
        this.resourceType = resourceType;
        this.name = name;
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getName() {
        return name;
    }
}
